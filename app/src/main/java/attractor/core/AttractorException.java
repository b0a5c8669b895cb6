package attractor.core;

/** Base type for failures raised while building an attractor. */
public class AttractorException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public AttractorException(String message) {
    super(message);
  }

  public AttractorException(String message, Throwable cause) {
    super(message, cause);
  }
}
