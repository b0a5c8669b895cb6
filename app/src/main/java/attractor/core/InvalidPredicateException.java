package attractor.core;

/** Raised when a predicate name does not satisfy the identifier grammar or is reserved. */
public final class InvalidPredicateException extends AttractorException {
  private static final long serialVersionUID = 1L;

  private final String name;

  public InvalidPredicateException(String name, String message) {
    super(message);
    this.name = name;
  }

  /** The rejected name, exactly as supplied. */
  public String name() {
    return name;
  }
}
