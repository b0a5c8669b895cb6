package attractor.closure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared constants for closure builds. The depth ceiling can be raised through the system property
 * {@code attractor.maxDepthCeiling} or the environment variable {@code
 * ATTRACTOR_MAX_DEPTH_CEILING}.
 */
public final class ClosureDefaults {
  private static final Logger LOG = LoggerFactory.getLogger(ClosureDefaults.class);
  private static final String DEPTH_CEILING_PROPERTY = "attractor.maxDepthCeiling";
  private static final String DEPTH_CEILING_ENV = "ATTRACTOR_MAX_DEPTH_CEILING";

  private ClosureDefaults() {}

  public static final int MAX_DEPTH = 2;

  public static final int MAX_SET_SIZE = 10_000;

  public static final int DEPTH_CEILING = 64;

  /** Frontier size below which a parallel build still expands on the calling thread. */
  public static final int PARALLEL_THRESHOLD = 64;

  public static int maxDepthCeiling() {
    Integer fromProperty = parsePositive(System.getProperty(DEPTH_CEILING_PROPERTY));
    if (fromProperty != null) {
      return fromProperty;
    }
    Integer fromEnv = parsePositive(System.getenv(DEPTH_CEILING_ENV));
    return fromEnv != null ? fromEnv : DEPTH_CEILING;
  }

  private static Integer parsePositive(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      int value = Integer.parseInt(raw.trim());
      return value > 0 ? value : null;
    } catch (NumberFormatException ex) {
      LOG.warn("Ignoring non-numeric depth ceiling override '{}'", raw);
      return null;
    }
  }
}
