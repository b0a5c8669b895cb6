package attractor.core;

import java.util.Locale;

/**
 * Resource-exhaustion failure: the closure would grow past its size bound, or the requested depth
 * is above the configured ceiling. Carries the values needed to reproduce the failure.
 */
public final class DepthLimitException extends AttractorException {
  private static final long serialVersionUID = 1L;

  private final String seed;
  private final int generation;
  private final long attempted;
  private final long bound;

  private DepthLimitException(
      String message, String seed, int generation, long attempted, long bound) {
    super(message);
    this.seed = seed;
    this.generation = generation;
    this.attempted = attempted;
    this.bound = bound;
  }

  public static DepthLimitException setSizeExceeded(
      String seed, int generation, long attemptedSize, long maxSetSize) {
    return new DepthLimitException(
        String.format(
            Locale.ROOT,
            "Closure of '%s' exceeded max set size %d at generation %d (attempted %d expressions)",
            seed,
            maxSetSize,
            generation,
            attemptedSize),
        seed,
        generation,
        attemptedSize,
        maxSetSize);
  }

  public static DepthLimitException depthCeilingExceeded(
      String seed, int requestedDepth, int ceiling) {
    return new DepthLimitException(
        String.format(
            Locale.ROOT,
            "Requested depth %d for '%s' exceeds maximum allowed depth %d",
            requestedDepth,
            seed,
            ceiling),
        seed,
        -1,
        requestedDepth,
        ceiling);
  }

  public String seed() {
    return seed;
  }

  /** Generation being built when the bound tripped; -1 when rejected before generation work. */
  public int generation() {
    return generation;
  }

  /** Set size (or depth) that was attempted. */
  public long attempted() {
    return attempted;
  }

  public long bound() {
    return bound;
  }
}
