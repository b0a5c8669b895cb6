package attractor.closure;

import attractor.algebra.Simplification;

/** Bounds and mode for a single closure build. */
public record ClosureOptions(
    int maxDepth,
    int maxSetSize,
    Simplification simplification,
    boolean parallel,
    int parallelism) {

  public ClosureOptions {
    if (maxDepth < 0) {
      throw new IllegalArgumentException("maxDepth must be non-negative, got " + maxDepth);
    }
    if (maxSetSize <= 0) {
      throw new IllegalArgumentException("maxSetSize must be positive, got " + maxSetSize);
    }
    simplification = simplification != null ? simplification : Simplification.STRUCTURAL;
    parallelism = parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
  }

  public static ClosureOptions defaults() {
    return of(ClosureDefaults.MAX_DEPTH, ClosureDefaults.MAX_SET_SIZE);
  }

  public static ClosureOptions of(int maxDepth, int maxSetSize) {
    return new ClosureOptions(maxDepth, maxSetSize, Simplification.STRUCTURAL, false, 0);
  }

  public ClosureOptions withSimplification(Simplification mode) {
    return new ClosureOptions(maxDepth, maxSetSize, mode, parallel, parallelism);
  }

  public ClosureOptions withParallel(boolean enabled) {
    return new ClosureOptions(maxDepth, maxSetSize, simplification, enabled, parallelism);
  }

  public ClosureOptions withParallelism(int workers) {
    return new ClosureOptions(maxDepth, maxSetSize, simplification, true, workers);
  }
}
