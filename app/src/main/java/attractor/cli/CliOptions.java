package attractor.cli;

import attractor.algebra.Simplification;
import attractor.closure.ClosureDefaults;
import attractor.core.Predicate;
import java.nio.file.Path;

record CliOptions(
    String predicate,
    int depth,
    int maxSetSize,
    Simplification simplification,
    boolean parallel,
    boolean validate,
    boolean verbose,
    boolean json,
    boolean initial,
    int steps,
    Path output) {

  static final String DEFAULT_PREDICATE = "X";
  static final int DEFAULT_STEPS = 10;

  CliOptions {
    Predicate.of(predicate);
    simplification = simplification == null ? Simplification.STRUCTURAL : simplification;
    if (depth < 0) {
      throw new IllegalArgumentException("--depth must be non-negative");
    }
    if (maxSetSize <= 0) {
      throw new IllegalArgumentException("--max-size must be positive");
    }
    if (steps < 0) {
      throw new IllegalArgumentException("--steps must be non-negative");
    }
  }

  boolean hasOutput() {
    return output != null;
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private String predicate = DEFAULT_PREDICATE;
    private int depth = ClosureDefaults.MAX_DEPTH;
    private int maxSetSize = ClosureDefaults.MAX_SET_SIZE;
    private Simplification simplification = Simplification.STRUCTURAL;
    private boolean parallel;
    private boolean validate;
    private boolean verbose;
    private boolean json;
    private boolean initial = true;
    private int steps = DEFAULT_STEPS;
    private Path output;

    Builder predicate(String predicate) {
      this.predicate = predicate;
      return this;
    }

    Builder depth(int depth) {
      this.depth = depth;
      return this;
    }

    Builder maxSetSize(int maxSetSize) {
      this.maxSetSize = maxSetSize;
      return this;
    }

    Builder simplification(Simplification simplification) {
      this.simplification = simplification;
      return this;
    }

    Builder parallel(boolean parallel) {
      this.parallel = parallel;
      return this;
    }

    Builder validate(boolean validate) {
      this.validate = validate;
      return this;
    }

    Builder verbose(boolean verbose) {
      this.verbose = verbose;
      return this;
    }

    Builder json(boolean json) {
      this.json = json;
      return this;
    }

    Builder initial(boolean initial) {
      this.initial = initial;
      return this;
    }

    Builder steps(int steps) {
      this.steps = steps;
      return this;
    }

    Builder output(Path output) {
      this.output = output;
      return this;
    }

    CliOptions build() {
      return new CliOptions(
          predicate,
          depth,
          maxSetSize,
          simplification,
          parallel,
          validate,
          verbose,
          json,
          initial,
          steps,
          output);
    }
  }
}
