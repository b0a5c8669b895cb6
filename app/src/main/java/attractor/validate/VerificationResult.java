package attractor.validate;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link VerificationSuite#run}.
 *
 * @param sweep set size observed at each depth of the convergence sweep
 * @param convergenceDepth first depth whose size equals the previous depth's, or null
 * @param contradictionPreserved whether {@code P ∧ ¬P} is a member at the preservation depth
 * @param oscillationPeriod period found over the stability run, or null
 * @param oscillationStable whether the oscillator kept period two
 * @param oscillationEntropyBits entropy of the long oscillation run
 */
public record VerificationResult(
    String seed,
    List<DepthSample> sweep,
    Integer convergenceDepth,
    boolean contradictionPreserved,
    Integer oscillationPeriod,
    boolean oscillationStable,
    double oscillationEntropyBits) {

  public VerificationResult {
    Objects.requireNonNull(seed, "seed");
    sweep = List.copyOf(Objects.requireNonNull(sweep, "sweep"));
  }

  public boolean passed() {
    return contradictionPreserved
        && oscillationStable
        && oscillationPeriod != null
        && oscillationPeriod == 2;
  }

  public record DepthSample(int depth, int totalExpressions, int newExpressions) {}
}
