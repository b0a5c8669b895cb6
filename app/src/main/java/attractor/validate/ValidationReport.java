package attractor.validate;

import attractor.algebra.Simplification;
import java.util.List;
import java.util.Objects;

/**
 * Findings of {@link AttractorValidator#validate} together with the parameters that produced the
 * attractor. Failed checks are listed in {@code failures}; the boolean fields carry the raw
 * outcome of each check.
 */
public record ValidationReport(
    String seed,
    int maxDepth,
    int maxSetSize,
    Simplification simplification,
    boolean contradictionPresent,
    boolean tautologyPresent,
    boolean basePredicatePresent,
    boolean baseNegationPresent,
    boolean converged,
    boolean convergedConsistent,
    double entropyBits,
    boolean entropyConserved,
    int totalExpressions,
    int generationCount,
    List<ValidationFailure> failures) {

  public ValidationReport {
    Objects.requireNonNull(seed, "seed");
    Objects.requireNonNull(simplification, "simplification");
    failures = List.copyOf(Objects.requireNonNull(failures, "failures"));
  }

  public boolean passed() {
    return failures.isEmpty();
  }

  public boolean hasFailure(FailureReason reason) {
    return failures.stream().anyMatch(f -> f.reason() == reason);
  }
}
