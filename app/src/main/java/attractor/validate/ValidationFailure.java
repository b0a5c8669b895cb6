package attractor.validate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** One failed check inside a report. */
public record ValidationFailure(
    FailureReason reason, String message, Map<String, Object> attributes) {

  public static final String ATTR_KEY = "key";
  public static final String ATTR_GENERATION = "generation";
  public static final String ATTR_REPORTED = "reported";
  public static final String ATTR_RECOMPUTED = "recomputed";
  public static final String ATTR_EXPECTED = "expected";
  public static final String ATTR_ACTUAL = "actual";
  public static final String ATTR_PERIOD = "period";
  public static final String ATTR_LENGTH = "length";

  public ValidationFailure {
    Objects.requireNonNull(reason, "reason");
    Objects.requireNonNull(message, "message");
    attributes =
        (attributes == null || attributes.isEmpty())
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  public static ValidationFailure contradictionAbsent(String key) {
    return new ValidationFailure(
        FailureReason.CONTRADICTION_ABSENT,
        "contradiction " + key + " is not a member of the final set",
        Map.of(ATTR_KEY, key));
  }

  public static ValidationFailure baseElementAbsent(String key, int generation) {
    return new ValidationFailure(
        FailureReason.BASE_ELEMENT_ABSENT,
        String.format(Locale.ROOT, "base element %s missing from generation %d", key, generation),
        Map.of(ATTR_KEY, key, ATTR_GENERATION, generation));
  }

  public static ValidationFailure convergenceInconsistent(boolean reported, boolean recomputed) {
    return new ValidationFailure(
        FailureReason.CONVERGENCE_INCONSISTENT,
        "converged flag is " + reported + " but the last two generations say " + recomputed,
        Map.of(ATTR_REPORTED, reported, ATTR_RECOMPUTED, recomputed));
  }

  public static ValidationFailure entropyNotConserved(
      int generation, double expected, double actual) {
    return new ValidationFailure(
        FailureReason.ENTROPY_NOT_CONSERVED,
        String.format(
            Locale.ROOT,
            "base entropy changed at generation %d: %.6f bits, expected %.6f",
            generation,
            actual,
            expected),
        Map.of(ATTR_GENERATION, generation, ATTR_EXPECTED, expected, ATTR_ACTUAL, actual));
  }

  public static ValidationFailure seedMismatch(String expected, String actual) {
    return new ValidationFailure(
        FailureReason.SEED_MISMATCH,
        "attractor was built from '" + actual + "', validated against '" + expected + "'",
        Map.of(ATTR_EXPECTED, expected, ATTR_ACTUAL, actual));
  }

  /** A {@code period} equal to the sequence length means no shorter shift repeats. */
  public static ValidationFailure periodNotTwo(int period, int length) {
    return new ValidationFailure(
        FailureReason.PERIOD_NOT_TWO,
        String.format(Locale.ROOT, "sequence of length %d has period %d", length, period),
        Map.of(ATTR_EXPECTED, 2, ATTR_PERIOD, period, ATTR_LENGTH, length));
  }
}
