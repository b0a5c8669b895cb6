package attractor.validate;

import java.util.List;
import java.util.Objects;

/** Periodicity findings for one oscillator sequence. {@code period} is null without a period. */
public record OscillationReport(
    int length,
    Integer period,
    Periodicity classification,
    double entropyBits,
    List<ValidationFailure> failures) {

  public OscillationReport {
    Objects.requireNonNull(classification, "classification");
    failures = List.copyOf(Objects.requireNonNull(failures, "failures"));
  }

  public boolean passed() {
    return failures.isEmpty();
  }
}
