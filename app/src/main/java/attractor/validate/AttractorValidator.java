package attractor.validate;

import attractor.algebra.ExpressionAlgebra;
import attractor.closure.AttractorResult;
import attractor.closure.Generation;
import attractor.core.Predicate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structural checks over a built attractor and over oscillator sequences. A violated invariant is
 * recorded as a {@link ValidationFailure} and the remaining checks still run; only malformed input
 * (null arguments or null sequence elements) throws.
 */
public final class AttractorValidator {
  private static final Logger LOG = LoggerFactory.getLogger(AttractorValidator.class);
  private static final double ENTROPY_TOLERANCE = 1e-12;

  public ValidationReport validate(AttractorResult attractor, Predicate seed) {
    Objects.requireNonNull(attractor, "attractor");
    Objects.requireNonNull(seed, "seed");

    List<ValidationFailure> failures = new ArrayList<>();
    if (!attractor.seed().equals(seed)) {
      failures.add(ValidationFailure.seedMismatch(seed.name(), attractor.seed().name()));
    }

    ExpressionAlgebra algebra = new ExpressionAlgebra(attractor.options().simplification());
    String contradictionKey = algebra.contradiction(seed).key();
    String tautologyKey = algebra.tautology(seed).key();
    String predicateKey = seed.asserted().key();
    String negationKey = seed.negation().key();

    boolean contradictionPresent = attractor.contains(contradictionKey);
    if (!contradictionPresent && attractor.options().maxDepth() >= 1) {
      failures.add(ValidationFailure.contradictionAbsent(contradictionKey));
    }
    boolean tautologyPresent = attractor.contains(tautologyKey);
    boolean predicatePresent = attractor.contains(predicateKey);
    boolean negationPresent = attractor.contains(negationKey);
    int lastIndex = attractor.lastGeneration().index();
    if (!predicatePresent) {
      failures.add(ValidationFailure.baseElementAbsent(predicateKey, lastIndex));
    }
    if (!negationPresent) {
      failures.add(ValidationFailure.baseElementAbsent(negationKey, lastIndex));
    }

    boolean recomputed = fixedPointReached(attractor.generations());
    boolean convergedConsistent = recomputed == attractor.converged();
    if (!convergedConsistent) {
      failures.add(ValidationFailure.convergenceInconsistent(attractor.converged(), recomputed));
    }

    List<Generation> generations = attractor.generations();
    double entropyBits = baseEntropy(generations.get(0), predicateKey, negationKey);
    boolean entropyConserved = true;
    for (Generation generation : generations.subList(1, generations.size())) {
      double bits = baseEntropy(generation, predicateKey, negationKey);
      if (Math.abs(bits - entropyBits) > ENTROPY_TOLERANCE) {
        entropyConserved = false;
        failures.add(ValidationFailure.entropyNotConserved(generation.index(), entropyBits, bits));
        break;
      }
    }

    ValidationReport report =
        new ValidationReport(
            seed.name(),
            attractor.options().maxDepth(),
            attractor.options().maxSetSize(),
            attractor.options().simplification(),
            contradictionPresent,
            tautologyPresent,
            predicatePresent,
            negationPresent,
            attractor.converged(),
            convergedConsistent,
            entropyBits,
            entropyConserved,
            attractor.size(),
            generations.size(),
            failures);
    if (!report.passed()) {
      LOG.warn("Attractor of '{}' failed {} check(s)", seed, failures.size());
    }
    return report;
  }

  public OscillationReport validateOscillation(List<Boolean> sequence) {
    Objects.requireNonNull(sequence, "sequence");
    long trueCount = 0;
    for (int i = 0; i < sequence.size(); i++) {
      Boolean state = Objects.requireNonNull(sequence.get(i), "sequence element " + i);
      if (state) {
        trueCount++;
      }
    }
    int length = sequence.size();
    double entropyBits = Entropy.shannonBits(trueCount, length - trueCount);

    if (length < 2) {
      return new OscillationReport(
          length, null, Periodicity.INSUFFICIENT_DATA, entropyBits, List.of());
    }

    int period = minimalPeriod(sequence);
    List<ValidationFailure> failures = new ArrayList<>();
    if (period != 2) {
      failures.add(ValidationFailure.periodNotTwo(period, length));
    }
    return new OscillationReport(length, period, Periodicity.PERIODIC, entropyBits, failures);
  }

  /** True when the last two snapshots hold the same keys in the same order. */
  static boolean fixedPointReached(List<Generation> generations) {
    if (generations.size() < 2) {
      return false;
    }
    Generation last = generations.get(generations.size() - 1);
    Generation previous = generations.get(generations.size() - 2);
    return last.keys().equals(previous.keys());
  }

  /** Entropy of the two-outcome base distribution as observed in one snapshot. */
  static double baseEntropy(Generation generation, String predicateKey, String negationKey) {
    long predicate = generation.contains(predicateKey) ? 1 : 0;
    long negation = generation.contains(negationKey) ? 1 : 0;
    return Entropy.shannonBits(predicate, negation);
  }

  /** Smallest p in [1, n] with s[i] == s[i - p] for every i >= p. */
  static int minimalPeriod(List<Boolean> sequence) {
    int n = sequence.size();
    for (int p = 1; p < n; p++) {
      boolean repeats = true;
      for (int i = p; i < n; i++) {
        if (!sequence.get(i).equals(sequence.get(i - p))) {
          repeats = false;
          break;
        }
      }
      if (repeats) {
        return p;
      }
    }
    return n;
  }
}
