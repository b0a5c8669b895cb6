package attractor.validate;

import attractor.algebra.ExpressionAlgebra;
import attractor.algebra.Simplification;
import attractor.closure.AttractorResult;
import attractor.closure.ClosureEngine;
import attractor.closure.ClosureOptions;
import attractor.closure.Generation;
import attractor.core.Predicate;
import attractor.oscillator.Oscillator;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the standard battery over one seed: a convergence sweep, contradiction preservation, and
 * period and entropy checks on the oscillator.
 */
public final class VerificationSuite {
  private static final Logger LOG = LoggerFactory.getLogger(VerificationSuite.class);

  public static final int SWEEP_DEPTH = 5;
  public static final int PRESERVATION_DEPTH = 3;
  public static final int STABILITY_STEPS = 100;
  public static final int ENTROPY_STEPS = 1000;

  private final ClosureEngine engine;
  private final AttractorValidator validator;
  private final Simplification simplification;
  private final int maxSetSize;

  public VerificationSuite() {
    this(new ClosureEngine(), Simplification.STRUCTURAL, 10_000);
  }

  public VerificationSuite(ClosureEngine engine, Simplification simplification, int maxSetSize) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.simplification = Objects.requireNonNull(simplification, "simplification");
    this.maxSetSize = maxSetSize;
    this.validator = new AttractorValidator();
  }

  public VerificationResult run(String seedName) {
    Predicate seed = Predicate.of(seedName);
    LOG.info("Running verification suite for '{}' ({})", seed, simplification);

    AttractorResult sweepRun = engine.buildAttractor(seed, options(SWEEP_DEPTH));
    List<VerificationResult.DepthSample> sweep = new ArrayList<>();
    Integer convergenceDepth = null;
    List<Generation> generations = sweepRun.generations();
    for (int depth = 1; depth < generations.size(); depth++) {
      int total = generations.get(depth).size();
      int previous = generations.get(depth - 1).size();
      sweep.add(new VerificationResult.DepthSample(depth, total, total - previous));
      if (depth > 1 && total == previous) {
        convergenceDepth = depth;
        break;
      }
    }

    AttractorResult preservationRun = engine.buildAttractor(seed, options(PRESERVATION_DEPTH));
    String contradictionKey = new ExpressionAlgebra(simplification).contradiction(seed).key();
    boolean contradictionPreserved = preservationRun.contains(contradictionKey);

    Oscillator oscillator = new Oscillator(true);
    OscillationReport stability =
        validator.validateOscillation(oscillator.iterate(STABILITY_STEPS));
    boolean stable = stability.passed() && oscillator.isStable(STABILITY_STEPS);
    double entropy = validator.validateOscillation(oscillator.iterate(ENTROPY_STEPS)).entropyBits();

    return new VerificationResult(
        seed.name(),
        sweep,
        convergenceDepth,
        contradictionPreserved,
        stability.period(),
        stable,
        entropy);
  }

  private ClosureOptions options(int depth) {
    return ClosureOptions.of(depth, maxSetSize).withSimplification(simplification);
  }
}
