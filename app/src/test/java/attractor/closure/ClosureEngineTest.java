package attractor.closure;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import attractor.algebra.CanonicalCache;
import attractor.algebra.ExpressionAlgebra;
import attractor.algebra.Simplification;
import attractor.core.DepthLimitException;
import attractor.core.Expression;
import attractor.core.InvalidPredicateException;
import attractor.core.Predicate;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class ClosureEngineTest {
  private final ClosureEngine engine = new ClosureEngine(null, ClosureDefaults.DEPTH_CEILING);

  @Test
  void firstGenerationHoldsContradictionAndTautology() {
    AttractorResult result = engine.buildAttractor("X", 1, 100);
    assertEquals(List.of("X", "¬X"), result.generations().get(0).keys());
    assertEquals(List.of("X", "¬X", "(X ∧ ¬X)", "(X ∨ ¬X)"), result.finalKeys());
    assertTrue(result.contains("(X ∧ ¬X)"));
    assertFalse(result.converged());
    assertEquals(-1, result.convergenceGeneration());
  }

  @Test
  void secondGenerationOrderIsStable() {
    AttractorResult result = engine.buildAttractor("X", 2, 100);
    assertEquals(
        List.of(
            "X",
            "¬X",
            "(X ∧ ¬X)",
            "(X ∨ ¬X)",
            "((X ∧ ¬X) ∨ X)",
            "((X ∧ ¬X) ∨ ¬X)",
            "¬(X ∧ ¬X)",
            "((X ∨ ¬X) ∧ X)",
            "((X ∨ ¬X) ∧ ¬X)",
            "¬(X ∨ ¬X)"),
        result.finalKeys());
  }

  @Test
  void generationsGrowMonotonically() {
    AttractorResult result = engine.buildAttractor("X", 4, 10_000);
    List<Integer> sizes = result.generations().stream().map(Generation::size).toList();
    assertEquals(List.of(2, 4, 10, 34, 130), sizes);
    for (int i = 1; i < result.generations().size(); i++) {
      Set<String> previous = result.generations().get(i - 1).keySet();
      Set<String> current = result.generations().get(i).keySet();
      assertTrue(current.containsAll(previous), "Generation " + i + " dropped members");
      assertEquals(
          result.generations().get(i - 1).keys(),
          result.generations().get(i).keys().subList(0, previous.size()),
          "Generation " + i + " reordered earlier members");
    }
  }

  @Test
  void depthZeroYieldsBaseOnly() {
    AttractorResult result = engine.buildAttractor("Y", 0, 10);
    assertEquals(1, result.generations().size());
    assertEquals(List.of("Y", "¬Y"), result.finalKeys());
    assertFalse(result.converged());
  }

  @Test
  void buildsAreDeterministic() {
    AttractorResult first = engine.buildAttractor("X", 3, 1_000);
    AttractorResult second = new ClosureEngine(new CanonicalCache()).buildAttractor("X", 3, 1_000);
    assertEquals(first.generationKeys(), second.generationKeys());
    assertEquals(first.finalKeys(), second.finalKeys());
  }

  @Test
  void sizeBoundAbortsTheBuild() {
    DepthLimitException ex =
        assertThrows(DepthLimitException.class, () -> engine.buildAttractor("X", 50, 4));
    assertEquals("X", ex.seed());
    assertEquals(2, ex.generation());
    assertEquals(5, ex.attempted());
    assertEquals(4, ex.bound());
  }

  @Test
  void sizeBoundBelowBaseFailsImmediately() {
    DepthLimitException ex =
        assertThrows(DepthLimitException.class, () -> engine.buildAttractor("X", 1, 1));
    assertEquals(0, ex.generation());
    assertEquals(2, ex.attempted());
  }

  @Test
  void depthAboveCeilingIsRejected() {
    ClosureEngine bounded = new ClosureEngine(null, 3);
    DepthLimitException ex =
        assertThrows(DepthLimitException.class, () -> bounded.buildAttractor("X", 4, 100));
    assertEquals(-1, ex.generation());
    assertEquals(4, ex.attempted());
    assertEquals(3, ex.bound());
    assertEquals(3, bounded.depthCeiling());
  }

  @Test
  void invalidArgumentsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> engine.buildAttractor("X", -1, 10));
    assertThrows(IllegalArgumentException.class, () -> engine.buildAttractor("X", 1, 0));
    assertThrows(InvalidPredicateException.class, () -> engine.buildAttractor("not", 1, 10));
    assertThrows(InvalidPredicateException.class, () -> engine.buildAttractor("", 1, 10));
  }

  @Test
  void latticeClosureReachesFixedPoint() {
    ClosureOptions options = ClosureOptions.of(3, 100).withSimplification(Simplification.LATTICE);
    AttractorResult result = engine.buildAttractor(Predicate.of("X"), options);

    assertTrue(result.converged());
    assertEquals(1, result.convergenceGeneration());
    assertEquals(3, result.generations().size());
    assertEquals(result.generations().get(1).keys(), result.generations().get(2).keys());
    assertEquals(List.of("X", "¬X", "(X ∧ ¬X)", "(X ∨ ¬X)"), result.finalKeys());

    ExpressionAlgebra algebra = new ExpressionAlgebra(Simplification.LATTICE);
    List<Expression> base = Predicate.of("X").base();
    for (Expression element : result.finalSet()) {
      for (Expression candidate : ClosureEngine.candidatesFor(element, base, algebra)) {
        assertTrue(result.contains(candidate.key()), "Not closed under " + candidate);
      }
    }
  }

  @Test
  void parallelBuildMatchesSequential() {
    ClosureOptions sequential = ClosureOptions.of(5, 10_000);
    AttractorResult expected = engine.buildAttractor(Predicate.of("X"), sequential);
    AttractorResult actual =
        engine.buildAttractor(Predicate.of("X"), sequential.withParallelism(4));
    assertTrue(actual.options().parallel());
    assertEquals(514, actual.size());
    assertEquals(expected.generationKeys(), actual.generationKeys());
  }

  @Test
  void parallelBuildWithDefaultWorkersMatchesSequential() {
    ClosureOptions sequential = ClosureOptions.of(5, 10_000);
    ClosureOptions parallel = sequential.withParallel(true);
    assertEquals(Runtime.getRuntime().availableProcessors(), parallel.parallelism());

    AttractorResult expected = engine.buildAttractor(Predicate.of("X"), sequential);
    for (int run = 0; run < 3; run++) {
      AttractorResult actual = engine.buildAttractor(Predicate.of("X"), parallel);
      assertEquals(expected.finalKeys(), actual.finalKeys(), "run " + run);
    }
  }

  @Test
  void parallelBuildAtDepthZeroNeedsNoWorkers() {
    AttractorResult result =
        engine.buildAttractor(Predicate.of("X"), ClosureOptions.of(0, 10).withParallel(true));
    assertEquals(List.of("X", "¬X"), result.finalKeys());
  }

  @Test
  void sharedCacheIsReused() {
    CanonicalCache cache = new CanonicalCache();
    ClosureEngine cached = new ClosureEngine(cache, ClosureDefaults.DEPTH_CEILING);
    AttractorResult first = cached.buildAttractor("X", 3, 1_000);
    long hitsAfterFirst = cache.stats().hits();
    AttractorResult second = cached.buildAttractor("X", 3, 1_000);

    assertEquals(first.finalKeys(), second.finalKeys());
    assertTrue(cache.stats().hits() > hitsAfterFirst);
  }

  @Test
  void candidatesFollowFixedOrder() {
    ExpressionAlgebra algebra = new ExpressionAlgebra();
    Predicate x = Predicate.of("X");
    List<String> keys =
        ClosureEngine.candidatesFor(x.asserted(), x.base(), algebra).stream()
            .map(Expression::key)
            .toList();
    assertEquals(List.of("X", "X", "(X ∧ ¬X)", "(X ∨ ¬X)", "¬X"), keys);
  }
}
