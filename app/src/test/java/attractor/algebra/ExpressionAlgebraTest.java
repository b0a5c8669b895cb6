package attractor.algebra;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import attractor.core.Expression;
import attractor.core.Predicate;
import attractor.core.Tag;
import attractor.util.CacheStats;
import java.util.List;
import org.junit.jupiter.api.Test;

final class ExpressionAlgebraTest {
  private final Predicate x = Predicate.of("X");
  private final Expression p = x.asserted();
  private final Expression notP = x.negation();

  private List<Expression> samples(ExpressionAlgebra algebra) {
    Expression contradiction = algebra.conjoin(p, notP);
    Expression tautology = algebra.disjoin(p, notP);
    return List.of(
        p,
        notP,
        contradiction,
        tautology,
        algebra.negate(contradiction),
        algebra.conjoin(tautology, notP),
        algebra.disjoin(algebra.negate(tautology), p),
        Expression.not(Expression.not(Expression.and(notP, p))));
  }

  @Test
  void canonicalizationIsIdempotent() {
    for (Simplification mode : Simplification.values()) {
      ExpressionAlgebra algebra = new ExpressionAlgebra(mode);
      for (Expression e : samples(algebra)) {
        Expression once = algebra.canonicalize(e);
        assertEquals(once.key(), algebra.canonicalize(once).key(), mode + " " + e);
      }
    }
  }

  @Test
  void doubleNegationReturnsOriginal() {
    for (Simplification mode : Simplification.values()) {
      ExpressionAlgebra algebra = new ExpressionAlgebra(mode);
      for (Expression e : samples(algebra)) {
        Expression canonical = algebra.canonicalize(e);
        assertEquals(canonical, algebra.negate(algebra.negate(canonical)), mode + " " + e);
      }
    }
  }

  @Test
  void conjunctionAndDisjunctionCommute() {
    for (Simplification mode : Simplification.values()) {
      ExpressionAlgebra algebra = new ExpressionAlgebra(mode);
      List<Expression> samples = samples(algebra);
      for (Expression a : samples) {
        for (Expression b : samples) {
          assertEquals(algebra.conjoin(a, b), algebra.conjoin(b, a), a + " ∧ " + b);
          assertEquals(algebra.disjoin(a, b), algebra.disjoin(b, a), a + " ∨ " + b);
        }
      }
    }
  }

  @Test
  void literalNegationFlips() {
    ExpressionAlgebra algebra = new ExpressionAlgebra();
    assertEquals("¬X", algebra.negate(p).key());
    assertEquals("X", algebra.negate(notP).key());
    assertEquals("¬X", algebra.canonicalKey(Expression.not(p)));
  }

  @Test
  void structuralModeKeepsNegationOverCompounds() {
    ExpressionAlgebra algebra = new ExpressionAlgebra(Simplification.STRUCTURAL);
    Expression contradiction = algebra.contradiction(x);
    assertEquals("(X ∧ ¬X)", contradiction.key());
    assertEquals("(X ∨ ¬X)", algebra.tautology(x).key());
    Expression negated = algebra.negate(contradiction);
    assertEquals(Tag.NOT, negated.tag());
    assertEquals("¬(X ∧ ¬X)", negated.key());
  }

  @Test
  void idempotentOperandsCollapse() {
    ExpressionAlgebra algebra = new ExpressionAlgebra(Simplification.STRUCTURAL);
    Expression contradiction = algebra.conjoin(p, notP);
    assertEquals(p, algebra.conjoin(p, p));
    assertEquals(p, algebra.disjoin(p, p));
    assertEquals(contradiction, algebra.conjoin(contradiction, p));
    assertEquals(contradiction, algebra.conjoin(notP, contradiction));
  }

  @Test
  void structuralModeDoesNotAbsorb() {
    ExpressionAlgebra algebra = new ExpressionAlgebra(Simplification.STRUCTURAL);
    Expression absorbed = algebra.conjoin(algebra.tautology(x), p);
    assertEquals("((X ∨ ¬X) ∧ X)", absorbed.key());
  }

  @Test
  void latticeModeAppliesDeMorganAndAbsorption() {
    ExpressionAlgebra algebra = new ExpressionAlgebra(Simplification.LATTICE);
    Expression contradiction = algebra.contradiction(x);
    Expression tautology = algebra.tautology(x);
    assertEquals(tautology, algebra.negate(contradiction));
    assertEquals(contradiction, algebra.negate(tautology));
    assertEquals(p, algebra.conjoin(p, tautology));
    assertEquals(notP, algebra.disjoin(contradiction, notP));
  }

  @Test
  void modesDisagreeOnNegatedCompounds() {
    Expression raw = Expression.not(Expression.and(p, notP));
    assertNotEquals(
        new ExpressionAlgebra(Simplification.STRUCTURAL).canonicalKey(raw),
        new ExpressionAlgebra(Simplification.LATTICE).canonicalKey(raw));
  }

  @Test
  void cacheReturnsMemoizedForms() {
    CacheStats stats = new CacheStats();
    CanonicalCache cache = new CanonicalCache(stats);
    ExpressionAlgebra algebra = new ExpressionAlgebra(Simplification.STRUCTURAL, cache);
    Expression raw = Expression.or(Expression.and(notP, p), p);

    Expression first = algebra.canonicalize(raw);
    long missesAfterFirst = stats.misses();
    Expression second = algebra.canonicalize(raw);

    assertSame(first, second);
    assertTrue(stats.hits() >= 1, "Repeated canonicalization should hit the cache");
    assertEquals(missesAfterFirst, stats.misses());
    assertTrue(cache.size() > 0);
  }

  @Test
  void cacheSeparatesModes() {
    CanonicalCache cache = new CanonicalCache();
    Expression raw = Expression.not(Expression.and(p, notP));
    String structural = new ExpressionAlgebra(Simplification.STRUCTURAL, cache).canonicalKey(raw);
    String lattice = new ExpressionAlgebra(Simplification.LATTICE, cache).canonicalKey(raw);
    assertEquals("¬(X ∧ ¬X)", structural);
    assertEquals("(X ∨ ¬X)", lattice);
  }
}
