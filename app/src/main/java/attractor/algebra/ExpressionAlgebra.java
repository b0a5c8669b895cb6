package attractor.algebra;

import attractor.core.Binary;
import attractor.core.Expression;
import attractor.core.Literal;
import attractor.core.Negation;
import attractor.core.Predicate;
import attractor.core.Tag;
import java.util.Objects;

/**
 * Builds AND/OR/NOT expressions in canonical form. Canonicalization is a pure, bottom-up rewrite:
 * canonicalizing a canonical expression returns an equal expression, and commutative children
 * are ordered by key so that {@code conjoin(a, b)} and {@code conjoin(b, a)} share a key.
 *
 * <p>The rule set is chosen by {@link Simplification}. A {@link CanonicalCache}, when supplied,
 * memoizes results across calls.
 */
public final class ExpressionAlgebra {
  private final Simplification mode;
  private final CanonicalCache cache;

  public ExpressionAlgebra() {
    this(Simplification.STRUCTURAL, null);
  }

  public ExpressionAlgebra(Simplification mode) {
    this(mode, null);
  }

  public ExpressionAlgebra(Simplification mode, CanonicalCache cache) {
    this.mode = Objects.requireNonNull(mode, "mode");
    this.cache = cache;
  }

  public Simplification mode() {
    return mode;
  }

  public Expression negate(Expression e) {
    return canonicalize(Expression.not(Objects.requireNonNull(e, "e")));
  }

  public Expression conjoin(Expression a, Expression b) {
    return canonicalize(Expression.and(a, b));
  }

  public Expression disjoin(Expression a, Expression b) {
    return canonicalize(Expression.or(a, b));
  }

  public String canonicalKey(Expression e) {
    return canonicalize(e).key();
  }

  /** {@code P ∧ ¬P} in canonical form. */
  public Expression contradiction(Predicate predicate) {
    return conjoin(predicate.asserted(), predicate.negation());
  }

  /** {@code P ∨ ¬P} in canonical form. */
  public Expression tautology(Predicate predicate) {
    return disjoin(predicate.asserted(), predicate.negation());
  }

  public Expression canonicalize(Expression e) {
    Objects.requireNonNull(e, "e");
    if (e.isLiteral()) {
      return e;
    }
    if (cache != null) {
      Expression cached = cache.get(mode, e);
      if (cached != null) {
        return cached;
      }
    }
    Expression canonical =
        switch (e.tag()) {
          case NOT -> negateCanonical(canonicalize(((Negation) e).child()));
          case AND, OR -> {
            Binary node = (Binary) e;
            yield combine(node.tag(), canonicalize(node.left()), canonicalize(node.right()));
          }
          case LITERAL -> e;
        };
    if (cache != null) {
      cache.put(mode, e, canonical);
    }
    return canonical;
  }

  /** Negation of an expression that is already canonical. */
  private Expression negateCanonical(Expression c) {
    return switch (c.tag()) {
      case LITERAL -> ((Literal) c).flip();
      case NOT -> ((Negation) c).child();
      case AND, OR -> {
        if (!mode.pushesNegation()) {
          yield Expression.not(c);
        }
        Binary node = (Binary) c;
        yield combine(
            node.tag().dual(), negateCanonical(node.left()), negateCanonical(node.right()));
      }
    };
  }

  /** Joins two canonical operands under {@code tag}. */
  private Expression combine(Tag tag, Expression a, Expression b) {
    if (a.equals(b)) {
      return a;
    }
    if (containsOperand(a, tag, b)) {
      return a;
    }
    if (containsOperand(b, tag, a)) {
      return b;
    }
    if (mode.absorbs()) {
      if (containsOperand(b, tag.dual(), a)) {
        return a;
      }
      if (containsOperand(a, tag.dual(), b)) {
        return b;
      }
    }
    return a.compareTo(b) <= 0 ? Expression.binary(tag, a, b) : Expression.binary(tag, b, a);
  }

  private static boolean containsOperand(Expression node, Tag tag, Expression operand) {
    return node.tag() == tag && ((Binary) node).hasOperand(operand);
  }
}
