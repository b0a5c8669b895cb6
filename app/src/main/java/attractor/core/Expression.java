package attractor.core;

import java.util.List;
import java.util.Objects;

/**
 * Immutable expression tree over predicate literals. Every node carries a key computed once from
 * its children's keys, so key construction is linear in the size of the tree and instances can be
 * shared freely between closure sets.
 *
 * <p>Key grammar:
 *
 * <ul>
 *   <li>literal: {@code X} or {@code ¬X}
 *   <li>binary: {@code (a ∧ b)} and {@code (a ∨ b)}, children in construction order
 *   <li>negation: {@code ¬} followed by the child key, with literal children wrapped as {@code
 *       ¬(X)}
 * </ul>
 *
 * Predicate names cannot contain any of the grammar's symbols, so distinct trees have distinct
 * keys. Equality and hashing use the key only. Trees built through the factories here are raw;
 * canonical forms come from {@code ExpressionAlgebra}.
 */
public abstract class Expression implements Comparable<Expression> {
  private final String key;
  private final int size;

  Expression(String key, int size) {
    this.key = key;
    this.size = size;
  }

  public static Literal literal(Predicate predicate, boolean negated) {
    return new Literal(predicate, negated);
  }

  public static Binary and(Expression left, Expression right) {
    return new Binary(Tag.AND, left, right);
  }

  public static Binary or(Expression left, Expression right) {
    return new Binary(Tag.OR, left, right);
  }

  public static Binary binary(Tag tag, Expression left, Expression right) {
    return new Binary(tag, left, right);
  }

  public static Negation not(Expression child) {
    return new Negation(child);
  }

  public abstract Tag tag();

  public abstract List<Expression> children();

  public final String key() {
    return key;
  }

  /** Number of nodes in the tree. */
  public final int size() {
    return size;
  }

  public final boolean isLiteral() {
    return tag() == Tag.LITERAL;
  }

  @Override
  public final int compareTo(Expression other) {
    return key.compareTo(other.key);
  }

  @Override
  public final boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    return obj instanceof Expression other && key.equals(other.key);
  }

  @Override
  public final int hashCode() {
    return key.hashCode();
  }

  @Override
  public String toString() {
    return key;
  }

  static Expression requireChild(Expression child, String name) {
    return Objects.requireNonNull(child, name);
  }
}
