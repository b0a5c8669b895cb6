package attractor.core;

import java.util.List;

/** NOT node over a single child. */
public final class Negation extends Expression {
  private final Expression child;

  Negation(Expression child) {
    super(keyOf(requireChild(child, "child")), 1 + child.size());
    this.child = child;
  }

  private static String keyOf(Expression child) {
    String inner = child.isLiteral() ? "(" + child.key() + ")" : child.key();
    return Tag.NOT.symbol() + inner;
  }

  public Expression child() {
    return child;
  }

  @Override
  public Tag tag() {
    return Tag.NOT;
  }

  @Override
  public List<Expression> children() {
    return List.of(child);
  }
}
