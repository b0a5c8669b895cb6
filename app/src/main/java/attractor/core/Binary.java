package attractor.core;

import java.util.List;

/** AND or OR node over exactly two children. */
public final class Binary extends Expression {
  private final Tag tag;
  private final Expression left;
  private final Expression right;

  Binary(Tag tag, Expression left, Expression right) {
    super(
        keyOf(tag, requireChild(left, "left"), requireChild(right, "right")),
        1 + left.size() + right.size());
    this.tag = tag;
    this.left = left;
    this.right = right;
  }

  private static String keyOf(Tag tag, Expression left, Expression right) {
    if (tag == null || !tag.isBinary()) {
      throw new IllegalArgumentException("Binary node requires AND or OR, got " + tag);
    }
    return "(" + left.key() + " " + tag.symbol() + " " + right.key() + ")";
  }

  public Expression left() {
    return left;
  }

  public Expression right() {
    return right;
  }

  /** True when {@code operand} is one of the two direct children. */
  public boolean hasOperand(Expression operand) {
    return left.equals(operand) || right.equals(operand);
  }

  @Override
  public Tag tag() {
    return tag;
  }

  @Override
  public List<Expression> children() {
    return List.of(left, right);
  }
}
