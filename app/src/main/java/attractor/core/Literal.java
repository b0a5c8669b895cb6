package attractor.core;

import java.util.List;
import java.util.Objects;

/** A predicate in asserted or negated polarity. */
public final class Literal extends Expression {
  private final Predicate predicate;
  private final boolean negated;

  Literal(Predicate predicate, boolean negated) {
    super(keyOf(Objects.requireNonNull(predicate, "predicate"), negated), 1);
    this.predicate = predicate;
    this.negated = negated;
  }

  private static String keyOf(Predicate predicate, boolean negated) {
    return negated ? Tag.NOT.symbol() + predicate.name() : predicate.name();
  }

  public Predicate predicate() {
    return predicate;
  }

  public boolean negated() {
    return negated;
  }

  /** Same predicate, opposite polarity. */
  public Literal flip() {
    return new Literal(predicate, !negated);
  }

  @Override
  public Tag tag() {
    return Tag.LITERAL;
  }

  @Override
  public List<Expression> children() {
    return List.of();
  }
}
