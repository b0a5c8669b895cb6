package attractor.core;

/** Node kinds of an {@link Expression} tree. */
public enum Tag {
  LITERAL(""),
  AND("∧"),
  OR("∨"),
  NOT("¬");

  private final String symbol;

  Tag(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  public boolean isBinary() {
    return this == AND || this == OR;
  }

  /** AND for OR and vice versa; other tags have no dual. */
  public Tag dual() {
    return switch (this) {
      case AND -> OR;
      case OR -> AND;
      default -> throw new IllegalStateException("No dual for " + this);
    };
  }
}
