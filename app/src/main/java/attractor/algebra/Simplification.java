package attractor.algebra;

/** Rewrite rules applied by {@link ExpressionAlgebra#canonicalize}. */
public enum Simplification {
  /**
   * Double-negation collapse, key ordering of AND/OR children, idempotence ({@code a ∧ a → a}) and
   * re-association idempotence ({@code (a ∧ b) ∧ a → (a ∧ b)}). Negations of compound nodes stay
   * as NOT nodes.
   */
  STRUCTURAL,

  /**
   * {@link #STRUCTURAL} plus De Morgan (negation is pushed down to literals) and absorption ({@code
   * a ∧ (a ∨ b) → a}). The contradiction {@code P ∧ ¬P} is kept as an element; no complement
   * laws are applied.
   */
  LATTICE;

  public boolean pushesNegation() {
    return this == LATTICE;
  }

  public boolean absorbs() {
    return this == LATTICE;
  }
}
