package attractor.validate;

/** Structured reasons a validation check can fail. */
public enum FailureReason {
  CONTRADICTION_ABSENT,
  BASE_ELEMENT_ABSENT,
  CONVERGENCE_INCONSISTENT,
  ENTROPY_NOT_CONSERVED,
  SEED_MISMATCH,
  PERIOD_NOT_TWO;
}
