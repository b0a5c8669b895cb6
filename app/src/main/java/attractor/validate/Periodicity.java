package attractor.validate;

/** Periodicity classification of a boolean sequence. */
public enum Periodicity {
  PERIODIC("periodic"),
  INSUFFICIENT_DATA("insufficient-data");

  private final String label;

  Periodicity(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
