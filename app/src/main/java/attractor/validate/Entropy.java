package attractor.validate;

/** Shannon entropy over outcome counts. */
public final class Entropy {
  private static final double LN_2 = Math.log(2.0);

  private Entropy() {}

  /** Entropy in bits of the distribution given by {@code counts}; zero counts add nothing. */
  public static double shannonBits(long... counts) {
    long total = 0;
    for (long count : counts) {
      if (count < 0) {
        throw new IllegalArgumentException("counts must be non-negative");
      }
      total += count;
    }
    if (total == 0) {
      return 0.0;
    }
    double bits = 0.0;
    for (long count : counts) {
      if (count == 0) {
        continue;
      }
      double p = count / (double) total;
      bits -= p * Math.log(p) / LN_2;
    }
    return bits;
  }
}
