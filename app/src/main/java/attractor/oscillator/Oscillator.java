package attractor.oscillator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Two-state toggle: the state at step i is {@code initial} when i is even and its negation
 * otherwise. Holds no state beyond the initial value.
 */
public final class Oscillator {
  public static final int PERIOD = 2;

  private static final int MIN_STABILITY_STEPS = 2 * PERIOD;

  private final boolean initial;

  public Oscillator(boolean initial) {
    this.initial = initial;
  }

  public boolean initial() {
    return initial;
  }

  /** Sequence of {@code steps} states starting at {@code initial}; empty for zero steps. */
  public static List<Boolean> iterate(boolean initial, int steps) {
    if (steps < 0) {
      throw new IllegalArgumentException("steps must be non-negative, got " + steps);
    }
    if (steps == 0) {
      return List.of();
    }
    List<Boolean> history = new ArrayList<>(steps);
    boolean current = initial;
    for (int i = 0; i < steps; i++) {
      history.add(current);
      current = !current;
    }
    return Collections.unmodifiableList(history);
  }

  public List<Boolean> iterate(int steps) {
    return iterate(initial, steps);
  }

  public int period() {
    return PERIOD;
  }

  /**
   * Checks that {@code steps} states repeat with {@link #period()}. Fewer than two full periods
   * are raised to two.
   */
  public boolean isStable(int steps) {
    List<Boolean> sequence = iterate(Math.max(steps, MIN_STABILITY_STEPS));
    for (int i = PERIOD; i < sequence.size(); i++) {
      if (!sequence.get(i).equals(sequence.get(i - PERIOD))) {
        return false;
      }
    }
    return true;
  }
}
