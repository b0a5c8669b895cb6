package attractor.validate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

final class EntropyTest {

  @Test
  void balancedTwoOutcomesCarryOneBit() {
    assertEquals(1.0, Entropy.shannonBits(1, 1), 1e-12);
    assertEquals(1.0, Entropy.shannonBits(500, 500), 1e-12);
  }

  @Test
  void certainOutcomeCarriesNothing() {
    assertEquals(0.0, Entropy.shannonBits(4, 0), 0.0);
    assertEquals(0.0, Entropy.shannonBits(0, 0), 0.0);
    assertEquals(0.0, Entropy.shannonBits(), 0.0);
  }

  @Test
  void uniformOverFourIsTwoBits() {
    assertEquals(2.0, Entropy.shannonBits(3, 3, 3, 3), 1e-12);
  }

  @Test
  void skewedDistribution() {
    double expected = -(0.75 * Math.log(0.75) + 0.25 * Math.log(0.25)) / Math.log(2.0);
    assertEquals(expected, Entropy.shannonBits(3, 1), 1e-12);
  }

  @Test
  void negativeCountsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> Entropy.shannonBits(1, -1));
  }
}
