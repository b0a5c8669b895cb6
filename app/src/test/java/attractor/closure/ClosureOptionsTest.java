package attractor.closure;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import attractor.algebra.Simplification;
import org.junit.jupiter.api.Test;

final class ClosureOptionsTest {

  @Test
  void defaultsAreSequentialAndStructural() {
    ClosureOptions options = ClosureOptions.defaults();
    assertEquals(ClosureDefaults.MAX_DEPTH, options.maxDepth());
    assertEquals(ClosureDefaults.MAX_SET_SIZE, options.maxSetSize());
    assertEquals(Simplification.STRUCTURAL, options.simplification());
    assertFalse(options.parallel());
    assertTrue(options.parallelism() > 0);
  }

  @Test
  void nullSimplificationFallsBackToStructural() {
    ClosureOptions options = new ClosureOptions(1, 10, null, false, 0);
    assertEquals(Simplification.STRUCTURAL, options.simplification());
  }

  @Test
  void withersKeepOtherFields() {
    ClosureOptions options =
        ClosureOptions.of(3, 50).withSimplification(Simplification.LATTICE).withParallelism(2);
    assertEquals(3, options.maxDepth());
    assertEquals(50, options.maxSetSize());
    assertEquals(Simplification.LATTICE, options.simplification());
    assertTrue(options.parallel());
    assertEquals(2, options.parallelism());
    assertFalse(options.withParallel(false).parallel());
  }

  @Test
  void boundsAreValidated() {
    assertThrows(IllegalArgumentException.class, () -> ClosureOptions.of(-1, 10));
    assertThrows(IllegalArgumentException.class, () -> ClosureOptions.of(1, 0));
  }

  @Test
  void depthCeilingHonoursSystemProperty() {
    String key = "attractor.maxDepthCeiling";
    String previous = System.getProperty(key);
    try {
      System.setProperty(key, "7");
      assertEquals(7, ClosureDefaults.maxDepthCeiling());
      assertEquals(7, new ClosureEngine().depthCeiling());
    } finally {
      if (previous == null) {
        System.clearProperty(key);
      } else {
        System.setProperty(key, previous);
      }
    }
  }
}
