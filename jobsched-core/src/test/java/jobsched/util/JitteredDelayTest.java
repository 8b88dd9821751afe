package jobsched.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JitteredDelayTest {

  @Test
  void defaultDelayStaysWithinBounds() {
    JitteredDelay delay = JitteredDelay.DEFAULT;
    assertEquals(600, delay.minDelayMs());
    assertEquals(1000, delay.maxDelayMs());

    for (int i = 0; i < 1000; i++) {
      long next = delay.nextDelayMs();
      assertTrue(next >= 600 && next <= 1000, "delay out of range: " + next);
    }
  }

  @Test
  void zeroJitterIsFixed() {
    assertEquals(10, new JitteredDelay(0, 0, 10).nextDelayMs());
  }

  @Test
  void rejectsInvertedRange() {
    assertThrows(IllegalArgumentException.class, () -> new JitteredDelay(900, 500, 100));
    assertThrows(IllegalArgumentException.class, () -> new JitteredDelay(-1, 5, 0));
  }
}
