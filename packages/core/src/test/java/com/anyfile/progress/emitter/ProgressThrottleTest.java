package com.anyfile.progress.emitter;

import static org.junit.jupiter.api.Assertions.*;

import com.anyfile.progress.exception.ValidationException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ProgressThrottleTest {

  private static final long MS = 1_000_000L;

  @Test
  void allowsFirstEventAndIntervalBasedEvents() {
    ProgressThrottle throttle = new ProgressThrottle(Duration.ofMillis(300));

    // first event must pass, even at an arbitrary clock origin
    assertTrue(throttle.tryAcquire(-42 * MS, false));

    // within interval -> blocked
    assertFalse(throttle.tryAcquire(100 * MS, false));

    // forced -> allowed, and restarts the window
    assertTrue(throttle.tryAcquire(150 * MS, true));
    assertFalse(throttle.tryAcquire(400 * MS, false));

    // interval elapsed since the forced event -> allowed
    assertTrue(throttle.tryAcquire(450 * MS, false));
  }

  @Test
  void zeroIntervalNeverSuppresses() {
    ProgressThrottle throttle = new ProgressThrottle(Duration.ZERO);

    assertTrue(throttle.tryAcquire(5, false));
    assertTrue(throttle.tryAcquire(5, false));
    assertTrue(throttle.tryAcquire(6, false));
  }

  @Test
  void rejectsNegativeInterval() {
    assertThrows(ValidationException.class, () -> new ProgressThrottle(Duration.ofMillis(-1)));
    assertThrows(ValidationException.class, () -> new ProgressThrottle(null));
  }
}
