package dev.henneberger.vertx.sync.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class CapabilityCacheTest {

  private static final TargetIdentity PRIMARY = new TargetIdentity("db1", 5432, "app");
  private static final TargetIdentity REPLICA = new TargetIdentity("db2", 5432, "app");

  @Test
  void probesOncePerTargetAndCapability() throws Exception {
    CapabilityCache cache = new CapabilityCache();
    AtomicInteger calls = new AtomicInteger();

    for (int i = 0; i < 5; i++) {
      assertTrue(cache.isAvailable(PRIMARY, "hstore", () -> {
        calls.incrementAndGet();
        return true;
      }));
    }

    assertEquals(1, calls.get());
    assertEquals(1, cache.probesExecuted());
  }

  @Test
  void negativeResultIsCachedToo() throws Exception {
    CapabilityCache cache = new CapabilityCache();

    assertFalse(cache.isAvailable(PRIMARY, "hstore", () -> false));
    assertFalse(cache.isAvailable(PRIMARY, "hstore", () -> true));
    assertEquals(1, cache.probesExecuted());
  }

  @Test
  void targetsAreProbedSeparately() throws Exception {
    CapabilityCache cache = new CapabilityCache();

    assertTrue(cache.isAvailable(PRIMARY, "hstore", () -> true));
    assertFalse(cache.isAvailable(REPLICA, "hstore", () -> false));
    assertEquals(2, cache.probesExecuted());
  }
}
