package dev.henneberger.vertx.sync.core;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Remembers boolean feature probes per target. A probe runs at most once per target and
 * capability for the lifetime of the cache; failed probes are not cached.
 */
public final class CapabilityCache {

  @FunctionalInterface
  public interface Probe {
    boolean run() throws Exception;
  }

  private final Map<Key, Boolean> results = new HashMap<>();
  private long probesExecuted;

  public boolean isAvailable(TargetIdentity target, String capability, Probe probe) throws Exception {
    Key key = new Key(Objects.requireNonNull(target, "target"), Objects.requireNonNull(capability, "capability"));
    Boolean known = results.get(key);
    if (known != null) {
      return known;
    }
    probesExecuted++;
    boolean available = Objects.requireNonNull(probe, "probe").run();
    results.put(key, available);
    return available;
  }

  public long probesExecuted() {
    return probesExecuted;
  }

  private static final class Key {
    private final TargetIdentity target;
    private final String capability;

    private Key(TargetIdentity target, String capability) {
      this.target = target;
      this.capability = capability;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Key)) {
        return false;
      }
      Key other = (Key) o;
      return target.equals(other.target) && capability.equals(other.capability);
    }

    @Override
    public int hashCode() {
      return Objects.hash(target, capability);
    }
  }
}
