package dev.henneberger.vertx.sync.core;

/**
 * Wall clock and sleeping used for polling windows, keepalive cadence and snapshot intervals.
 */
public interface SyncClock {

  SyncClock SYSTEM = new SyncClock() {
    @Override
    public long millis() {
      return System.currentTimeMillis();
    }

    @Override
    public void sleep(long millis) throws InterruptedException {
      if (millis > 0) {
        Thread.sleep(millis);
      }
    }
  };

  long millis();

  void sleep(long millis) throws InterruptedException;
}
