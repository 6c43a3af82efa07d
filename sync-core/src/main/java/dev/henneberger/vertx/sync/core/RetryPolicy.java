package dev.henneberger.vertx.sync.core;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded exponential backoff for reopening a source connection after a transient failure.
 * Which failures qualify is decided by the {@link ErrorClassifier}.
 */
public final class RetryPolicy {

  public static final long DEFAULT_MAX_ATTEMPTS = 3;

  private Duration initialDelay = Duration.ofSeconds(1);
  private Duration maxDelay = Duration.ofSeconds(30);
  private double multiplier = 2.0d;
  private double jitter = 0.2d;
  private long maxAttempts;
  private boolean enabled;

  private RetryPolicy(boolean enabled, long maxAttempts) {
    this.enabled = enabled;
    this.maxAttempts = maxAttempts;
  }

  public static RetryPolicy disabled() {
    return new RetryPolicy(false, 0);
  }

  public static RetryPolicy exponentialBackoff() {
    return new RetryPolicy(true, DEFAULT_MAX_ATTEMPTS);
  }

  public static RetryPolicy exponentialBackoff(long maxAttempts) {
    return new RetryPolicy(true, maxAttempts);
  }

  public RetryPolicy copy() {
    RetryPolicy copy = new RetryPolicy(enabled, maxAttempts);
    copy.initialDelay = initialDelay;
    copy.maxDelay = maxDelay;
    copy.multiplier = multiplier;
    copy.jitter = jitter;
    return copy;
  }

  public RetryPolicy setInitialDelay(Duration initialDelay) {
    this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
    return this;
  }

  public RetryPolicy setMaxDelay(Duration maxDelay) {
    this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
    return this;
  }

  public RetryPolicy setMultiplier(double multiplier) {
    this.multiplier = multiplier;
    return this;
  }

  public RetryPolicy setJitter(double jitter) {
    if (jitter < 0.0d || jitter > 1.0d) {
      throw new IllegalArgumentException("jitter must be between 0.0 and 1.0");
    }
    this.jitter = jitter;
    return this;
  }

  public RetryPolicy setMaxAttempts(long maxAttempts) {
    this.maxAttempts = maxAttempts;
    return this;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public Duration getInitialDelay() {
    return initialDelay;
  }

  public Duration getMaxDelay() {
    return maxDelay;
  }

  public double getMultiplier() {
    return multiplier;
  }

  public double getJitter() {
    return jitter;
  }

  public long getMaxAttempts() {
    return maxAttempts;
  }

  /**
   * @param attempt the number of the attempt that just failed, starting at 1
   */
  public boolean shouldRetry(Throwable error, long attempt, ErrorClassifier classifier) {
    if (!enabled || !classifier.isTransient(error)) {
      return false;
    }
    return attempt <= maxAttempts;
  }

  public long computeDelayMillis(long attempt) {
    double base = initialDelay.toMillis() * Math.pow(Math.max(1.0d, multiplier), Math.max(0, attempt - 1));
    long capped = Math.min((long) base, maxDelay.toMillis());
    if (jitter == 0.0d) {
      return capped;
    }
    long delta = (long) (capped * jitter);
    long min = Math.max(0L, capped - delta);
    long max = capped + delta;
    return ThreadLocalRandom.current().nextLong(min, max + 1);
  }

  public void validate() {
    if (initialDelay.isNegative()) {
      throw new IllegalArgumentException("initialDelay must be >= 0");
    }
    if (maxDelay.compareTo(initialDelay) < 0) {
      throw new IllegalArgumentException("maxDelay must be >= initialDelay");
    }
    if (multiplier < 1.0d) {
      throw new IllegalArgumentException("multiplier must be >= 1.0");
    }
    if (enabled && maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1; retries are always bounded");
    }
  }
}
