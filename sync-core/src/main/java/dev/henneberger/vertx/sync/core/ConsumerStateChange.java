package dev.henneberger.vertx.sync.core;

public final class ConsumerStateChange {
  private final ConsumerState previousState;
  private final ConsumerState state;
  private final Throwable cause;
  private final long attempt;

  public ConsumerStateChange(ConsumerState previousState,
                             ConsumerState state,
                             Throwable cause,
                             long attempt) {
    this.previousState = previousState;
    this.state = state;
    this.cause = cause;
    this.attempt = attempt;
  }

  public ConsumerState previousState() {
    return previousState;
  }

  public ConsumerState state() {
    return state;
  }

  public Throwable cause() {
    return cause;
  }

  public long attempt() {
    return attempt;
  }

  @Override
  public String toString() {
    return previousState + " -> " + state + (cause == null ? "" : " (" + cause + ")");
  }
}
