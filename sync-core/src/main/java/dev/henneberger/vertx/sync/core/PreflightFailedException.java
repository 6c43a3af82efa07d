package dev.henneberger.vertx.sync.core;

import java.util.Objects;

public final class PreflightFailedException extends SyncException {

  private final PreflightReport report;

  public PreflightFailedException(PreflightReport report) {
    super(PreflightReports.describeFailure(Objects.requireNonNull(report, "report")));
    this.report = report;
  }

  public PreflightReport report() {
    return report;
  }
}
