package dev.henneberger.vertx.sync.core;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public final class PreflightReports {

  private PreflightReports() {
  }

  public static String describeFailure(PreflightReport report) {
    Objects.requireNonNull(report, "report");
    if (report.ok()) {
      return "Preflight passed";
    }
    return "Preflight failed: " + describe(report.errors());
  }

  public static String describeWarnings(PreflightReport report) {
    Objects.requireNonNull(report, "report");
    return describe(report.warnings());
  }

  private static String describe(List<PreflightIssue> issues) {
    return issues.stream()
      .map(PreflightReports::formatIssue)
      .collect(Collectors.joining("; "));
  }

  private static String formatIssue(PreflightIssue issue) {
    StringBuilder sb = new StringBuilder();
    sb.append('[').append(issue.code()).append("] ").append(issue.message());
    if (issue.remediation() != null && !issue.remediation().isBlank()) {
      sb.append(" Remediation: ").append(issue.remediation());
    }
    return sb.toString();
  }
}
