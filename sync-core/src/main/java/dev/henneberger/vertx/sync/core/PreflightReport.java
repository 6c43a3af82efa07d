package dev.henneberger.vertx.sync.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public final class PreflightReport {
  private final List<PreflightIssue> issues;

  public PreflightReport(List<PreflightIssue> issues) {
    Objects.requireNonNull(issues, "issues");
    this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
  }

  public boolean ok() {
    return errors().isEmpty();
  }

  public List<PreflightIssue> issues() {
    return issues;
  }

  public List<PreflightIssue> errors() {
    return withSeverity(PreflightIssue.Severity.ERROR);
  }

  public List<PreflightIssue> warnings() {
    return withSeverity(PreflightIssue.Severity.WARNING);
  }

  private List<PreflightIssue> withSeverity(PreflightIssue.Severity severity) {
    return issues.stream()
      .filter(issue -> issue.severity() == severity)
      .collect(Collectors.toList());
  }
}
