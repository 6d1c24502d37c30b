package com.remindme.backend.command.service;

import java.util.List;
import java.util.stream.Collectors;

/** User input that cannot be executed. Never retried and never reaches storage. */
public class CommandValidationException extends RuntimeException {

  private final List<FieldViolation> violations;

  public CommandValidationException(List<FieldViolation> violations) {
    super(describe(violations));
    this.violations = List.copyOf(violations);
  }

  public CommandValidationException(String field, String rule, String message) {
    this(List.of(new FieldViolation(field, rule, message)));
  }

  public List<FieldViolation> getViolations() {
    return violations;
  }

  public FieldViolation firstViolation() {
    return violations.get(0);
  }

  private static String describe(List<FieldViolation> violations) {
    if (violations == null || violations.isEmpty()) {
      throw new IllegalArgumentException("At least one violation is required");
    }
    return violations.stream()
        .map(FieldViolation::toString)
        .collect(Collectors.joining("; ", "Invalid command: ", ""));
  }
}
