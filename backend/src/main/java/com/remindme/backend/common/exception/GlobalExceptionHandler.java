package com.remindme.backend.common.exception;

import com.remindme.backend.command.service.CommandValidationException;
import com.remindme.backend.command.service.FieldViolation;
import com.remindme.backend.guard.service.BudgetExceededException;
import com.remindme.backend.guard.service.CircuitOpenException;
import com.remindme.backend.guard.service.RateLimitedException;
import com.remindme.backend.llm.client.PermanentUpstreamException;
import com.remindme.backend.llm.client.TransientUpstreamException;
import com.remindme.backend.reminder.service.ReminderStoreException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpectedException(Exception ex) {
    log.error("Unhandled exception", ex);
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Unexpected error");
    problem.setDetail("Произошла непредвиденная ошибка. Попробуйте повторить запрос позже.");
    return ResponseEntity.internalServerError().body(problem);
  }

  @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class})
  public ResponseEntity<ProblemDetail> handleValidationErrors(BindException ex) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Validation failed");
    problem.setDetail(
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(
                error ->
                    error.getDefaultMessage() != null
                        ? error.getDefaultMessage()
                        : "Invalid request payload")
            .orElse("Invalid request payload"));
    return ResponseEntity.badRequest().body(problem);
  }

  @ExceptionHandler(CommandValidationException.class)
  public ResponseEntity<ProblemDetail> handleCommandValidation(CommandValidationException ex) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid command");
    problem.setDetail(ex.firstViolation().message());
    List<String> fields = ex.getViolations().stream().map(FieldViolation::field).toList();
    problem.setProperty("fields", fields);
    return ResponseEntity.badRequest().body(problem);
  }

  @ExceptionHandler(RateLimitedException.class)
  public ResponseEntity<ProblemDetail> handleRateLimited(RateLimitedException ex) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.TOO_MANY_REQUESTS);
    problem.setTitle("Too many requests");
    problem.setDetail(ex.getMessage());
    return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(problem);
  }

  @ExceptionHandler({
    CircuitOpenException.class,
    BudgetExceededException.class,
    TransientUpstreamException.class
  })
  public ResponseEntity<ProblemDetail> handleUnavailable(RuntimeException ex) {
    log.warn("Model unavailable: {}", ex.getMessage());
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Model unavailable");
    problem.setDetail(ex.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problem);
  }

  @ExceptionHandler(PermanentUpstreamException.class)
  public ResponseEntity<ProblemDetail> handlePermanentUpstream(PermanentUpstreamException ex) {
    log.warn("Model call failed permanently: {}", ex.getMessage());
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
    problem.setTitle("Model error");
    problem.setDetail(ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(problem);
  }

  @ExceptionHandler(ReminderStoreException.class)
  public ResponseEntity<ProblemDetail> handleStore(ReminderStoreException ex) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Store error");
    problem.setDetail("Хранилище напоминаний недоступно. Попробуйте позже.");
    return ResponseEntity.internalServerError().body(problem);
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ProblemDetail> handleResponseStatusException(ResponseStatusException ex) {
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }
}
