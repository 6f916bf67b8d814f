package com.boxline.api.common;

import com.boxline.billing.domain.BillingException;
import com.boxline.billing.domain.ExternalServiceException;
import com.boxline.billing.domain.InvalidStateException;
import com.boxline.billing.domain.NotFoundException;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<Map<String, Object>> notFound(NotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ex);
  }

  @ExceptionHandler(InvalidStateException.class)
  public ResponseEntity<Map<String, Object>> conflict(InvalidStateException ex) {
    return error(HttpStatus.CONFLICT, ex);
  }

  @ExceptionHandler(ExternalServiceException.class)
  public ResponseEntity<Map<String, Object>> unavailable(ExternalServiceException ex) {
    log.warn("External service failed. service={} err={}", ex.service(), ex.getMessage());
    return error(HttpStatus.SERVICE_UNAVAILABLE, ex);
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<Map<String, Object>> forbidden(AccessDeniedException ex) {
    return body(HttpStatus.FORBIDDEN, "forbidden", ex.getMessage());
  }

  @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
  public ResponseEntity<Map<String, Object>> badRequest(RuntimeException ex) {
    return body(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException ex) {
    return body(HttpStatus.BAD_REQUEST, "bad_request", "malformed request body");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
    Map<String, String> fields = new HashMap<>();
    for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
      fields.put(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
    }
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
        "status", "error",
        "reason", "validation_error",
        "message", "invalid_request",
        "fields", fields,
        "ts", Instant.now().toString()
    ));
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<Map<String, Object>> validation(ConstraintViolationException ex) {
    return body(HttpStatus.BAD_REQUEST, "validation_error", ex.getMessage());
  }

  private static ResponseEntity<Map<String, Object>> error(HttpStatus status, BillingException ex) {
    return body(status, ex.reason(), ex.getMessage());
  }

  private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String reason, String message) {
    return ResponseEntity.status(status).body(Map.of(
        "status", "error",
        "reason", reason,
        "message", message == null ? reason : message,
        "ts", Instant.now().toString()
    ));
  }
}
