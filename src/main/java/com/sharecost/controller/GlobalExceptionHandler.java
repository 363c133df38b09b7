package com.sharecost.controller;

import com.sharecost.exception.AuthForbiddenException;
import com.sharecost.exception.AuthInvalidException;
import com.sharecost.exception.ShareCostException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Maps failures to a JSON body of {@code error}, {@code message} and {@code status}. */
@RestControllerAdvice
public class GlobalExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(ShareCostException.class)
  public ResponseEntity<Map<String, Object>> handleShareCost(ShareCostException e) {
    Map<String, Object> body = body(e.getStatus(), e.getCode(), e.getMessage());
    if (e instanceof AuthInvalidException) {
      body.put("reason", ((AuthInvalidException) e).getReason().name().toLowerCase(Locale.ROOT));
    } else if (e instanceof AuthForbiddenException) {
      body.put("capability", ((AuthForbiddenException) e).getCapability().wireName());
    }
    return ResponseEntity.status(e.getStatus()).body(body);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> handleValidationErrors(MethodArgumentNotValidException e) {
    String message = e.getBindingResult().getFieldErrors().stream()
        .map(error -> error.getField() + " " + error.getDefaultMessage())
        .collect(Collectors.joining(", "));
    return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "validation_error", message));
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
    String message = "Invalid value for " + e.getName() + ": " + e.getValue();
    return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "validation_error", message));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
    return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "validation_error", "Malformed request body"));
  }

  // ResponseStatusException and Spring MVC's own status exceptions
  @ExceptionHandler(ErrorResponseException.class)
  public ResponseEntity<Map<String, Object>> handleErrorResponse(ErrorResponseException e) {
    HttpStatusCode status = e.getStatusCode();
    String code = status.value() == HttpStatus.NOT_FOUND.value() ? "not_found" : "error";
    return ResponseEntity.status(status).body(body(status, code, e.getBody().getDetail()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGenericException(Exception e) {
    log.error("Unexpected error", e);
    return ResponseEntity.internalServerError()
        .body(body(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "An unexpected error occurred"));
  }

  private static Map<String, Object> body(HttpStatusCode status, String code, String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", code);
    body.put("message", message);
    body.put("status", status.value());
    return body;
  }
}
