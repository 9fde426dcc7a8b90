package com.github.spud.sample.alexa.interfaces.rest;

import com.github.spud.sample.alexa.domain.error.AuthException;
import com.github.spud.sample.alexa.domain.error.BackendException;
import com.github.spud.sample.alexa.domain.error.NoConversationException;
import com.github.spud.sample.alexa.domain.error.NotFoundException;
import com.github.spud.sample.alexa.domain.error.ProtocolException;
import com.github.spud.sample.alexa.domain.error.ResponseTimeoutException;
import com.github.spud.sample.alexa.domain.error.TransportException;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @Data
  @Builder
  public static class ErrorResponse {
    private String code;
    private String message;
    private OffsetDateTime timestamp;
    private Map<String, Object> details;
  }

  @ExceptionHandler(AuthException.class)
  public ResponseEntity<ErrorResponse> handleAuth(AuthException e) {
    log.warn("Authentication failed: {}", e.getMessage());
    return respond(HttpStatus.UNAUTHORIZED, "AUTH_FAILED", e.getMessage(), null);
  }

  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
    return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage(), null);
  }

  @ExceptionHandler(ResponseTimeoutException.class)
  public ResponseEntity<ErrorResponse> handleTimeout(ResponseTimeoutException e) {
    return respond(HttpStatus.GATEWAY_TIMEOUT, "RESPONSE_TIMEOUT", e.getMessage(),
      Map.of("timeoutMillis", e.getTimeout().toMillis()));
  }

  @ExceptionHandler(NoConversationException.class)
  public ResponseEntity<ErrorResponse> handleNoConversation(NoConversationException e) {
    return respond(HttpStatus.CONFLICT, "NO_CONVERSATION", e.getMessage(), null);
  }

  @ExceptionHandler(BackendException.class)
  public ResponseEntity<ErrorResponse> handleBackend(BackendException e) {
    log.error("Alexa backend error: {}", e.getMessage());
    Map<String, Object> details = new HashMap<>();
    details.put("status", e.getStatus());
    details.put("body", e.getBody());
    return respond(HttpStatus.BAD_GATEWAY, "BACKEND_ERROR", e.getMessage(), details);
  }

  @ExceptionHandler(ProtocolException.class)
  public ResponseEntity<ErrorResponse> handleProtocol(ProtocolException e) {
    log.error("Unexpected Alexa response format: {}", e.getMessage());
    return respond(HttpStatus.BAD_GATEWAY, "PROTOCOL_ERROR", e.getMessage(), null);
  }

  @ExceptionHandler(TransportException.class)
  public ResponseEntity<ErrorResponse> handleTransport(TransportException e) {
    log.error("Alexa backend unreachable: {}", e.getMessage());
    return respond(HttpStatus.BAD_GATEWAY, "TRANSPORT_ERROR", e.getMessage(), null);
  }

  @ExceptionHandler(WebExchangeBindException.class)
  public ResponseEntity<ErrorResponse> handleWebExchangeBind(WebExchangeBindException e) {
    Map<String, String> fieldErrors = new HashMap<>();
    for (FieldError error : e.getBindingResult().getFieldErrors()) {
      fieldErrors.put(error.getField(), error.getDefaultMessage());
    }
    return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request validation failed",
      Map.of("fieldErrors", fieldErrors));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
    return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", e.getMessage(), null);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
    log.error("Unhandled exception", e);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
      "An unexpected error occurred", createDetailsMap(e));
  }

  private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message,
    Map<String, Object> details) {
    ErrorResponse error = ErrorResponse.builder()
        .code(code)
        .message(message)
        .timestamp(OffsetDateTime.now())
        .details(details)
        .build();
    return ResponseEntity.status(status).body(error);
  }

  private Map<String, Object> createDetailsMap(Exception e) {
    Map<String, Object> details = new HashMap<>();
    details.put("exception", e.getClass().getSimpleName());
    details.put("message", e.getMessage());
    if (e.getCause() != null) {
      details.put("cause", e.getCause().getMessage());
    }
    return details;
  }
}
