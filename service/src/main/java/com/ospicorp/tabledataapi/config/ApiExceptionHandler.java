package com.ospicorp.tabledataapi.config;

import static com.ospicorp.tabledataapi.config.RequestDescriptions.clientIp;
import static com.ospicorp.tabledataapi.config.RequestDescriptions.uriWithQuery;

import com.ospicorp.tabledataapi.tables.exception.InvalidParameterException;
import com.ospicorp.tabledataapi.tables.exception.TableDataException;
import com.ospicorp.tabledataapi.tables.model.ErrorEnvelope;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Renders every failure as {@code {error, details, status: "error"}}.
 *
 * <p>Application failures (validation, table lookup, database) always answer 500. Framework
 * exceptions that carry their own status, such as an unmapped path or a wrong method, keep it.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);
  private static final String GENERIC_ERROR = "Processing error";

  @ExceptionHandler(TableDataException.class)
  public ResponseEntity<ErrorEnvelope> handleTableData(TableDataException ex,
      HttpServletRequest request) {
    HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
    if (ex instanceof InvalidParameterException invalid) {
      log.warn("Request {} {} from {} rejected with status {} (code {}): {}",
          request.getMethod(), uriWithQuery(request), clientIp(request), status.value(),
          invalid.errorCode(), ex.getMessage());
    } else if (ex.clientFault()) {
      log.warn("Request {} {} from {} rejected with status {}: {}",
          request.getMethod(), uriWithQuery(request), clientIp(request), status.value(),
          ex.getMessage());
    } else {
      logServerError(status, ex, request);
    }
    return envelope(status, ErrorEnvelope.of(ex.error(), ex.details()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorEnvelope> handleUnexpected(Exception ex, HttpServletRequest request) {
    HttpStatusCode status = HttpStatus.INTERNAL_SERVER_ERROR;
    if (ex instanceof ErrorResponse errorResponse) {
      status = errorResponse.getStatusCode();
    }
    if (status.is5xxServerError()) {
      logServerError(status, ex, request);
    } else {
      log.warn("Request {} {} from {} returned status {}: {}",
          request.getMethod(), uriWithQuery(request), clientIp(request), status.value(),
          ex.getMessage());
    }
    return envelope(status, ErrorEnvelope.of(GENERIC_ERROR, ex.getMessage()));
  }

  private ResponseEntity<ErrorEnvelope> envelope(HttpStatusCode status, ErrorEnvelope body) {
    return ResponseEntity.status(status)
        .contentType(MediaType.APPLICATION_JSON)
        .body(body);
  }

  private void logServerError(HttpStatusCode status, Exception ex, HttpServletRequest request) {
    String errorMessage = ex.getMessage();
    if (errorMessage == null || errorMessage.isBlank()) {
      errorMessage = ex.getClass().getName();
    }
    log.error("Request {} {} from {} failed with status {}: {}",
        request.getMethod(),
        uriWithQuery(request),
        clientIp(request),
        status.value(),
        errorMessage,
        ex);
  }
}
