package com.pocketdb.web;

import com.mongodb.MongoException;
import com.pocketdb.api.ErrorResponse;
import com.pocketdb.registry.NotConnectedException;
import com.pocketdb.service.ConnectFailedException;
import com.pocketdb.service.ConnectTimeoutException;
import com.pocketdb.tunnel.AuthUnsupportedException;
import com.pocketdb.tunnel.TunnelException;
import io.lettuce.core.RedisException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.sql.SQLException;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Input validation failed", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Malformed request body", ex.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler(NotConnectedException.class)
    public ResponseEntity<ErrorResponse> handleNotConnected(NotConnectedException ex) {
        return respond(HttpStatus.CONFLICT, "NOT_CONNECTED", ex.getMessage(), null);
    }

    @ExceptionHandler({ConnectFailedException.class, TunnelException.class})
    public ResponseEntity<ErrorResponse> handleConnectFailed(RuntimeException ex) {
        log.warn("Connect failed: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "CONNECTION_FAILED", ex.getMessage(), causeMessage(ex));
    }

    @ExceptionHandler(ConnectTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleConnectTimeout(ConnectTimeoutException ex) {
        return respond(HttpStatus.GATEWAY_TIMEOUT, "CONNECT_TIMEOUT", ex.getMessage(), null);
    }

    @ExceptionHandler(AuthUnsupportedException.class)
    public ResponseEntity<ErrorResponse> handleAuthUnsupported(AuthUnsupportedException ex) {
        return respond(HttpStatus.BAD_REQUEST, "AUTH_UNSUPPORTED", ex.getMessage(), null);
    }

    @ExceptionHandler(SQLException.class)
    public ResponseEntity<ErrorResponse> handleSQLException(SQLException ex) {
        log.error("Database error occurred (SQLState: {}, Error Code: {}): {}", ex.getSQLState(), ex.getErrorCode(), ex.getMessage());
        String details = ex.getSQLState() != null ? "SQLState " + ex.getSQLState() + ", error code " + ex.getErrorCode() : null;
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "QUERY_ERROR", ex.getMessage(), details);
    }

    @ExceptionHandler({RedisException.class, MongoException.class})
    public ResponseEntity<ErrorResponse> handleStoreException(RuntimeException ex) {
        log.error("Store error occurred: {}", ex.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "QUERY_ERROR", ex.getMessage(), causeMessage(ex));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), null);
    }

    @ExceptionHandler(UnsupportedOperationException.class)
    public ResponseEntity<ErrorResponse> handleUnsupportedOperation(UnsupportedOperationException ex) {
        return respond(HttpStatus.BAD_REQUEST, "UNSUPPORTED_OPERATION", ex.getMessage(), null);
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFoundException(Exception ex) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", "Not found", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", "An unexpected error occurred", ex.getMessage());
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message, String details) {
        ErrorResponse error = ErrorResponse.builder()
                .code(code)
                .message(message)
                .details(details)
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build();
        return ResponseEntity.status(status).body(error);
    }

    private static String causeMessage(Throwable ex) {
        Throwable cause = ex.getCause();
        return cause != null && cause != ex ? cause.getMessage() : null;
    }
}
