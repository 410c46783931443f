package com.clapgrow.bridge.api.exception;

import com.clapgrow.bridge.api.chatwoot.ChatwootApiException;
import com.clapgrow.bridge.api.service.BadRequestException;
import com.clapgrow.bridge.api.service.BridgeException;
import com.clapgrow.bridge.api.service.NotFoundException;
import com.clapgrow.bridge.api.service.ServiceUnavailableException;
import com.clapgrow.bridge.api.service.UnauthorizedException;
import com.clapgrow.bridge.api.whatsapp.WhatsAppClientException;
import com.clapgrow.bridge.common.crypto.VaultException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(UnauthorizedException e) {
        log.warn("Unauthorized: {}", e.getMessage());
        return respond(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", e.getMessage());
    }

    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(BadRequestException e) {
        log.warn("Bad request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "invalid payload");
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        log.debug("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(ServiceUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleServiceUnavailable(ServiceUnavailableException e) {
        log.warn("Service unavailable: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "SERVICE_UNAVAILABLE", e.getMessage());
    }

    @ExceptionHandler(BridgeException.class)
    public ResponseEntity<ErrorResponse> handleBridgeException(BridgeException e) {
        log.error("Bridge error: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "BRIDGE_ERROR", e.getMessage());
    }

    @ExceptionHandler(ChatwootApiException.class)
    public ResponseEntity<ErrorResponse> handleChatwootApiException(ChatwootApiException e) {
        log.error("Chatwoot API error: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "CHATWOOT_ERROR", e.getMessage());
    }

    @ExceptionHandler(WhatsAppClientException.class)
    public ResponseEntity<ErrorResponse> handleWhatsAppClientException(WhatsAppClientException e) {
        log.error("WhatsApp client error: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "WHATSAPP_ERROR", e.getMessage());
    }

    @ExceptionHandler(VaultException.class)
    public ResponseEntity<ErrorResponse> handleVaultException(VaultException e) {
        log.error("Credential vault error: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "ENCRYPTION_ERROR", "Encryption error occurred");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationExceptions(MethodArgumentNotValidException e) {
        Map<String, String> errors = new HashMap<>();
        e.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });
        String firstMessage = e.getBindingResult().getAllErrors().isEmpty()
            ? "Validation failed"
            : e.getBindingResult().getAllErrors().get(0).getDefaultMessage();

        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("errorCode", "VALIDATION_ERROR");
        response.put("error", firstMessage);
        response.put("errors", errors);
        response.put("timestamp", LocalDateTime.now());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccessException(DataAccessException e) {
        log.error("Database access error: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "DATABASE_ERROR", "Database error occurred. Please try again.");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR",
            e.getMessage() != null ? e.getMessage() : "An unexpected error occurred");
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String errorCode, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(errorCode, message, LocalDateTime.now()));
    }

    /**
     * Error body for every failed request. {@code error} holds the short message callers match on.
     */
    public static class ErrorResponse {
        private boolean success = false;
        private String errorCode;
        private String error;
        private LocalDateTime timestamp;

        public ErrorResponse(String errorCode, String error, LocalDateTime timestamp) {
            this.errorCode = errorCode;
            this.error = error;
            this.timestamp = timestamp;
        }

        public boolean isSuccess() { return success; }
        public void setSuccess(boolean success) { this.success = success; }
        public String getErrorCode() { return errorCode; }
        public void setErrorCode(String errorCode) { this.errorCode = errorCode; }
        public String getError() { return error; }
        public void setError(String error) { this.error = error; }
        public LocalDateTime getTimestamp() { return timestamp; }
        public void setTimestamp(LocalDateTime timestamp) { this.timestamp = timestamp; }
    }
}
