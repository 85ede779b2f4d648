package com.traceradar.api.controller;

import com.traceradar.analysis.AnalysisNotAvailableException;
import com.traceradar.analysis.InvalidTransactionHashException;
import com.traceradar.api.dto.ErrorBody;
import com.traceradar.ingestion.adapter.RpcException;
import com.traceradar.ingestion.adapter.TraceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Optional;

/**
 * Maps validation and analysis failures to ErrorBody (error, message, timestamp).
 */
@Slf4j
@RestControllerAdvice
public class AnalysisExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = userFacingMessage(error, ex);
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(InvalidTransactionHashException.class)
    public ResponseEntity<ErrorBody> handleInvalidHash(InvalidTransactionHashException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_TX_HASH", ex.getMessage()));
    }

    @ExceptionHandler(TraceNotFoundException.class)
    public ResponseEntity<ErrorBody> handleTraceNotFound(TraceNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of("TRACE_NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(AnalysisNotAvailableException.class)
    public ResponseEntity<ErrorBody> handleAnalysisNotAvailable(AnalysisNotAvailableException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of("ANALYSIS_NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(RpcException.class)
    public ResponseEntity<ErrorBody> handleRpc(RpcException ex) {
        log.warn("Trace RPC failure: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ErrorBody.of("RPC_ERROR", ex.getMessage()));
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        return switch (errorCode) {
            case "INVALID_TX_HASH" -> "Transaction hash must be 0x followed by 64 hex characters";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
