package dao.fhe.settle.controller;

import dao.fhe.settle.exception.DecryptionUnavailableException;
import dao.fhe.settle.exception.LedgerRejectedException;
import dao.fhe.settle.exception.NetworkTransientException;
import dao.fhe.settle.exception.QuorumNotMetException;
import dao.fhe.settle.exception.TypeMismatchException;
import dao.fhe.settle.exception.UnauthorizedAttestationException;
import dao.fhe.settle.exception.UnauthorizedFinalizerException;
import dao.fhe.settle.exception.UnsupportedTagException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

/**
 * Maps engine exceptions to JSON error bodies.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", details);
    }

    @ExceptionHandler({TypeMismatchException.class, UnsupportedTagException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(RuntimeException ex) {
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler({UnauthorizedAttestationException.class, UnauthorizedFinalizerException.class})
    public ResponseEntity<Map<String, Object>> handleUnauthorized(RuntimeException ex) {
        log.warn("Unauthorized request: {}", ex.getMessage());
        return error(HttpStatus.FORBIDDEN, "UNAUTHORIZED", ex.getMessage());
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NoSuchElementException ex) {
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(QuorumNotMetException.class)
    public ResponseEntity<Map<String, Object>> handleQuorum(QuorumNotMetException ex) {
        return error(HttpStatus.CONFLICT, "QUORUM_NOT_MET", ex.getMessage());
    }

    @ExceptionHandler(LedgerRejectedException.class)
    public ResponseEntity<Map<String, Object>> handleLedgerRejected(LedgerRejectedException ex) {
        log.warn("Ledger rejected request: {}", ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "LEDGER_REJECTED", ex.getMessage());
    }

    @ExceptionHandler({NetworkTransientException.class, DecryptionUnavailableException.class})
    public ResponseEntity<Map<String, Object>> handleUnavailable(RuntimeException ex) {
        log.warn("Upstream unavailable: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "UPSTREAM_UNAVAILABLE", ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ERROR");
        body.put("code", code);
        body.put("error", message);
        return ResponseEntity.status(status).body(body);
    }
}
