package com.privacygraph.main.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(EngineNotReadyException.class)
    public ResponseEntity<Map<String, Object>> handleEngineNotReady(EngineNotReadyException e, HttpServletRequest request) {
        log.warn("Engine not ready: {}", e.getMessage());
        return errorResponse(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", e.getMessage(), request);
    }

    @ExceptionHandler(EmbeddingException.class)
    public ResponseEntity<Map<String, Object>> handleEmbeddingException(EmbeddingException e, HttpServletRequest request) {
        log.error("Embedding model error: {}", e.getMessage(), e);
        return errorResponse(HttpStatus.SERVICE_UNAVAILABLE, "Embedding Unavailable", e.getMessage(), request);
    }

    @ExceptionHandler(GraphExtractionException.class)
    public ResponseEntity<Map<String, Object>> handleGraphExtractionException(GraphExtractionException e,
                                                                              HttpServletRequest request) {
        log.warn("Graph extraction failed: {}", e.getMessage());
        return errorResponse(HttpStatus.UNPROCESSABLE_ENTITY, "Unprocessable Document", e.getMessage(), request);
    }

    @ExceptionHandler(OntologyViolationException.class)
    public ResponseEntity<Map<String, Object>> handleOntologyViolation(OntologyViolationException e,
                                                                       HttpServletRequest request) {
        log.warn("Ontology violation: {}", e.getMessage());
        return errorResponse(HttpStatus.UNPROCESSABLE_ENTITY, "Ontology Violation", e.getMessage(), request);
    }

    @ExceptionHandler(GraphOperationException.class)
    public ResponseEntity<Map<String, Object>> handleGraphOperationException(GraphOperationException e,
                                                                             HttpServletRequest request) {
        log.error("Graph storage error: {}", e.getMessage(), e);
        return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Graph Storage Error", e.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(MethodArgumentNotValidException e,
                                                                         HttpServletRequest request) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        log.warn("Request validation failed: {}", message);
        return errorResponse(HttpStatus.BAD_REQUEST, "Bad Request", message, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException e,
                                                                    HttpServletRequest request) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return errorResponse(HttpStatus.BAD_REQUEST, "Bad Request", "Malformed request body", request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException e,
                                                                  HttpServletRequest request) {
        String message = "Invalid value '" + e.getValue() + "' for parameter " + e.getName();
        log.warn("Request parameter mismatch: {}", message);
        return errorResponse(HttpStatus.BAD_REQUEST, "Bad Request", message, request);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MissingServletRequestPartException.class})
    public ResponseEntity<Map<String, Object>> handleMissingRequestInput(Exception e, HttpServletRequest request) {
        log.warn("Missing request input: {}", e.getMessage());
        return errorResponse(HttpStatus.BAD_REQUEST, "Bad Request", e.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(IllegalArgumentException e,
                                                                              HttpServletRequest request) {
        log.error("Invalid argument: {}", e.getMessage(), e);
        return errorResponse(HttpStatus.BAD_REQUEST, "Bad Request", e.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception e, HttpServletRequest request) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", request);
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }

    private static ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String error, String message,
                                                                     HttpServletRequest request) {
        // LinkedHashMap: message may be null, Map.of rejects nulls
        Map<String, Object> errorResponse = new LinkedHashMap<>();
        errorResponse.put("timestamp", LocalDateTime.now());
        errorResponse.put("status", status.value());
        errorResponse.put("error", error);
        errorResponse.put("message", message);
        errorResponse.put("path", request != null ? request.getRequestURI() : "N/A");
        return ResponseEntity.status(status).body(errorResponse);
    }
}
