package com.hydromat.tooling.controller;

import com.hydromat.tooling.exception.DocumentStorageException;
import com.hydromat.tooling.exception.DuplicateToolCodeException;
import com.hydromat.tooling.exception.InventoryValidationException;
import com.hydromat.tooling.exception.ReadOnlyModeException;
import com.hydromat.tooling.exception.ResourceNotFoundException;
import com.hydromat.tooling.exception.SetPhotoOwnershipException;
import com.hydromat.tooling.exception.ToolCodeValidationException;
import com.hydromat.tooling.exception.ToolInUseException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps inventory exceptions to JSON error bodies:
 * {@code {ok:false, status, error, message, path, timestamp, exception}} where {@code error} is a
 * stable machine-readable code.
 */
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionAdvice {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionAdvice.class);

    @ExceptionHandler(ToolCodeValidationException.class)
    public ResponseEntity<Map<String, Object>> handleToolCode(ToolCodeValidationException ex,
                                                              HttpServletRequest request) {
        Map<String, Object> out = body(HttpStatus.BAD_REQUEST, "invalid_tool_code_input", ex, request);
        out.put("field", ex.getField());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(out);
    }

    @ExceptionHandler(InventoryValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(InventoryValidationException ex,
                                                                HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "validation_failed", ex, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException ex,
                                                                 HttpServletRequest request) {
        Map<String, Object> out = body(HttpStatus.BAD_REQUEST, "validation_failed", ex, request);
        out.put("message", ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining("; ")));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(out);
    }

    @ExceptionHandler(SetPhotoOwnershipException.class)
    public ResponseEntity<Map<String, Object>> handleSetPhoto(SetPhotoOwnershipException ex,
                                                              HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "set_photo_owner_only", ex, request);
    }

    @ExceptionHandler(DuplicateToolCodeException.class)
    public ResponseEntity<Map<String, Object>> handleDuplicate(DuplicateToolCodeException ex,
                                                               HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "duplicate_tool_code", ex, request);
    }

    @ExceptionHandler(ToolInUseException.class)
    public ResponseEntity<Map<String, Object>> handleInUse(ToolInUseException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "tool_assigned", ex, request);
    }

    @ExceptionHandler(ReadOnlyModeException.class)
    public ResponseEntity<Map<String, Object>> handleReadOnly(ReadOnlyModeException ex,
                                                              HttpServletRequest request) {
        return respond(HttpStatus.FORBIDDEN, "read_only_mode", ex, request);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException ex,
                                                              HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "not_found", ex, request);
    }

    @ExceptionHandler(DocumentStorageException.class)
    public ResponseEntity<Map<String, Object>> handleStorage(DocumentStorageException ex,
                                                             HttpServletRequest request) {
        logger.error("Document storage failure on {}", request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "document_storage_failed", ex, request);
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, String code,
                                                               Exception ex, HttpServletRequest request) {
        return ResponseEntity.status(status).body(body(status, code, ex, request));
    }

    static Map<String, Object> body(HttpStatus status, String code, Exception ex, HttpServletRequest request) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("ok", false);
        out.put("status", status.value());
        out.put("error", code);
        out.put("message", ex == null ? null : ex.getMessage());
        if (request != null) {
            out.put("path", request.getRequestURI());
        }
        out.put("timestamp", Instant.now().toString());
        if (ex != null) {
            out.put("exception", ex.getClass().getName());
        }
        return out;
    }
}
