package com.openforge.writecrew.common;

import com.openforge.writecrew.approval.ApprovalAlreadyResolvedException;
import com.openforge.writecrew.approval.ApprovalExpiredException;
import com.openforge.writecrew.approval.ApprovalNotFoundException;
import com.openforge.writecrew.document.ConflictUnresolvableException;
import com.openforge.writecrew.document.DocumentNotFoundException;
import com.openforge.writecrew.document.InvalidChangeException;
import com.openforge.writecrew.permission.AgentPermissionsNotFoundException;
import com.openforge.writecrew.permission.InvalidPermissionsException;
import com.openforge.writecrew.usage.UsageLimitExceededException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders every API failure as
 * {@code {ok:false, status, error, message, path, timestamp}}.
 *
 * Domain exceptions map by type:
 *   not found        → 404
 *   already resolved → 409, overlapping edit → 409
 *   approval expired → 410
 *   invalid input    → 422
 *   usage limit      → 429
 */
@Slf4j
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionAdvice {

    @ExceptionHandler(CollaborationException.class)
    public ResponseEntity<Map<String, Object>> handleDomain(CollaborationException ex, HttpServletRequest request) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            log.error("[Api] {} {} failed: {}", request.getMethod(), request.getRequestURI(), ex.getMessage(), ex);
        }
        return ResponseEntity.status(status).body(body(status, ex.errorCode(), ex.getMessage(), request));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleStatus(ResponseStatusException ex, HttpServletRequest request) {
        HttpStatusCode status = ex.getStatusCode();
        String code = status instanceof HttpStatus known
                ? known.name().toLowerCase()
                : String.valueOf(status.value());
        return ResponseEntity.status(status).body(body(status, code, ex.getReason(), request));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex,
                                                                HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        HttpStatus status = HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(body(status, "validation_failed", message, request));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(body(status, "bad_request", ex.getMessage(), request));
    }

    static HttpStatus statusFor(CollaborationException ex) {
        if (ex instanceof ApprovalNotFoundException
                || ex instanceof AgentPermissionsNotFoundException
                || ex instanceof DocumentNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof ApprovalAlreadyResolvedException || ex instanceof ConflictUnresolvableException) {
            return HttpStatus.CONFLICT;
        }
        if (ex instanceof ApprovalExpiredException) {
            return HttpStatus.GONE;
        }
        if (ex instanceof InvalidPermissionsException || ex instanceof InvalidChangeException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        if (ex instanceof UsageLimitExceededException) {
            return HttpStatus.TOO_MANY_REQUESTS;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static Map<String, Object> body(HttpStatusCode status, String code, String message,
                                            HttpServletRequest request) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("ok", false);
        out.put("status", status.value());
        out.put("error", code);
        out.put("message", message);
        if (request != null) {
            out.put("path", request.getRequestURI());
        }
        out.put("timestamp", Instant.now().toString());
        return out;
    }
}
