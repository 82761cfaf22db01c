package com.chicu.riskwatch.web.controller.api;

import com.chicu.riskwatch.common.exception.RiskWatchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiErrorHandler {

    @ExceptionHandler(RiskWatchException.class)
    public ResponseEntity<Map<String, Object>> handleDomain(RiskWatchException e, HttpServletRequest req) {
        HttpStatus status = statusOf(e.getErrorCode());
        if (status.is5xxServerError()) {
            log.error("{} at {}: [{}] {}", status.value(), safePath(req), e.getErrorCode(), safeMsg(e), e);
        } else {
            log.warn("{} at {}: [{}] {}", status.value(), safePath(req), e.getErrorCode(), safeMsg(e));
        }
        return build(status.value(), e.getErrorCode(), e, req);
    }

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e, HttpServletRequest req) {
        log.warn("400 Bad Request at {}: {}", safePath(req), e.toString());
        return build(400, "ERR-REQUEST", e, req);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<Map<String, Object>> handleMethodNotAllowed(HttpRequestMethodNotSupportedException e,
                                                                      HttpServletRequest req) {
        log.warn("405 Method Not Allowed at {}: {}", safePath(req), e.getMethod());
        return build(405, "ERR-REQUEST", e, req);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleResponseStatus(ResponseStatusException e,
                                                                    HttpServletRequest req) {
        int code = e.getStatusCode().value();
        if (code >= 500) {
            log.error("{} at {}: {}", code, safePath(req), safeMsg(e), e);
        } else {
            log.warn("{} at {}: {}", code, safePath(req), e.getReason());
        }
        return build(code, "ERR-REQUEST", e, req);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handle(Exception e, HttpServletRequest req) {
        log.error("500 at {}: {}", safePath(req), safeMsg(e), e);
        return build(500, "ERR-INTERNAL", e, req);
    }

    // ---------- helpers ----------

    static HttpStatus statusOf(String errorCode) {
        if (errorCode == null) return HttpStatus.INTERNAL_SERVER_ERROR;
        return switch (errorCode) {
            case "ERR-SCHEMA", "ERR-DATA" -> HttpStatus.UNPROCESSABLE_ENTITY;
            case "ERR-INPUT" -> HttpStatus.BAD_REQUEST;
            case "ERR-ARTIFACT" -> HttpStatus.SERVICE_UNAVAILABLE;
            case "ERR-CONFLICT" -> HttpStatus.CONFLICT;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private ResponseEntity<Map<String, Object>> build(int status, String code, Exception e, HttpServletRequest req) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status);
        body.put("code", code);
        body.put("message", e instanceof ResponseStatusException rse && rse.getReason() != null
                ? rse.getReason() : safeMsg(e));
        body.put("path", safePath(req));
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }

    private String safeMsg(Throwable e) {
        String m = (e != null ? e.getMessage() : null);
        return (m != null && !m.isBlank()) ? m : (e != null ? e.getClass().getSimpleName() : "Error");
    }

    private String safePath(HttpServletRequest req) {
        return req != null ? req.getRequestURI() : "/";
    }
}
