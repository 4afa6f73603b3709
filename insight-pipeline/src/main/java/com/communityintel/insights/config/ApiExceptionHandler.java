package com.communityintel.insights.config;

import com.communityintel.insights.exception.InsightNotFoundException;
import com.communityintel.insights.exception.InvalidJobConfigException;
import com.communityintel.insights.exception.JobNotFoundException;
import com.communityintel.insights.exception.PipelineException;
import com.communityintel.insights.exception.RunNotFoundException;
import com.communityintel.insights.exception.SchedulerSaturatedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps pipeline exceptions to {@code {error, code, timestamp}} responses.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidJobConfigException.class)
    public ResponseEntity<Map<String, Object>> invalidConfig(InvalidJobConfigException e) {
        return error(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler({JobNotFoundException.class, RunNotFoundException.class, InsightNotFoundException.class})
    public ResponseEntity<Map<String, Object>> notFound(PipelineException e) {
        return error(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(SchedulerSaturatedException.class)
    public ResponseEntity<Map<String, Object>> saturated(SchedulerSaturatedException e) {
        log.warn("Rejected job submission: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException e) {
        return body(HttpStatus.BAD_REQUEST, "Malformed request body: " + e.getMostSpecificCause().getMessage(),
                "INVALID_CONFIG");
    }

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<Map<String, Object>> pipeline(PipelineException e) {
        log.error("Unhandled pipeline error: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, PipelineException e) {
        return body(status, e.getMessage(), e.getErrorCode());
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String message, String code) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("code", code);
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }
}
