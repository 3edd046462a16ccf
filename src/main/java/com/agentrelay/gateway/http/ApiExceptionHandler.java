package com.agentrelay.gateway.http;

import com.agentrelay.registry.AgentNotFoundException;
import com.agentrelay.resilience.CircuitOpenException;
import com.agentrelay.resilience.RateLimitExceededException;
import com.agentrelay.shared.DelegationException;
import com.agentrelay.transport.CommunicationException;
import com.agentrelay.workflow.FallbackExhaustedException;
import com.agentrelay.workflow.WorkflowValidationException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({IllegalArgumentException.class, WorkflowValidationException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> badRequest(Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, ex, request);
    }

    @ExceptionHandler(AgentNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(AgentNotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, ex, request);
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<Map<String, Object>> rateLimited(RateLimitExceededException ex, HttpServletRequest request) {
        var response = respond(HttpStatus.TOO_MANY_REQUESTS, ex, request);
        response.getBody().put("reset_at", ex.resetAt().toString());
        return response;
    }

    @ExceptionHandler(CircuitOpenException.class)
    public ResponseEntity<Map<String, Object>> circuitOpen(CircuitOpenException ex, HttpServletRequest request) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex, request);
    }

    @ExceptionHandler(FallbackExhaustedException.class)
    public ResponseEntity<Map<String, Object>> exhausted(FallbackExhaustedException ex, HttpServletRequest request) {
        var response = respond(HttpStatus.BAD_GATEWAY, ex, request);
        response.getBody().put("attempts", ex.attempts());
        return response;
    }

    @ExceptionHandler(CommunicationException.class)
    public ResponseEntity<Map<String, Object>> communication(CommunicationException ex, HttpServletRequest request) {
        var response = respond(HttpStatus.BAD_GATEWAY, ex, request);
        response.getBody().put("kind", ex.kind().name());
        return response;
    }

    @ExceptionHandler(DelegationException.class)
    public ResponseEntity<Map<String, Object>> delegation(DelegationException ex, HttpServletRequest request) {
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> unknown(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, errorType={}", path(request), method(request),
                ex.getClass().getSimpleName(), ex);
        var body = new LinkedHashMap<String, Object>();
        body.put("error", "InternalError");
        body.put("message", "internal error");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private ResponseEntity<Map<String, Object>> respond(HttpStatus status, Exception ex, HttpServletRequest request) {
        var message = truncate(ex.getMessage(), 300);
        log.warn("HTTP_ERROR path={}, method={}, status={}, errorType={}, errorMessage={}",
                path(request), method(request), status.value(), ex.getClass().getSimpleName(), message);
        var body = new LinkedHashMap<String, Object>();
        body.put("error", ex.getClass().getSimpleName());
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }

    private static String path(HttpServletRequest request) {
        return request == null || request.getRequestURI() == null ? "-" : request.getRequestURI();
    }

    private static String method(HttpServletRequest request) {
        return request == null || request.getMethod() == null ? "-" : request.getMethod();
    }

    private static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) return text;
        return text.substring(0, maxLength);
    }
}
