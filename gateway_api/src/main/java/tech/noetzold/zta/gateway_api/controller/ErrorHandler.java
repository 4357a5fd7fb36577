package tech.noetzold.zta.gateway_api.controller;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import tech.noetzold.zta.gateway_api.model.DecisionCancelledException;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

@Slf4j
@RestControllerAdvice
public class ErrorHandler {

    @ExceptionHandler(TimeoutException.class)
    @ResponseStatus(HttpStatus.GATEWAY_TIMEOUT)
    public Map<String, Object> handleTimeout(TimeoutException ex) {
        return body("UPSTREAM_TIMEOUT", "An upstream service timed out");
    }

    @ExceptionHandler(DecisionCancelledException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleCancelled(DecisionCancelledException ex) {
        log.warn("Decision cancelled at stage {}", ex.getStage());
        return body("DECISION_CANCELLED", ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class,
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(Exception ex) {
        return body("BAD_REQUEST", String.valueOf(ex.getMessage()));
    }

    private static Map<String, Object> body(String code, String message) {
        Map<String, Object> out = new HashMap<>();
        out.put("code", code);
        out.put("message", message);
        String traceId = MDC.get("trace_id");
        if (traceId != null) {
            out.put("trace_id", traceId);
        }
        return out;
    }
}
