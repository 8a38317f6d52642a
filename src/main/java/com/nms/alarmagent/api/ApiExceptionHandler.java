package com.nms.alarmagent.api;

import com.nms.alarmagent.error.AgentException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.UncheckedIOException;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(AgentException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Map<String, Object> handleAgentFailure(AgentException e) {
        log.error("Agent operation failed: {}", e.getMessage());
        return Map.of(
                "error", e.getClass().getSimpleName(),
                "detail", String.valueOf(e.getMessage())
        );
    }

    @ExceptionHandler(UncheckedIOException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleIo(UncheckedIOException e) {
        log.error("Event log I/O failed", e);
        return Map.of(
                "error", "EVENT_LOG_IO",
                "detail", String.valueOf(e.getMessage())
        );
    }
}
