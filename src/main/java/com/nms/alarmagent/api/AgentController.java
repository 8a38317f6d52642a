package com.nms.alarmagent.api;

import com.nms.alarmagent.orchestrator.AgentOrchestrator;
import com.nms.alarmagent.orchestrator.AgentStatus;
import com.nms.alarmagent.orchestrator.Health;
import com.nms.alarmagent.output.EventSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Thin REST facade over the orchestrator: health, status and operator controls.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class AgentController {

    private final AgentOrchestrator orchestrator;
    private final EventSink eventSink;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        AgentStatus status = orchestrator.status();
        HttpStatus httpStatus = status.health() == Health.UP ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(httpStatus).body(Map.of(
                "status", status.health(),
                "service", "alarm-agent",
                "token_valid", status.tokenValid(),
                "consumer", status.consumerState()
        ));
    }

    @GetMapping("/status")
    public AgentStatus status() {
        return orchestrator.status();
    }

    @GetMapping("/events/stats")
    public Map<String, Object> eventStats() {
        return Map.of(
                "file", eventSink.getFile().toString(),
                "records", eventSink.count(),
                "size_bytes", eventSink.sizeBytes()
        );
    }

    @DeleteMapping("/events")
    public ResponseEntity<Void> clearEvents() {
        log.warn("Operator requested truncation of the event log {}", eventSink.getFile());
        eventSink.clear();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/agent/shutdown")
    public AgentStatus shutdown() {
        log.info("Operator requested agent shutdown");
        orchestrator.shutdown();
        return orchestrator.status();
    }
}
