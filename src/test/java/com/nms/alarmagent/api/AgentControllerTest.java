package com.nms.alarmagent.api;

import com.nms.alarmagent.auth.CredentialStore;
import com.nms.alarmagent.auth.TokenManager;
import com.nms.alarmagent.config.AgentProperties;
import com.nms.alarmagent.consumer.EventDecoder;
import com.nms.alarmagent.consumer.StreamConsumer;
import com.nms.alarmagent.metrics.MetricsController;
import com.nms.alarmagent.metrics.MetricsRegistry;
import com.nms.alarmagent.metrics.NoOpMetrics;
import com.nms.alarmagent.orchestrator.AgentOrchestrator;
import com.nms.alarmagent.output.EventSink;
import com.nms.alarmagent.subscription.SubscriptionManager;
import com.nms.alarmagent.subscription.SubscriptionStore;
import com.nms.alarmagent.testutil.ManualTaskScheduler;
import com.nms.alarmagent.testutil.TestFactory;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

import static com.nms.alarmagent.testutil.TestFactory.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class AgentControllerTest {

    @TempDir
    Path dir;

    @Test
    void testHealthIsUnavailableWhileStopped() throws Exception {
        MockMvc mvc = mvc(new EventSink(dir.resolve("events.jsonl"), false, TestFactory.fixedClock()));

        mvc.perform(get("/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.token_valid").value(false))
                .andExpect(jsonPath("$.consumer").value("DISCONNECTED"));

        mvc.perform(get("/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(false));
    }

    @Test
    void testEventStatsAndClear() throws Exception {
        EventSink sink = new EventSink(dir.resolve("events.jsonl"), false, TestFactory.fixedClock());
        sink.initialize();
        sink.append(json("{\"severity\":\"warning\"}"));
        sink.append(json("{\"severity\":\"warning\"}"));
        MockMvc mvc = mvc(sink);

        mvc.perform(get("/events/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.records").value(2));

        mvc.perform(delete("/events")).andExpect(status().isNoContent());

        assertThat(sink.count()).isZero();
        assertThat(Files.size(sink.getFile())).isZero();
    }

    @Test
    void testEventLogFailureMapsToServerError() throws Exception {
        // a directory where the log file should be
        Path notAFile = Files.createDirectory(dir.resolve("events.jsonl"));
        MockMvc mvc = mvc(new EventSink(notAFile, false, TestFactory.fixedClock()));

        mvc.perform(delete("/events"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("EVENT_LOG_IO"));
    }

    @Test
    void testShutdownWhileStoppedIsHarmless() throws Exception {
        MockMvc mvc = mvc(new EventSink(dir.resolve("events.jsonl"), false, TestFactory.fixedClock()));

        mvc.perform(post("/agent/shutdown"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.health").value("DOWN"));
    }

    @Test
    void testMetricsEndpoint() throws Exception {
        MetricsRegistry metrics = new MetricsRegistry();
        metrics.onRecordReceived();
        metrics.onRecordExported();
        MockMvc mvc = MockMvcBuilders.standaloneSetup(new MetricsController(metrics)).build();

        mvc.perform(get("/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recordsReceived").value(1))
                .andExpect(jsonPath("$.recordsExported").value(1));
    }

    private static MockMvc mvc(EventSink sink) {
        AgentProperties properties = TestFactory.properties();
        Clock clock = TestFactory.fixedClock();
        RestTemplate restTemplate = new RestTemplate();
        ManualTaskScheduler scheduler = new ManualTaskScheduler();
        NoOpMetrics metrics = new NoOpMetrics();

        TokenManager tokenManager = new TokenManager(properties, restTemplate, new CredentialStore(),
                scheduler, metrics, clock);
        SubscriptionManager subscriptionManager = new SubscriptionManager(properties, restTemplate, tokenManager,
                new SubscriptionStore(), scheduler, metrics, clock);
        StreamConsumer streamConsumer = new StreamConsumer(() -> new MockConsumer<>(OffsetResetStrategy.EARLIEST),
                sink, new EventDecoder(TestFactory.objectMapper()), metrics, Duration.ofMillis(50), Duration.ofSeconds(5));
        AgentOrchestrator orchestrator = new AgentOrchestrator(properties, tokenManager, subscriptionManager,
                streamConsumer, sink, metrics, clock);

        return MockMvcBuilders.standaloneSetup(new AgentController(orchestrator, sink))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }
}
