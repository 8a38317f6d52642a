package com.nms.alarmagent.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nms.alarmagent.auth.CredentialStore;
import com.nms.alarmagent.auth.TokenManager;
import com.nms.alarmagent.config.AgentProperties;
import com.nms.alarmagent.consumer.ConsumerState;
import com.nms.alarmagent.consumer.EventDecoder;
import com.nms.alarmagent.consumer.StreamConsumer;
import com.nms.alarmagent.error.SubscriptionCreateException;
import com.nms.alarmagent.error.TransportFailureException;
import com.nms.alarmagent.metrics.MetricsRegistry;
import com.nms.alarmagent.output.EventSink;
import com.nms.alarmagent.subscription.SubscriptionManager;
import com.nms.alarmagent.subscription.SubscriptionStore;
import com.nms.alarmagent.testutil.ManualTaskScheduler;
import com.nms.alarmagent.testutil.TestFactory;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static com.nms.alarmagent.testutil.TestFactory.BASIC_AUTH;
import static com.nms.alarmagent.testutil.TestFactory.REVOCATION_URL;
import static com.nms.alarmagent.testutil.TestFactory.SUBSCRIPTIONS_URL;
import static com.nms.alarmagent.testutil.TestFactory.await;
import static com.nms.alarmagent.testutil.TestFactory.expectInitialToken;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

public class AgentOrchestratorTest {

    private static final Duration WAIT = Duration.ofSeconds(5);
    private static final TopicPartition PARTITION = new TopicPartition("T1", 0);

    @TempDir
    Path dir;

    private AgentProperties properties;
    private MockRestServiceServer server;
    private ManualTaskScheduler scheduler;
    private MockConsumer<String, byte[]> kafka;
    private EventSink eventSink;
    private AgentOrchestrator orchestrator;

    @BeforeEach
    void setUp() throws IOException {
        properties = TestFactory.properties();
        scheduler = new ManualTaskScheduler();
        kafka = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        eventSink = new EventSink(dir.resolve("kafka_messages.jsonl"), true, TestFactory.fixedClock());
        eventSink.initialize();
    }

    @AfterEach
    void tearDown() {
        if (orchestrator != null && orchestrator.isRunning()) {
            try {
                orchestrator.shutdown();
            } catch (AssertionError e) {
                // teardown calls were not expected by the failed test
            }
        }
    }

    @Test
    void testWarningEventEndsUpInTheLog() throws Exception {
        orchestrator = create(() -> kafka);
        expectInitialToken(server, "A1", "R1");
        expectSubscription();
        deliver("{\"severity\":\"warning\",\"probableCause\":\"x\"}");

        orchestrator.start();
        await(() -> eventSink.count() == 1, WAIT);

        AgentStatus status = orchestrator.status();
        assertThat(status.health()).isEqualTo(Health.UP);
        assertThat(status.running()).isTrue();
        assertThat(status.tokenValid()).isTrue();
        assertThat(status.subscriptionId()).isEqualTo("S1");
        assertThat(status.topicId()).isEqualTo("T1");
        assertThat(status.consumerState()).isEqualTo(ConsumerState.CONSUMING);
        assertThat(status.eventLogRecords()).isEqualTo(1);

        List<String> lines = Files.readAllLines(eventSink.getFile(), StandardCharsets.UTF_8);
        assertThat(lines).hasSize(1);
        JsonNode line = new ObjectMapper().readTree(lines.get(0));
        assertThat(line.path("timestamp").asText()).isEqualTo("2026-01-24T12:00:00Z");
        assertThat(line.has("received_at")).isTrue();
        assertThat(line.path("message").path("severity").asText()).isEqualTo("warning");
        assertThat(line.path("message").path("probableCause").asText()).isEqualTo("x");

        // both background tasks are scheduled one interval out
        assertThat(scheduler.scheduled()).hasSize(2);

        expectTeardown();
        orchestrator.shutdown();
        server.verify();
        assertThat(Files.readAllLines(eventSink.getFile(), StandardCharsets.UTF_8)).hasSize(1);
    }

    @Test
    void testShutdownDeletesSubscriptionThenRevokesToken() {
        orchestrator = create(() -> kafka);
        expectInitialToken(server, "A1", "R1");
        expectSubscription();
        server.expect(requestTo(SUBSCRIPTIONS_URL + "/S1"))
                .andExpect(method(HttpMethod.DELETE))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer A1"))
                .andRespond(withStatus(HttpStatus.NO_CONTENT));
        server.expect(requestTo(REVOCATION_URL))
                .andExpect(header(HttpHeaders.AUTHORIZATION, BASIC_AUTH))
                .andExpect(content().string("token=A1&token_type_hint=token"))
                .andRespond(withSuccess());

        orchestrator.start();
        await(() -> orchestrator.status().consumerState() == ConsumerState.CONSUMING, WAIT);
        orchestrator.shutdown();

        server.verify();
        assertThat(orchestrator.isRunning()).isFalse();
        assertThat(kafka.closed()).isTrue();
        assertThat(scheduler.scheduled()).allSatisfy(s -> assertThat(s.future().isCancelled()).isTrue());

        AgentStatus status = orchestrator.status();
        assertThat(status.health()).isEqualTo(Health.DOWN);
        assertThat(status.subscriptionId()).isNull();
        assertThat(status.tokenValid()).isFalse();

        // second shutdown is a no-op and sends nothing
        orchestrator.shutdown();
        server.verify();
    }

    @Test
    void testFailedDeleteStillRevokes() {
        orchestrator = create(() -> kafka);
        expectInitialToken(server, "A1", "R1");
        expectSubscription();
        server.expect(requestTo(SUBSCRIPTIONS_URL + "/S1")).andRespond(withServerError());
        server.expect(requestTo(REVOCATION_URL)).andRespond(withSuccess());

        orchestrator.start();
        orchestrator.shutdown();

        server.verify();
        assertThat(orchestrator.isRunning()).isFalse();
    }

    @Test
    void testSubscriptionFailureTearsDownAndPropagates() {
        orchestrator = create(() -> kafka);
        expectInitialToken(server, "A1", "R1");
        server.expect(requestTo(SUBSCRIPTIONS_URL)).andRespond(withServerError());
        server.expect(requestTo(REVOCATION_URL)).andRespond(withSuccess());

        assertThatThrownBy(() -> orchestrator.start())
                .isInstanceOf(SubscriptionCreateException.class);

        server.verify();
        assertThat(orchestrator.isRunning()).isFalse();
        assertThat(scheduler.only().future().isCancelled()).isTrue();
        assertThat(eventSink.count()).isZero();
    }

    @Test
    void testConsumerFailureTearsDownSubscription() {
        orchestrator = create(() -> {
            throw new KafkaException("ssl handshake failed");
        });
        expectInitialToken(server, "A1", "R1");
        expectSubscription();
        server.expect(requestTo(SUBSCRIPTIONS_URL + "/S1"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withStatus(HttpStatus.NO_CONTENT));
        server.expect(requestTo(REVOCATION_URL)).andRespond(withSuccess());

        assertThatThrownBy(() -> orchestrator.start())
                .isInstanceOf(TransportFailureException.class);

        server.verify();
        assertThat(orchestrator.isRunning()).isFalse();
    }

    @Test
    void testInvalidConfigurationFailsBeforeAnyCall() {
        properties.getApi().setRefreshInterval(Duration.ofHours(2));
        orchestrator = create(() -> kafka);

        assertThatThrownBy(() -> orchestrator.start())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("refresh-interval");

        server.verify();
        assertThat(scheduler.scheduled()).isEmpty();
    }

    @Test
    void testTransportFailureDegradesHealth() {
        orchestrator = create(() -> kafka);
        expectInitialToken(server, "A1", "R1");
        expectSubscription();
        kafka.setPollException(new KafkaException("broker unreachable"));

        orchestrator.start();
        await(() -> orchestrator.status().consumerState() == ConsumerState.DISCONNECTED
                && orchestrator.status().lastTransportFailure() != null, WAIT);

        AgentStatus status = orchestrator.status();
        assertThat(status.health()).isEqualTo(Health.DEGRADED);
        assertThat(status.running()).isTrue();
        assertThat(status.lastTransportFailure()).contains("T1");

        expectTeardown();
        orchestrator.shutdown();
        server.verify();
    }

    private AgentOrchestrator create(Supplier<Consumer<String, byte[]>> consumerSupplier) {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        MetricsRegistry metrics = new MetricsRegistry();

        TokenManager tokenManager = new TokenManager(properties, restTemplate, new CredentialStore(),
                scheduler, metrics, TestFactory.fixedClock());
        SubscriptionManager subscriptionManager = new SubscriptionManager(properties, restTemplate, tokenManager,
                new SubscriptionStore(), scheduler, metrics, TestFactory.fixedClock());
        StreamConsumer streamConsumer = new StreamConsumer(consumerSupplier, eventSink,
                new EventDecoder(TestFactory.objectMapper()), metrics, Duration.ofMillis(50), WAIT);

        return new AgentOrchestrator(properties, tokenManager, subscriptionManager, streamConsumer,
                eventSink, metrics, TestFactory.fixedClock());
    }

    private void expectSubscription() {
        server.expect(requestTo(SUBSCRIPTIONS_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer A1"))
                .andRespond(withSuccess("{\"response\":{\"data\":{\"subscriptionId\":\"S1\",\"topicId\":\"T1\"}}}",
                        MediaType.APPLICATION_JSON));
    }

    private void expectTeardown() {
        server.expect(requestTo(SUBSCRIPTIONS_URL + "/S1"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withStatus(HttpStatus.NO_CONTENT));
        server.expect(requestTo(REVOCATION_URL)).andRespond(withSuccess());
    }

    private void deliver(String payload) {
        kafka.schedulePollTask(() -> {
            kafka.rebalance(List.of(PARTITION));
            kafka.updateBeginningOffsets(Map.of(PARTITION, 0L));
            kafka.addRecord(new ConsumerRecord<>("T1", 0, 0L, null, payload.getBytes(StandardCharsets.UTF_8)));
        });
    }
}
