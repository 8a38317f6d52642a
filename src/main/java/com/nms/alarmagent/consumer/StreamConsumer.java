package com.nms.alarmagent.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.nms.alarmagent.error.DecodeFailureException;
import com.nms.alarmagent.error.TransportFailureException;
import com.nms.alarmagent.metrics.Metrics;
import com.nms.alarmagent.output.EventSink;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Consumes the subscription topic and hands every decoded event to the {@link EventSink}.
 *
 * Runs a blocking poll loop on its own thread. Delivery is at-least-once (automatic offset commit,
 * reset to earliest), so the same event may be exported twice after a restart.
 *
 * - Malformed records are logged and dropped; the loop keeps going
 * - {@link #stop()} lets the in-flight record finish before the loop exits
 * - Connection-level failures end the run; there is no internal restart
 */
@Slf4j
public class StreamConsumer {

    private final Supplier<Consumer<String, byte[]>> consumerSupplier;
    private final EventSink eventSink;
    private final EventDecoder decoder;
    private final Metrics metrics;
    private final Duration pollTimeout;
    private final Duration shutdownTimeout;

    private final AtomicLong receivedCount = new AtomicLong();

    private volatile ConsumerState state = ConsumerState.DISCONNECTED;
    private volatile boolean running;
    private volatile TransportFailureException lastFailure;
    private volatile String topicId;

    private Consumer<String, byte[]> consumer;
    private ExecutorService executor;
    private Future<?> loop;

    public StreamConsumer(
            Supplier<Consumer<String, byte[]>> consumerSupplier,
            EventSink eventSink,
            EventDecoder decoder,
            Metrics metrics,
            Duration pollTimeout,
            Duration shutdownTimeout
    ) {
        this.consumerSupplier = consumerSupplier;
        this.eventSink = eventSink;
        this.decoder = decoder;
        this.metrics = metrics;
        this.pollTimeout = pollTimeout;
        this.shutdownTimeout = shutdownTimeout;
    }

    /**
     * Connect, join the consumer group, subscribe to {@code topic} and start the receive loop.
     *
     * The topic is read once here; consuming a different topic takes a stop and a new start.
     *
     * @throws TransportFailureException if the client cannot be built or the subscribe is refused
     */
    public synchronized void start(String topic) {
        if (loop != null && !loop.isDone()) {
            log.warn("Consumer is already running on topic {}", topicId);
            return;
        }
        releaseExecutor();

        state = ConsumerState.CONNECTING;
        lastFailure = null;
        Consumer<String, byte[]> created = null;
        try {
            log.info("Creating Kafka consumer for topic: {}", topic);
            created = consumerSupplier.get();
            created.subscribe(List.of(topic));
        } catch (RuntimeException e) {
            state = ConsumerState.DISCONNECTED;
            if (created != null) {
                closeQuietly(created);
            }
            TransportFailureException failure =
                    new TransportFailureException("Cannot connect consumer to topic " + topic, e);
            lastFailure = failure;
            log.error("Failed to create Kafka consumer for topic {}", topic, e);
            throw failure;
        }

        consumer = created;
        topicId = topic;
        state = ConsumerState.SUBSCRIBED;
        running = true;

        executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "event-consumer");
            thread.setDaemon(false);
            return thread;
        });
        loop = executor.submit(this::consumeLoop);
        log.info("Started consuming from topic: {}", topic);
    }

    /**
     * Ask the loop to exit after the record it is currently processing, then wait for it.
     *
     * @return true if the loop has exited
     */
    public boolean stop() {
        Future<?> current;
        synchronized (this) {
            if (loop == null) {
                log.debug("Consumer is not running");
                return true;
            }
            current = loop;
            if (!current.isDone()) {
                log.info("Stopping Kafka consumer...");
                state = ConsumerState.STOPPING;
                running = false;
                consumer.wakeup();
            }
        }

        boolean stopped = true;
        try {
            current.get(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Consumer thread did not stop within {}", shutdownTimeout);
            stopped = false;
        } catch (ExecutionException e) {
            log.error("Consumer thread ended with an error", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopped = false;
        }

        synchronized (this) {
            if (stopped) {
                releaseExecutor();
                log.info("Kafka consumer stopped");
            }
        }
        return stopped;
    }

    public ConsumerState state() {
        return state;
    }

    public boolean isConsuming() {
        return state == ConsumerState.CONSUMING;
    }

    public long receivedCount() {
        return receivedCount.get();
    }

    public Optional<TransportFailureException> lastFailure() {
        return Optional.ofNullable(lastFailure);
    }

    public Optional<String> topicId() {
        return Optional.ofNullable(topicId);
    }

    private void consumeLoop() {
        state = ConsumerState.CONSUMING;
        log.info("Listening for messages on topic: {}", topicId);
        try {
            while (running) {
                ConsumerRecords<String, byte[]> records = consumer.poll(pollTimeout);
                processBatch(records);
            }
        } catch (WakeupException e) {
            log.debug("Consumer woken up for shutdown");
        } catch (KafkaException e) {
            lastFailure = new TransportFailureException("Kafka consumer failed on topic " + topicId, e);
            log.error("Kafka error in consumer loop, consumption stopped", e);
        } catch (RuntimeException e) {
            lastFailure = new TransportFailureException("Consumer loop on topic " + topicId + " ended unexpectedly", e);
            log.error("Unexpected error in consumer loop, consumption stopped", e);
        } finally {
            running = false;
            closeQuietly(consumer);
            state = ConsumerState.DISCONNECTED;
            log.info("Kafka consumer loop stopped. Total records received: {}", receivedCount.get());
        }
    }

    private void processBatch(ConsumerRecords<String, byte[]> records) {
        if (records.isEmpty()) {
            return;
        }
        List<ConsumerRecord<String, byte[]>> batch = new ArrayList<>(records.count());
        records.forEach(batch::add);

        for (int i = 0; i < batch.size(); i++) {
            if (!running) {
                rewind(batch.subList(i, batch.size()));
                return;
            }
            process(batch.get(i));
        }
    }

    private void process(ConsumerRecord<String, byte[]> record) {
        long n = receivedCount.incrementAndGet();
        metrics.onRecordReceived();
        log.debug("Received message #{} from partition {}, offset {}", n, record.partition(), record.offset());

        byte[] value = record.value();
        if (value == null || value.length == 0) {
            log.debug("Skipping empty record at partition {} offset {}", record.partition(), record.offset());
            return;
        }

        JsonNode event;
        try {
            event = decoder.decode(value);
        } catch (DecodeFailureException e) {
            metrics.onRecordDecodeFailed();
            log.warn("Dropping undecodable record at partition {} offset {}: {}",
                    record.partition(), record.offset(), e.getMessage());
            return;
        }

        try {
            eventSink.append(event);
            metrics.onRecordExported();
            log.info("Message #{} exported", n);
        } catch (RuntimeException e) {
            log.error("Failed to export record at partition {} offset {}", record.partition(), record.offset(), e);
        }
    }

    /**
     * Records left in a batch when a stop arrives are not processed. Seek back to them so the
     * offset committed on close does not skip past them.
     */
    private void rewind(List<ConsumerRecord<String, byte[]>> unprocessed) {
        Map<TopicPartition, Long> firstOffsets = new LinkedHashMap<>();
        for (ConsumerRecord<String, byte[]> record : unprocessed) {
            firstOffsets.putIfAbsent(new TopicPartition(record.topic(), record.partition()), record.offset());
        }
        firstOffsets.forEach(consumer::seek);
        log.info("Stop requested, {} fetched records left for redelivery", unprocessed.size());
    }

    private static void closeQuietly(Consumer<String, byte[]> target) {
        try {
            target.close();
        } catch (KafkaException e) {
            log.warn("Error closing Kafka consumer: {}", e.getMessage());
        }
    }

    private void releaseExecutor() {
        if (executor != null) {
            executor.shutdown();
        }
        executor = null;
        loop = null;
        consumer = null;
    }
}
