package com.nms.alarmagent.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.nms.alarmagent.config.AgentProperties;
import com.nms.alarmagent.model.ExportedRecord;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only JSON Lines log of exported fault events.
 *
 * Each record is written as one complete {@code \n}-terminated line in a single append, so a
 * concurrent reader, or a restart after a crash, only ever sees whole lines before the last one.
 * Existing content is never rewritten; {@link #clear()} is for operators only.
 */
@Slf4j
@Component
public class EventSink {

    private final Path file;
    private final boolean fsync;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final AtomicLong writeCount = new AtomicLong(0);
    private final AtomicLong recordCount = new AtomicLong(0);

    @Autowired
    public EventSink(AgentProperties properties, Clock clock) {
        this(Paths.get(properties.getExport().getFile()), properties.getExport().isFsync(), clock);
    }

    public EventSink(Path file, boolean fsync, Clock clock) {
        this.file = file;
        this.fsync = fsync;
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @PostConstruct
    public void initialize() throws IOException {
        log.info("Initializing event sink with file: {}", file);

        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        repairTornTail();
        recordCount.set(countLines());

        log.info("Event sink initialized ({} existing records)", recordCount.get());
    }

    /**
     * Stamp a decoded payload with the current UTC and local time and append it.
     */
    public ExportedRecord append(JsonNode message) {
        Instant now = clock.instant();
        ExportedRecord record = new ExportedRecord(now, LocalDateTime.ofInstant(now, clock.getZone()), message);
        append(record);
        return record;
    }

    public synchronized void append(ExportedRecord record) {
        byte[] line;
        try {
            line = (objectMapper.writeValueAsString(record) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Record cannot be serialized", e);
        }

        try (FileChannel channel = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            ByteBuffer buffer = ByteBuffer.wrap(line);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            if (fsync) {
                channel.force(false);
            }
        } catch (IOException e) {
            log.error("Failed to append record to {}", file, e);
            throw new UncheckedIOException("Event log append failed", e);
        }

        recordCount.incrementAndGet();
        long count = writeCount.incrementAndGet();
        log.debug("Record written to {} (writes this run: {})", file, count);
    }

    /**
     * Number of complete records in the log: the lines found at {@link #initialize()} plus the
     * records appended since. Changes made to the file by other processes are not seen.
     */
    public long count() {
        return recordCount.get();
    }

    private long countLines() {
        if (!Files.exists(file)) {
            return 0;
        }
        long lines = 0;
        byte[] chunk = new byte[8192];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(chunk)) != -1) {
                for (int i = 0; i < read; i++) {
                    if (chunk[i] == '\n') {
                        lines++;
                    }
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot count records in " + file, e);
        }
        return lines;
    }

    public long sizeBytes() {
        try {
            return Files.exists(file) ? Files.size(file) : 0;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot stat " + file, e);
        }
    }

    /**
     * Truncate the log. Operator action; nothing in the agent calls this on its own.
     */
    public synchronized void clear() {
        if (!Files.exists(file)) {
            return;
        }
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE)) {
            channel.truncate(0);
            recordCount.set(0);
            log.info("Cleared event log {}", file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot clear " + file, e);
        }
    }

    public long getWriteCount() {
        return writeCount.get();
    }

    public Path getFile() {
        return file;
    }

    /**
     * A crash in the middle of a write can leave a final line without its terminator. Close it
     * so the next record starts on its own line; the torn fragment itself is left as is.
     */
    private synchronized void repairTornTail() throws IOException {
        if (!Files.exists(file) || Files.size(file) == 0) {
            return;
        }
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            ByteBuffer last = ByteBuffer.allocate(1);
            channel.read(last, channel.size() - 1);
            if (last.get(0) != '\n') {
                log.warn("Event log {} ends with an incomplete record, terminating it", file);
                channel.write(ByteBuffer.wrap(new byte[]{'\n'}), channel.size());
                channel.force(false);
            }
        }
    }
}
