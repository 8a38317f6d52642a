package com.nms.alarmagent.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * One line of the event log: the decoded alarm/fault payload plus when we received it.
 *
 * Timestamps are written as ISO-8601 strings: UTC with a {@code Z} suffix, and local wall-clock
 * time without an offset.
 */
@JsonPropertyOrder({"timestamp", "received_at", "message"})
public record ExportedRecord(

        @JsonProperty("timestamp")
        Instant receivedAtUtc,

        @JsonProperty("received_at")
        LocalDateTime receivedAtLocal,

        @JsonProperty("message")
        JsonNode message
) {}
