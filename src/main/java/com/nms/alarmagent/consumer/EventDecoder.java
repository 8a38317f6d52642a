package com.nms.alarmagent.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.nms.alarmagent.error.DecodeFailureException;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Turns a raw record value into a JSON tree: strict UTF-8 first, then JSON.
 */
public class EventDecoder {

    private final ObjectReader reader;

    public EventDecoder(ObjectMapper objectMapper) {
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public JsonNode decode(byte[] value) {
        String text;
        try {
            CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT);
            text = utf8.decode(ByteBuffer.wrap(value)).toString();
        } catch (CharacterCodingException e) {
            throw new DecodeFailureException("Record value is not valid UTF-8", e);
        }

        try {
            JsonNode node = reader.readTree(text);
            if (node == null || node.isMissingNode()) {
                throw new DecodeFailureException("Record value holds no JSON document", null);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new DecodeFailureException("Record value is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
