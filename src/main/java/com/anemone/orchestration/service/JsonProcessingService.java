package com.anemone.orchestration.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigInteger;

@Service
@Slf4j
public class JsonProcessingService {

    private final ObjectMapper objectMapper;
    private final ObjectWriter resultWriter;

    public JsonProcessingService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        // u64/u256 chain values must survive as exact decimal strings
        SimpleModule bigIntegerAsString = new SimpleModule("BigIntegerAsString");
        bigIntegerAsString.addSerializer(BigInteger.class, ToStringSerializer.instance);
        this.resultWriter = objectMapper.copy()
                .registerModule(bigIntegerAsString)
                .writerWithDefaultPrettyPrinter();
    }

    public <T> @Nullable T parseJsonResponse(String label, @Nullable String raw, Class<T> type) {
        if (!StringUtils.hasText(raw)) {
            log.warn("Empty response for {}. Unable to parse JSON.", label);
            return null;
        }
        String json = extractJsonObject(raw);
        try {
            return objectMapper.readValue(json, type);
        } catch (Exception ex) {
            log.warn("Failed to parse {} response as JSON. Snippet: {}", label, truncate(raw, 240));
            return null;
        }
    }

    /**
     * Serializes a command result. Throws so the dispatcher can report the failure as a result string.
     */
    public String toResultJson(@Nullable Object value) throws JsonProcessingException {
        return resultWriter.writeValueAsString(value);
    }

    private String extractJsonObject(String raw) {
        String trimmed = raw.trim();
        if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
            return trimmed;
        }
        int firstBrace = trimmed.indexOf('{');
        int lastBrace = trimmed.lastIndexOf('}');
        if (firstBrace >= 0 && lastBrace > firstBrace) {
            return trimmed.substring(firstBrace, lastBrace + 1);
        }
        return trimmed;
    }

    static String truncate(String value, int maxLength) {
        String normalized = value.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= maxLength) {
            return normalized;
        }
        return normalized.substring(0, maxLength) + "...";
    }
}
