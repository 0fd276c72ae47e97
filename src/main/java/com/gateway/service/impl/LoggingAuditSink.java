package com.gateway.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gateway.model.AuditEntry;
import com.gateway.service.api.AuditSink;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes each dispatch attempt as one JSON line to the {@code gateway.audit} logger, leaving
 * retention and shipping to the logging backend.
 */
@Component
public class LoggingAuditSink implements AuditSink {

    static final String AUDIT_LOGGER = "gateway.audit";

    private final Logger auditLog;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public LoggingAuditSink() {
        this(LoggerFactory.getLogger(AUDIT_LOGGER));
    }

    LoggingAuditSink(Logger auditLog) {
        this.auditLog = auditLog;
    }

    @Override
    public void record(AuditEntry entry) {
        auditLog.info(toJsonLine(entry));
    }

    String toJsonLine(AuditEntry entry) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("timestamp", entry.timestamp());
        line.put("tool", entry.toolName());
        line.put("service", entry.service());
        line.put("endpoint", entry.url());
        line.put("payload", Map.of("method", entry.method(), "userAgent", entry.userAgent() != null ? entry.userAgent() : "unknown"));
        line.put("response", entry.response());
        line.put("return_code", entry.statusCode());
        try {
            return objectMapper.writeValueAsString(line);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize audit entry for tool " + entry.toolName(), e);
        }
    }
}
