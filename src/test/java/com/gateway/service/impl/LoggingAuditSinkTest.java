package com.gateway.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateway.model.AuditEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.Logger;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class LoggingAuditSinkTest {

    @Mock
    private Logger auditLog;

    private final AuditEntry entry = new AuditEntry("controller.jobs_list", "controller",
            "https://aap/api/controller/v2/jobs/", "GET", null, Map.of("count", 0), 200,
            Instant.parse("2026-01-15T10:00:00Z"));

    @Test
    void toJsonLine_shouldCarryAllAuditFields() throws Exception {
        LoggingAuditSink sink = new LoggingAuditSink(auditLog);

        JsonNode line = new ObjectMapper().readTree(sink.toJsonLine(entry));

        assertThat(line.get("timestamp").asText()).isEqualTo("2026-01-15T10:00:00Z");
        assertThat(line.get("tool").asText()).isEqualTo("controller.jobs_list");
        assertThat(line.get("service").asText()).isEqualTo("controller");
        assertThat(line.get("endpoint").asText()).isEqualTo("https://aap/api/controller/v2/jobs/");
        assertThat(line.at("/payload/method").asText()).isEqualTo("GET");
        assertThat(line.at("/payload/userAgent").asText()).isEqualTo("unknown");
        assertThat(line.at("/response/count").asInt()).isZero();
        assertThat(line.get("return_code").asInt()).isEqualTo(200);
    }

    @Test
    void record_shouldWriteOneLineToAuditLogger() {
        new LoggingAuditSink(auditLog).record(entry);

        verify(auditLog).info(contains("\"tool\":\"controller.jobs_list\""));
    }
}
