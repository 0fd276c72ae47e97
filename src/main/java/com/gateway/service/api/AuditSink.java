package com.gateway.service.api;

import com.gateway.model.AuditEntry;

/**
 * Receives one entry per dispatch attempt. Failures of a sink never affect the caller.
 */
public interface AuditSink {

    void record(AuditEntry entry);
}
