package com.eventedge.hypepipe.audit;

import reactor.core.publisher.Mono;

/**
 * Durable destination for audit records.
 */
public interface AuditSink {

    /**
     * Creates or migrates the audit table. Idempotent; safe to call concurrently.
     * Errors propagate.
     */
    Mono<Void> ensureSchema();

    /**
     * Appends one record. Never signals an error: a failed write is logged and
     * the returned Mono completes empty so the caller's response is unaffected.
     */
    Mono<Void> append(AuditRecord record);
}
