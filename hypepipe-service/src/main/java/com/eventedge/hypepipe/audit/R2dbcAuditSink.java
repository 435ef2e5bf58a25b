package com.eventedge.hypepipe.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link AuditSink} over the service's R2DBC connection factory.
 *
 * <p>The table is created lazily on first use and older deployments are migrated
 * in place by adding the later columns. The one-time guard is only set after every
 * statement succeeded, so a failed attempt is retried on the next append.
 */
@Component
public class R2dbcAuditSink implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger(R2dbcAuditSink.class);

    static final List<String> SCHEMA_STATEMENTS = List.of(
        """
        CREATE TABLE IF NOT EXISTS hypepipe_audit_events (
            id          BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
            ts          TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP,
            agent_id    VARCHAR NOT NULL,
            user_id     BIGINT,
            cap         VARCHAR NOT NULL,
            request_id  VARCHAR NOT NULL,
            trace_id    VARCHAR NOT NULL,
            decision    VARCHAR NOT NULL,
            latency_ms  INTEGER NOT NULL
        )
        """,
        "ALTER TABLE hypepipe_audit_events ADD COLUMN IF NOT EXISTS policy_version VARCHAR",
        "ALTER TABLE hypepipe_audit_events ADD COLUMN IF NOT EXISTS deny_reason VARCHAR",
        "ALTER TABLE hypepipe_audit_events ADD COLUMN IF NOT EXISTS asof VARCHAR",
        "ALTER TABLE hypepipe_audit_events ADD COLUMN IF NOT EXISTS cache_hit BOOLEAN"
    );

    private final R2dbcEntityTemplate template;
    private final DatabaseClient databaseClient;
    private final AtomicBoolean schemaReady = new AtomicBoolean(false);

    public R2dbcAuditSink(R2dbcEntityTemplate template) {
        this.template       = template;
        this.databaseClient = template.getDatabaseClient();
    }

    @Override
    public Mono<Void> ensureSchema() {
        return Mono.defer(() -> {
            if (schemaReady.get()) {
                return Mono.empty();
            }
            return Flux.fromIterable(SCHEMA_STATEMENTS)
                .concatMap(sql -> databaseClient.sql(sql).then())
                .then()
                .doOnSuccess(v -> {
                    if (schemaReady.compareAndSet(false, true)) {
                        log.info("Audit schema ready. table=hypepipe_audit_events");
                    }
                });
        });
    }

    @Override
    public Mono<Void> append(AuditRecord record) {
        return ensureSchema()
            .onErrorResume(e -> {
                log.warn("Audit schema check failed (non-fatal). traceId={}", record.traceId(), e);
                return Mono.empty();
            })
            .then(Mono.defer(() -> template.insert(HypePipeAuditEvent.from(record))))
            .then()
            .onErrorResume(e -> {
                log.warn("Audit append failed (non-fatal). cap={} decision={} traceId={}",
                         record.cap(), record.decision().wire(), record.traceId(), e);
                return Mono.empty();
            });
    }

    /** Best-effort warm-up so the first request does not pay for DDL. */
    @EventListener(ApplicationReadyEvent.class)
    public void prepareOnStartup() {
        ensureSchema()
            .subscribe(
                v -> { },
                e -> log.warn("Audit schema preparation on startup failed (non-fatal); will retry on first append", e));
    }

    boolean isSchemaReady() {
        return schemaReady.get();
    }
}
