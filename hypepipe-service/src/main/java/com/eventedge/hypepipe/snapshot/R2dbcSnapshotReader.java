package com.eventedge.hypepipe.snapshot;

import com.eventedge.common.snapshot.Snapshot;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Reads {@code edge_dataset_registry} rows written by the snapshot fetchers.
 *
 * <p>Read-only. A failed query or an unparsable payload is logged and treated as
 * "absent" so handlers degrade instead of failing.
 */
@Component
public class R2dbcSnapshotReader implements SnapshotReader {

    private static final Logger log = LoggerFactory.getLogger(R2dbcSnapshotReader.class);

    static final String SELECT_SNAPSHOT =
        "SELECT payload, updated_at FROM edge_dataset_registry WHERE dataset_key = :key";

    private final DatabaseClient databaseClient;
    private final ObjectMapper objectMapper;

    public R2dbcSnapshotReader(DatabaseClient databaseClient, ObjectMapper objectMapper) {
        this.databaseClient = databaseClient;
        this.objectMapper   = objectMapper;
    }

    @Override
    public Mono<Snapshot> get(String datasetKey) {
        return databaseClient.sql(SELECT_SNAPSHOT)
            .bind("key", datasetKey)
            .map((row, meta) -> new RawRow(row.get("payload", String.class), row.get("updated_at")))
            .first()
            .map(raw -> Snapshot.of(datasetKey, parsePayload(raw.payload()), toOffsetDateTime(raw.updatedAt())))
            .onErrorResume(e -> {
                log.warn("Snapshot read failed (non-fatal). datasetKey={}", datasetKey, e);
                return Mono.empty();
            });
    }

    private JsonNode parsePayload(String payload) {
        if (payload == null || payload.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(payload);
        } catch (Exception e) {
            throw new IllegalStateException("Unparsable snapshot payload", e);
        }
    }

    static OffsetDateTime toOffsetDateTime(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof OffsetDateTime odt) {
            return odt;
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toOffsetDateTime();
        }
        if (value instanceof Instant instant) {
            return instant.atOffset(ZoneOffset.UTC);
        }
        if (value instanceof LocalDateTime ldt) {
            // registry timestamps without zone are written in UTC
            return ldt.atOffset(ZoneOffset.UTC);
        }
        throw new IllegalStateException("Unsupported updated_at type: " + value.getClass().getName());
    }

    private record RawRow(String payload, Object updatedAt) {}
}
