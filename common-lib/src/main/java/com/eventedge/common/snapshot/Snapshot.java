package com.eventedge.common.snapshot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.time.OffsetDateTime;

/**
 * A pre-fetched provider payload as stored in {@code edge_dataset_registry}.
 *
 * @param datasetKey registry key, e.g. {@code coinglass:open_interest:BTC}
 * @param payload    raw provider payload; never {@code null}
 * @param updatedAt  when the fetcher last refreshed the row; may be {@code null}
 */
public record Snapshot(
    String datasetKey,
    JsonNode payload,
    OffsetDateTime updatedAt
) {
    public Snapshot {
        payload = payload != null ? payload : MissingNode.getInstance();
    }

    public static Snapshot of(String datasetKey, JsonNode payload, OffsetDateTime updatedAt) {
        return new Snapshot(datasetKey, payload, updatedAt);
    }
}
