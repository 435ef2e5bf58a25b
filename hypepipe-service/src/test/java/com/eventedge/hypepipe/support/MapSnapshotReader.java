package com.eventedge.hypepipe.support;

import com.eventedge.common.snapshot.Snapshot;
import com.eventedge.hypepipe.snapshot.SnapshotReader;
import com.fasterxml.jackson.databind.ObjectMapper;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** In-memory dataset registry. */
public class MapSnapshotReader implements SnapshotReader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, Snapshot> snapshots = new HashMap<>();
    private final List<String> requestedKeys = Collections.synchronizedList(new ArrayList<>());

    public MapSnapshotReader with(String datasetKey, String json, OffsetDateTime updatedAt) {
        try {
            snapshots.put(datasetKey, Snapshot.of(datasetKey, MAPPER.readTree(json), updatedAt));
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
        return this;
    }

    @Override
    public Mono<Snapshot> get(String datasetKey) {
        requestedKeys.add(datasetKey);
        return Mono.justOrEmpty(snapshots.get(datasetKey));
    }

    public List<String> requestedKeys() {
        return List.copyOf(requestedKeys);
    }
}
