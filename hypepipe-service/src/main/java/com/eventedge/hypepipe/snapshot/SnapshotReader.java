package com.eventedge.hypepipe.snapshot;

import com.eventedge.common.snapshot.Snapshot;
import reactor.core.publisher.Mono;

/**
 * Key → snapshot lookup over the dataset registry.
 */
public interface SnapshotReader {

    /**
     * @return the snapshot, or an empty Mono when the key is absent or unreadable
     */
    Mono<Snapshot> get(String datasetKey);
}
