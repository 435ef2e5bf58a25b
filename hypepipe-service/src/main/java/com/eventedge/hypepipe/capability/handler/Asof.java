package com.eventedge.hypepipe.capability.handler;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;

/** ISO-8601 rendering of the {@code asof} freshness marker. */
final class Asof {

    private Asof() {}

    static String of(OffsetDateTime updatedAt) {
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(updatedAt);
    }

    static String now(Clock clock) {
        return of(OffsetDateTime.now(clock));
    }
}
