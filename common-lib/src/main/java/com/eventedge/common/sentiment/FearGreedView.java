package com.eventedge.common.sentiment;

import java.util.List;

/**
 * Current Fear &amp; Greed reading plus a short history, oldest point first.
 */
public record FearGreedView(
    Current current,
    List<Point> history,
    Source source
) {
    public record Current(int value, String label) {}

    public record Point(String t, int v) {}

    public record Source(String provider, String datasetKey) {}
}
