package com.eventedge.common.sentiment;

import com.eventedge.common.snapshot.SnapshotKeys;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Parses the Alternative.me {@code /fng} payload into a {@link FearGreedView}.
 * Unparsable values default to 50 / "Neutral".
 */
public final class FearGreedParser {

    public static final String PROVIDER = "alternative.me";

    static final int HISTORY_POINTS = 7;
    static final int NEUTRAL_VALUE = 50;
    static final String NEUTRAL_LABEL = "Neutral";

    private static final DateTimeFormatter POINT_LABEL =
        DateTimeFormatter.ofPattern("MMM dd", Locale.ENGLISH).withZone(ZoneOffset.UTC);

    private FearGreedParser() {}

    public static FearGreedView parse(JsonNode payload) {
        JsonNode data = payload.path("data");
        List<JsonNode> rows = new ArrayList<>();
        if (data.isArray()) {
            data.forEach(rows::add);
        }

        JsonNode current = rows.isEmpty() ? null : rows.get(0);
        int currentValue = current != null ? intValue(current.path("value")) : NEUTRAL_VALUE;
        String currentLabel = current != null ? current.path("value_classification").asText("") : "";
        if (currentLabel.isBlank()) {
            currentLabel = NEUTRAL_LABEL;
        }

        // provider order is newest first; the chart wants oldest first
        List<JsonNode> window = new ArrayList<>(rows.subList(0, Math.min(HISTORY_POINTS, rows.size())));
        Collections.reverse(window);
        List<FearGreedView.Point> history = new ArrayList<>(window.size());
        for (int i = 0; i < window.size(); i++) {
            JsonNode row = window.get(i);
            history.add(new FearGreedView.Point(pointLabel(row.path("timestamp"), i), intValue(row.path("value"))));
        }

        return new FearGreedView(
            new FearGreedView.Current(currentValue, currentLabel),
            List.copyOf(history),
            new FearGreedView.Source(PROVIDER, SnapshotKeys.FEAR_GREED));
    }

    public static FearGreedView neutral() {
        return new FearGreedView(
            new FearGreedView.Current(NEUTRAL_VALUE, NEUTRAL_LABEL),
            List.of(),
            new FearGreedView.Source(PROVIDER, SnapshotKeys.FEAR_GREED));
    }

    private static int intValue(JsonNode node) {
        String raw = node.asText("").trim();
        return isDigits(raw) ? Integer.parseInt(raw) : NEUTRAL_VALUE;
    }

    private static String pointLabel(JsonNode timestamp, int index) {
        String raw = timestamp.asText("").trim();
        if (isDigits(raw)) {
            return POINT_LABEL.format(Instant.ofEpochSecond(Long.parseLong(raw)));
        }
        return "D-" + (HISTORY_POINTS - 1 - index);
    }

    private static boolean isDigits(String s) {
        if (s.isEmpty() || s.length() > 18) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
