package com.eventedge.common.format;

import java.util.Locale;

/**
 * Display formatting for dashboard-facing values. Absent values render as an em dash.
 */
public final class DisplayFormat {

    public static final String ABSENT = "—";

    private DisplayFormat() {}

    /** {@code $1.2B}, {@code $43.8M}, {@code $68,819}, {@code $12.34}. */
    public static String usd(Double n) {
        if (n == null) {
            return ABSENT;
        }
        double abs = Math.abs(n);
        if (abs >= 1_000_000_000.0) {
            return String.format(Locale.ROOT, "$%.1fB", n / 1_000_000_000.0);
        }
        if (abs >= 1_000_000.0) {
            return String.format(Locale.ROOT, "$%.1fM", n / 1_000_000.0);
        }
        if (abs >= 1_000.0) {
            return String.format(Locale.ROOT, "$%,.0f", n);
        }
        return String.format(Locale.ROOT, "$%,.2f", n);
    }

    public static String pct(Double p) {
        return pct(p, 2, true);
    }

    public static String pct(Double p, int digits) {
        return pct(p, digits, true);
    }

    /**
     * @param signed prefix positive values with {@code +}
     */
    public static String pct(Double p, int digits, boolean signed) {
        if (p == null) {
            return ABSENT;
        }
        String sign = signed && p > 0 ? "+" : "";
        return sign + String.format(Locale.ROOT, "%." + digits + "f%%", p);
    }
}
