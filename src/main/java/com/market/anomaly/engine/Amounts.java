package com.market.anomaly.engine;

import java.util.Locale;

/**
 * Locale-independent number formatting for event descriptions.
 */
public final class Amounts {

    private Amounts() {}

    /**
     * 1.6e9 -> "1.60B", 3.5e7 -> "35.00M", 1200 -> "1.20K".
     */
    public static String compact(double value) {
        double abs = Math.abs(value);
        if (abs >= 1e9) return String.format(Locale.ROOT, "%.2fB", value / 1e9);
        if (abs >= 1e6) return String.format(Locale.ROOT, "%.2fM", value / 1e6);
        if (abs >= 1e3) return String.format(Locale.ROOT, "%.2fK", value / 1e3);
        return String.format(Locale.ROOT, "%.2f", value);
    }

    public static String signedPct(double pct) {
        return String.format(Locale.ROOT, "%+.2f%%", pct);
    }

    public static String ratio(double ratio) {
        return String.format(Locale.ROOT, "%.2fx", ratio);
    }

    public static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}
