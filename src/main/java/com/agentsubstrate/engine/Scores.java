package com.agentsubstrate.engine;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Score arithmetic and number rendering shared by the analytical engines.
 */
public final class Scores {

    private Scores() {}

    public static double clamp(double value) {
        return Math.min(1.0, Math.max(0.0, value));
    }

    /** Rounds to two decimals, half up. */
    public static double round2(double value) {
        return Math.round(value * 100) / 100.0;
    }

    /** Renders a number without trailing zeros: 0.3 stays "0.3", 1.0 becomes "1". */
    public static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /** A ratio as a percentage with one decimal, e.g. {@code 65.0%}. */
    public static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.1f%%", ratio * 100);
    }

    /** A ratio as a whole percentage number without the sign, e.g. {@code 65}. */
    public static String wholePercent(double ratio) {
        return String.format(Locale.ROOT, "%.0f", ratio * 100);
    }
}
