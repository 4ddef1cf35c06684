package com.casefile.common.insight;

import java.util.Locale;

/**
 * Text formatting shared by the insight rules. Locale-independent so evidence strings are
 * byte-identical on every host.
 */
public final class SignalFormat {

    private static final String[] DAY_NAMES = {
        "Sunday", "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday"
    };

    private SignalFormat() {}

    /** 1 = Sunday … 7 = Saturday. */
    public static String dayName(int day) {
        return day >= 1 && day <= 7 ? DAY_NAMES[day - 1] : "Day " + day;
    }

    /** 0 → "12 AM", 13 → "1 PM". */
    public static String hour(int hour) {
        if (hour == 0)  return "12 AM";
        if (hour < 12)  return hour + " AM";
        if (hour == 12) return "12 PM";
        return (hour - 12) + " PM";
    }

    /** One decimal place, e.g. {@code 9.0}. */
    public static String oneDecimal(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    /** Whole percentage of a ratio, e.g. {@code 0.381 → "38"}. */
    public static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.0f", ratio * 100.0);
    }

    /** Integral values without a fraction, others with one decimal place. */
    public static String compact(double value) {
        if (value == Math.rint(value)) {
            return Long.toString((long) value);
        }
        return oneDecimal(value);
    }
}
