package com.example.integritychecker.util;

/**
 * Formats check timestamps relative to now for display.
 */
public final class RelativeTimeFormatter {

    private static final long MINUTE_MILLIS = 60_000L;
    private static final long HOUR_MILLIS = 3_600_000L;
    private static final long DAY_MILLIS = 86_400_000L;

    private RelativeTimeFormatter() {}

    public static String format(long timestamp, long now) {
        if (timestamp == 0L) {
            return "Never";
        }
        long diff = now - timestamp;
        if (diff < MINUTE_MILLIS) {
            return "Just now";
        }
        if (diff < HOUR_MILLIS) {
            return (diff / MINUTE_MILLIS) + " min ago";
        }
        if (diff < DAY_MILLIS) {
            return (diff / HOUR_MILLIS) + " hr ago";
        }
        return (diff / DAY_MILLIS) + " days ago";
    }
}
