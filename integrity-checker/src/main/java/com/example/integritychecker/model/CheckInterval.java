package com.example.integritychecker.model;

import com.fasterxml.jackson.annotation.JsonFormat;

/**
 * Intervals offered for the background check.
 */
@JsonFormat(shape = JsonFormat.Shape.OBJECT)
public enum CheckInterval {
    FIFTEEN_MIN(15, "15m"),
    THIRTY_MIN(30, "30m"),
    ONE_HOUR(60, "1h"),
    SIX_HOURS(360, "6h");

    public static final int MIN_INTERVAL_MINUTES = 15;

    private final int minutes;
    private final String label;

    CheckInterval(int minutes, String label) {
        this.minutes = minutes;
        this.label = label;
    }

    public int getMinutes() {
        return minutes;
    }

    public String getLabel() {
        return label;
    }

    public static String labelFor(int minutes) {
        for (CheckInterval interval : values()) {
            if (interval.minutes == minutes) {
                return interval.label;
            }
        }
        return minutes + " minutes";
    }

    public static int clamp(int minutes) {
        return Math.max(minutes, MIN_INTERVAL_MINUTES);
    }
}
