package com.example.integritychecker.model;

/**
 * A user-visible difference between two snapshots.
 *
 * @param title       notification title
 * @param message     comma-separated per-category summary, e.g. {@code Device: BASIC -> DEVICE}
 * @param improvement true when the device tier moved up the ladder
 */
public record VerdictChange(
        String title,
        String message,
        boolean improvement
) {
    public static final String DEFAULT_TITLE = "Integrity Status Changed";
}
