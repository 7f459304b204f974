package com.example.integritychecker.model;

/**
 * App recognition verdicts.
 */
public enum AppVerdict {
    PLAY_RECOGNIZED,
    UNRECOGNIZED_VERSION,
    UNEVALUATED;

    public static AppVerdict fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        for (AppVerdict verdict : values()) {
            if (verdict.name().equals(label.trim())) {
                return verdict;
            }
        }
        return null;
    }
}
