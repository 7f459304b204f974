package com.example.integritychecker.model;

/**
 * Device recognition verdicts, declared most-severe-first so that
 * {@link java.util.EnumSet} iteration renders them in that order.
 */
public enum DeviceVerdict {
    MEETS_STRONG_INTEGRITY,
    MEETS_DEVICE_INTEGRITY,
    MEETS_VIRTUAL_INTEGRITY,
    MEETS_BASIC_INTEGRITY,
    NO_INTEGRITY;

    /**
     * Resolves a stored or transmitted label.
     *
     * @return the verdict, or null if the label is blank or not recognised
     */
    public static DeviceVerdict fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        for (DeviceVerdict verdict : values()) {
            if (verdict.name().equals(label.trim())) {
                return verdict;
            }
        }
        return null;
    }
}
