package com.example.integritychecker.model;

/**
 * Severity classification derived from a {@link VerdictSnapshot}. Never persisted.
 * STRONG, DEVICE, BASIC and FAILED are ranked in that order; ERROR and UNKNOWN are not ranked.
 */
public enum OverallStatus {
    STRONG,
    DEVICE,
    BASIC,
    FAILED,
    ERROR,
    UNKNOWN;

    public static OverallStatus of(VerdictSnapshot snapshot) {
        if (snapshot.lastCheckTimestamp() == 0L) {
            return UNKNOWN;
        }
        if (!snapshot.success() && snapshot.errorMessage() != null && !snapshot.errorMessage().isEmpty()) {
            return ERROR;
        }
        if (snapshot.deviceVerdicts().contains(DeviceVerdict.MEETS_STRONG_INTEGRITY)) {
            return STRONG;
        }
        if (snapshot.deviceVerdicts().contains(DeviceVerdict.MEETS_DEVICE_INTEGRITY)) {
            return DEVICE;
        }
        if (snapshot.deviceVerdicts().contains(DeviceVerdict.MEETS_BASIC_INTEGRITY)) {
            return BASIC;
        }
        return FAILED;
    }

    public boolean isRanked() {
        return this != ERROR && this != UNKNOWN;
    }
}
