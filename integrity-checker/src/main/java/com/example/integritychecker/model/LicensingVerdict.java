package com.example.integritychecker.model;

public enum LicensingVerdict {
    LICENSED,
    UNLICENSED,
    UNEVALUATED;

    public static LicensingVerdict fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        for (LicensingVerdict verdict : values()) {
            if (verdict.name().equals(label.trim())) {
                return verdict;
            }
        }
        return null;
    }
}
