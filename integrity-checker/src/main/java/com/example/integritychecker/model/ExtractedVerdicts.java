package com.example.integritychecker.model;

import java.util.Set;

/**
 * Verdict fields lifted out of an {@link IntegrityStatement}.
 */
public record ExtractedVerdicts(
        Set<DeviceVerdict> deviceVerdicts,
        AppVerdict appVerdict,
        LicensingVerdict licensingVerdict
) {
    public ExtractedVerdicts {
        deviceVerdicts = VerdictSnapshot.copyOf(deviceVerdicts);
    }
}
