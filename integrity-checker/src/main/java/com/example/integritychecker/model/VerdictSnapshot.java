package com.example.integritychecker.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * The most recently observed verdicts plus check metadata.
 *
 * @param deviceVerdicts     device recognition verdicts, iterated most-severe-first
 * @param appVerdict         app recognition verdict, null when not asserted
 * @param licensingVerdict   licensing verdict, null when not asserted
 * @param lastCheckTimestamp epoch millis of the last attempt, 0 if never checked
 * @param success            whether the last attempt completed without error
 * @param errorMessage       description of the last failure, null after a success
 */
public record VerdictSnapshot(
        Set<DeviceVerdict> deviceVerdicts,
        AppVerdict appVerdict,
        LicensingVerdict licensingVerdict,
        long lastCheckTimestamp,
        boolean success,
        String errorMessage
) {
    public static final VerdictSnapshot NEVER_CHECKED =
            new VerdictSnapshot(Set.of(), null, null, 0L, false, null);

    public VerdictSnapshot {
        deviceVerdicts = copyOf(deviceVerdicts);
    }

    public boolean hasBeenChecked() {
        return lastCheckTimestamp > 0L;
    }

    public OverallStatus overallStatus() {
        return OverallStatus.of(this);
    }

    public VerdictSnapshot withSuccess(Set<DeviceVerdict> newDeviceVerdicts, AppVerdict newAppVerdict,
                                       LicensingVerdict newLicensingVerdict, long timestamp) {
        return new VerdictSnapshot(newDeviceVerdicts, newAppVerdict, newLicensingVerdict, timestamp, true, null);
    }

    public VerdictSnapshot withFailure(String message, long timestamp) {
        return new VerdictSnapshot(deviceVerdicts, appVerdict, licensingVerdict, timestamp, false, message);
    }

    static Set<DeviceVerdict> copyOf(Collection<DeviceVerdict> verdicts) {
        if (verdicts == null || verdicts.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(verdicts));
    }
}
