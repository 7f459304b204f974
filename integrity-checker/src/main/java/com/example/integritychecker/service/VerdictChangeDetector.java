package com.example.integritychecker.service;

import com.example.integritychecker.model.DeviceVerdict;
import com.example.integritychecker.model.OverallStatus;
import com.example.integritychecker.model.VerdictChange;
import com.example.integritychecker.model.VerdictSnapshot;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a new snapshot differs from the previous one in a way the user
 * should hear about. At most one change is reported per check.
 */
@Component
public class VerdictChangeDetector {

    private static final String NOT_AVAILABLE = "N/A";

    /**
     * @param previous snapshot read before the check started
     * @param current  snapshot written by the check
     * @return the change, or empty if nothing changed or there is no baseline to compare against
     */
    public Optional<VerdictChange> detect(VerdictSnapshot previous, VerdictSnapshot current) {
        if (!previous.hasBeenChecked()) {
            return Optional.empty();
        }

        boolean deviceChanged = !previous.deviceVerdicts().equals(current.deviceVerdicts());
        boolean appChanged = previous.appVerdict() != current.appVerdict();
        boolean licensingChanged = previous.licensingVerdict() != current.licensingVerdict();

        if (!deviceChanged && !appChanged && !licensingChanged) {
            return Optional.empty();
        }

        StringBuilder changes = new StringBuilder();
        if (deviceChanged) {
            changes.append("Device: ")
                    .append(highestLabel(previous.deviceVerdicts()))
                    .append(" -> ")
                    .append(highestLabel(current.deviceVerdicts()));
        }
        if (appChanged) {
            appendSeparator(changes);
            changes.append("App: ")
                    .append(labelOf(previous.appVerdict()))
                    .append(" -> ")
                    .append(labelOf(current.appVerdict()));
        }
        if (licensingChanged) {
            appendSeparator(changes);
            changes.append("License: ")
                    .append(labelOf(previous.licensingVerdict()))
                    .append(" -> ")
                    .append(labelOf(current.licensingVerdict()));
        }

        boolean improvement = isImprovement(previous.overallStatus(), current.deviceVerdicts());
        return Optional.of(new VerdictChange(VerdictChange.DEFAULT_TITLE, changes.toString(), improvement));
    }

    /**
     * Strict upgrade ladder. A check coming out of ERROR or UNKNOWN is never an
     * improvement, whatever the new verdicts are.
     */
    static boolean isImprovement(OverallStatus previousStatus, Set<DeviceVerdict> newVerdicts) {
        boolean strong = newVerdicts.contains(DeviceVerdict.MEETS_STRONG_INTEGRITY);
        boolean device = newVerdicts.contains(DeviceVerdict.MEETS_DEVICE_INTEGRITY);
        boolean basic = newVerdicts.contains(DeviceVerdict.MEETS_BASIC_INTEGRITY);

        return switch (previousStatus) {
            case FAILED -> basic || device || strong;
            case BASIC -> device || strong;
            case DEVICE -> strong;
            case STRONG, ERROR, UNKNOWN -> false;
        };
    }

    static String highestLabel(Set<DeviceVerdict> verdicts) {
        if (verdicts.contains(DeviceVerdict.MEETS_STRONG_INTEGRITY)) {
            return "STRONG";
        }
        if (verdicts.contains(DeviceVerdict.MEETS_DEVICE_INTEGRITY)) {
            return "DEVICE";
        }
        if (verdicts.contains(DeviceVerdict.MEETS_BASIC_INTEGRITY)) {
            return "BASIC";
        }
        return "NONE";
    }

    private static String labelOf(Enum<?> verdict) {
        return Objects.toString(verdict, NOT_AVAILABLE);
    }

    private static void appendSeparator(StringBuilder changes) {
        if (!changes.isEmpty()) {
            changes.append(", ");
        }
    }
}
