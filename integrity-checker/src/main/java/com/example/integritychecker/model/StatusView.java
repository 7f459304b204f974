package com.example.integritychecker.model;

import com.example.integritychecker.util.RelativeTimeFormatter;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Read-only projection of a {@link VerdictSnapshot} for display surfaces.
 */
public record StatusView(
        @JsonProperty("overall_status") OverallStatus overallStatus,
        @JsonProperty("device_verdicts") List<DeviceVerdict> deviceVerdicts,
        @JsonProperty("app_verdict") AppVerdict appVerdict,
        @JsonProperty("licensing_verdict") LicensingVerdict licensingVerdict,
        @JsonProperty("last_check_timestamp") long lastCheckTimestamp,
        @JsonProperty("last_checked") String lastChecked,
        boolean success,
        @JsonProperty("error_message") String errorMessage
) {

    public static StatusView of(VerdictSnapshot snapshot, long now) {
        return new StatusView(
                snapshot.overallStatus(),
                List.copyOf(snapshot.deviceVerdicts()),
                snapshot.appVerdict(),
                snapshot.licensingVerdict(),
                snapshot.lastCheckTimestamp(),
                RelativeTimeFormatter.format(snapshot.lastCheckTimestamp(), now),
                snapshot.success(),
                snapshot.errorMessage()
        );
    }

    /**
     * One-line summary, e.g. {@code STRONG [MEETS_STRONG_INTEGRITY] checked 5 min ago}.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder(overallStatus.name())
                .append(' ')
                .append(deviceVerdicts)
                .append(" checked ")
                .append(lastChecked);
        if (errorMessage != null && !errorMessage.isEmpty()) {
            sb.append(" (").append(errorMessage).append(')');
        }
        return sb.toString();
    }
}
