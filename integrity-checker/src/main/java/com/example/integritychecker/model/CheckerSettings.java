package com.example.integritychecker.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * User-tunable settings persisted next to the verdict state.
 *
 * @param alertsEnabled          whether verdict changes raise a notification
 * @param checkIntervalMinutes   period of the background check
 * @param periodicRefreshEnabled whether the background check is scheduled at all
 */
public record CheckerSettings(
        @JsonProperty("alerts_enabled") boolean alertsEnabled,
        @JsonProperty("check_interval_minutes") int checkIntervalMinutes,
        @JsonProperty("periodic_refresh_enabled") boolean periodicRefreshEnabled
) {
    public static final int DEFAULT_INTERVAL_MINUTES = 60;

    public static final CheckerSettings DEFAULTS =
            new CheckerSettings(true, DEFAULT_INTERVAL_MINUTES, true);
}
