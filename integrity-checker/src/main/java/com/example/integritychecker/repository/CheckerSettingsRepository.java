package com.example.integritychecker.repository;

import com.example.integritychecker.model.CheckerSettings;
import com.example.integritychecker.service.IntegrityCheckException;
import com.example.integritychecker.service.IntegrityCheckException.Kind;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

@Repository
public class CheckerSettingsRepository {

    private static final int ROW_ID = 1;

    private final JdbcClient jdbcClient;

    public CheckerSettingsRepository(JdbcClient jdbcClient) {
        this.jdbcClient = jdbcClient;
    }

    /**
     * @return stored settings, or {@link CheckerSettings#DEFAULTS} if none were saved yet
     */
    public CheckerSettings load() throws IntegrityCheckException {
        try {
            return jdbcClient.sql("SELECT * FROM checker_settings WHERE id = :id")
                .param("id", ROW_ID)
                .query((rs, rowNum) -> new CheckerSettings(
                        rs.getBoolean("alerts_enabled"),
                        rs.getInt("check_interval_minutes"),
                        rs.getBoolean("periodic_refresh_enabled")))
                .optional()
                .orElse(CheckerSettings.DEFAULTS);
        } catch (DataAccessException e) {
            throw new IntegrityCheckException(Kind.STORE_UNAVAILABLE, e.getMostSpecificCause().getMessage(), e);
        }
    }

    public void save(CheckerSettings settings) throws IntegrityCheckException {
        try {
            jdbcClient.sql("""
                MERGE INTO checker_settings (id, alerts_enabled, check_interval_minutes, periodic_refresh_enabled)
                KEY (id)
                VALUES (:id, :alertsEnabled, :checkIntervalMinutes, :periodicRefreshEnabled)
                """)
                .param("id", ROW_ID)
                .param("alertsEnabled", settings.alertsEnabled())
                .param("checkIntervalMinutes", settings.checkIntervalMinutes())
                .param("periodicRefreshEnabled", settings.periodicRefreshEnabled())
                .update();
        } catch (DataAccessException e) {
            throw new IntegrityCheckException(Kind.STORE_UNAVAILABLE, e.getMostSpecificCause().getMessage(), e);
        }
    }
}
