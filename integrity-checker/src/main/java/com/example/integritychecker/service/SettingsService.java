package com.example.integritychecker.service;

import com.example.integritychecker.model.CheckerSettings;
import com.example.integritychecker.repository.CheckerSettingsRepository;
import com.example.integritychecker.scheduling.CheckScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Persists user settings and keeps the background schedule in line with them.
 */
@Service
public class SettingsService {

    private static final Logger logger = LoggerFactory.getLogger(SettingsService.class);

    private final CheckerSettingsRepository settingsRepository;
    private final CheckScheduler checkScheduler;

    public SettingsService(CheckerSettingsRepository settingsRepository, CheckScheduler checkScheduler) {
        this.settingsRepository = settingsRepository;
        this.checkScheduler = checkScheduler;
    }

    public CheckerSettings getSettings() throws IntegrityCheckException {
        return settingsRepository.load();
    }

    /**
     * @throws IllegalArgumentException if the interval is not positive
     */
    public CheckerSettings updateSettings(CheckerSettings settings) throws IntegrityCheckException {
        if (settings.checkIntervalMinutes() <= 0) {
            throw new IllegalArgumentException("Check interval must be positive: " + settings.checkIntervalMinutes());
        }
        settingsRepository.save(settings);
        logger.info("Saved settings: alerts={}, interval={} min, periodic={}",
                settings.alertsEnabled(), settings.checkIntervalMinutes(), settings.periodicRefreshEnabled());
        applySchedule(settings);
        return settings;
    }

    public void restoreSchedule() throws IntegrityCheckException {
        applySchedule(settingsRepository.load());
    }

    private void applySchedule(CheckerSettings settings) {
        if (settings.periodicRefreshEnabled()) {
            checkScheduler.schedulePeriodic(settings.checkIntervalMinutes());
        } else {
            checkScheduler.cancelPeriodic();
        }
    }
}
