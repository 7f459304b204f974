package com.example.integritychecker.config;

import com.example.integritychecker.service.IntegrityCheckException;
import com.example.integritychecker.service.SettingsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Restores the periodic check from the saved settings on startup.
 */
@Component
public class ScheduleInitializer implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ScheduleInitializer.class);

    private final SettingsService settingsService;

    public ScheduleInitializer(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @Override
    public void run(String... args) {
        try {
            settingsService.restoreSchedule();
        } catch (IntegrityCheckException e) {
            log.error("Could not restore periodic check schedule: {}", e.toErrorMessage(), e);
        }
    }
}
