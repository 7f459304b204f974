package com.example.integritychecker.controller;

import com.example.integritychecker.display.StateStreamBroadcaster;
import com.example.integritychecker.model.CheckInterval;
import com.example.integritychecker.model.CheckerSettings;
import com.example.integritychecker.model.StatusView;
import com.example.integritychecker.repository.VerdictStateStore;
import com.example.integritychecker.scheduling.CheckScheduler;
import com.example.integritychecker.service.IntegrityCheckException;
import com.example.integritychecker.service.IntegrityCheckService;
import com.example.integritychecker.service.SettingsService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/integrity")
public class IntegrityController {

    private final VerdictStateStore stateStore;
    private final CheckScheduler checkScheduler;
    private final IntegrityCheckService checkService;
    private final SettingsService settingsService;
    private final StateStreamBroadcaster broadcaster;
    private final Clock clock;

    public IntegrityController(VerdictStateStore stateStore,
                               CheckScheduler checkScheduler,
                               IntegrityCheckService checkService,
                               SettingsService settingsService,
                               StateStreamBroadcaster broadcaster,
                               Clock clock) {
        this.stateStore = stateStore;
        this.checkScheduler = checkScheduler;
        this.checkService = checkService;
        this.settingsService = settingsService;
        this.broadcaster = broadcaster;
        this.clock = clock;
    }

    @GetMapping(value = "/state", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<StatusView> getState() {
        try {
            return ResponseEntity.ok(StatusView.of(stateStore.read(), clock.millis()));
        } catch (IntegrityCheckException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, e.toErrorMessage(), e);
        }
    }

    @PostMapping(value = "/check", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> requestCheck() {
        checkScheduler.scheduleImmediate();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("scheduled", true);
        response.put("phase", checkService.getCurrentPhase());
        return ResponseEntity.accepted().body(response);
    }

    @GetMapping(value = "/check", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> getCheckStatus() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("phase", checkService.getCurrentPhase());
        response.put("periodic_scheduled", checkScheduler.isPeriodicScheduled());
        response.put("interval", CheckInterval.labelFor(checkScheduler.getPeriodicIntervalMinutes()));
        return ResponseEntity.ok(response);
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream() {
        try {
            return broadcaster.register(stateStore.read());
        } catch (IntegrityCheckException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, e.toErrorMessage(), e);
        }
    }

    @GetMapping(value = "/settings", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CheckerSettings> getSettings() {
        try {
            return ResponseEntity.ok(settingsService.getSettings());
        } catch (IntegrityCheckException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, e.toErrorMessage(), e);
        }
    }

    @PutMapping(value = "/settings", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CheckerSettings> updateSettings(@RequestBody CheckerSettings settings) {
        try {
            return ResponseEntity.ok(settingsService.updateSettings(settings));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        } catch (IntegrityCheckException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, e.toErrorMessage(), e);
        }
    }

    @GetMapping(value = "/intervals", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<CheckInterval> getIntervals() {
        return List.of(CheckInterval.values());
    }
}
