package com.example.integritychecker.display;

import com.example.integritychecker.model.StatusView;
import com.example.integritychecker.model.VerdictSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Writes the status line to the log on every refresh.
 */
@Component
public class StatusLogDisplay implements DisplaySurface {

    private static final Logger logger = LoggerFactory.getLogger(StatusLogDisplay.class);

    private final Clock clock;

    public StatusLogDisplay(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void refresh(VerdictSnapshot snapshot) {
        logger.info("Integrity status: {}", StatusView.of(snapshot, clock.millis()).summary());
    }
}
