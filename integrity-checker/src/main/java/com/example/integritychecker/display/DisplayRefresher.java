package com.example.integritychecker.display;

import com.example.integritychecker.model.VerdictSnapshot;
import com.example.integritychecker.repository.VerdictStateStore;
import com.example.integritychecker.service.IntegrityCheckException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Pushes the stored state to every display surface. Failures are logged per
 * surface and never propagate to the caller.
 */
@Component
public class DisplayRefresher {

    private static final Logger logger = LoggerFactory.getLogger(DisplayRefresher.class);

    private final VerdictStateStore stateStore;
    private final List<DisplaySurface> surfaces;

    public DisplayRefresher(VerdictStateStore stateStore, List<DisplaySurface> surfaces) {
        this.stateStore = stateStore;
        this.surfaces = List.copyOf(surfaces);
    }

    public void refreshAll() {
        VerdictSnapshot snapshot;
        try {
            snapshot = stateStore.read();
        } catch (IntegrityCheckException e) {
            logger.error("Failed to update displays: {}", e.toErrorMessage(), e);
            return;
        }
        for (DisplaySurface surface : surfaces) {
            try {
                surface.refresh(snapshot);
            } catch (RuntimeException e) {
                logger.error("Failed to update display {}", surface.getClass().getSimpleName(), e);
            }
        }
    }
}
