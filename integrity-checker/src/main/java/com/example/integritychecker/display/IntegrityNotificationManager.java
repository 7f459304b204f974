package com.example.integritychecker.display;

import com.example.integritychecker.config.IntegrityCheckerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Raises verdict-change and check-failure alerts. Without notification permission
 * every call is a silent no-op.
 */
@Component
public class IntegrityNotificationManager implements NotificationSurface {

    private static final Logger logger = LoggerFactory.getLogger(IntegrityNotificationManager.class);

    static final String CHECK_FAILED_TITLE = "Integrity Check Failed";

    private final IntegrityCheckerProperties.Notifications notifications;
    private final StateStreamBroadcaster broadcaster;

    public IntegrityNotificationManager(IntegrityCheckerProperties properties, StateStreamBroadcaster broadcaster) {
        this.notifications = properties.getNotifications();
        this.broadcaster = broadcaster;
    }

    @Override
    public void notifyChange(String title, String message, boolean improvement) {
        if (!hasNotificationPermission()) {
            return;
        }
        if (improvement) {
            logger.info("{}: {}", title, message);
        } else {
            logger.warn("{}: {}", title, message);
        }
        broadcaster.broadcastNotification(new StateStreamBroadcaster.Notification(title, message, improvement));
    }

    @Override
    public void notifyCheckFailed(String errorMessage) {
        if (!hasNotificationPermission()) {
            return;
        }
        logger.warn("{}: {}", CHECK_FAILED_TITLE, errorMessage);
        broadcaster.broadcastNotification(new StateStreamBroadcaster.Notification(CHECK_FAILED_TITLE, errorMessage, false));
    }

    public boolean hasNotificationPermission() {
        return notifications.isEnabled();
    }
}
