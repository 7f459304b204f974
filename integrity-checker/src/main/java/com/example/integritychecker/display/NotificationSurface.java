package com.example.integritychecker.display;

/**
 * User-facing alerts. Implementations without permission to notify do nothing.
 */
public interface NotificationSurface {

    void notifyChange(String title, String message, boolean improvement);

    void notifyCheckFailed(String errorMessage);
}
