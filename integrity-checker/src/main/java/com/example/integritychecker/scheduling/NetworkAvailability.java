package com.example.integritychecker.scheduling;

/**
 * Gate consulted before each scheduled check; checks only run while connected.
 */
@FunctionalInterface
public interface NetworkAvailability {

    boolean isAvailable();
}
