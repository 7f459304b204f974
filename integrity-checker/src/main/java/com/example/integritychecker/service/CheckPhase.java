package com.example.integritychecker.service;

/**
 * Steps of a single check, in execution order. FAILED is reachable from
 * REQUESTING_TOKEN, VERIFYING and EXTRACTING_VERDICT.
 */
public enum CheckPhase {
    IDLE,
    FETCHING_PREVIOUS,
    REQUESTING_TOKEN,
    VERIFYING,
    EXTRACTING_VERDICT,
    PERSISTING,
    DETECTING_CHANGES,
    NOTIFYING_DISPLAYS,
    DONE,
    FAILED
}
