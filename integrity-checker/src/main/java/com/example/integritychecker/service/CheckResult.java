package com.example.integritychecker.service;

/**
 * Outcome of one check as seen by the scheduler.
 */
public sealed interface CheckResult {
    record Success() implements CheckResult {}
    record Retry(String message) implements CheckResult {}
    record Failure(String message) implements CheckResult {}
    record Cancelled() implements CheckResult {}
}
