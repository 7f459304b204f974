package com.example.integritychecker.service;

import com.example.integritychecker.model.AppVerdict;
import com.example.integritychecker.model.DeviceVerdict;
import com.example.integritychecker.model.LicensingVerdict;
import com.example.integritychecker.model.OverallStatus;
import com.example.integritychecker.model.VerdictChange;
import com.example.integritychecker.model.VerdictSnapshot;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static com.example.integritychecker.model.DeviceVerdict.MEETS_BASIC_INTEGRITY;
import static com.example.integritychecker.model.DeviceVerdict.MEETS_DEVICE_INTEGRITY;
import static com.example.integritychecker.model.DeviceVerdict.MEETS_STRONG_INTEGRITY;
import static org.assertj.core.api.Assertions.assertThat;

class VerdictChangeDetectorTest {

    private final VerdictChangeDetector detector = new VerdictChangeDetector();

    private static VerdictSnapshot snapshot(Set<DeviceVerdict> device, AppVerdict app, LicensingVerdict licensing) {
        return VerdictSnapshot.NEVER_CHECKED.withSuccess(device, app, licensing, 1_000L);
    }

    @Test
    void firstCheckIsNeverAChange() {
        VerdictSnapshot current = snapshot(Set.of(MEETS_STRONG_INTEGRITY), AppVerdict.PLAY_RECOGNIZED, null);

        assertThat(detector.detect(VerdictSnapshot.NEVER_CHECKED, current)).isEmpty();
    }

    @Test
    void identicalVerdictsAreNotAChange() {
        VerdictSnapshot previous = snapshot(Set.of(MEETS_BASIC_INTEGRITY), AppVerdict.PLAY_RECOGNIZED, LicensingVerdict.LICENSED);
        VerdictSnapshot current = previous.withSuccess(Set.of(MEETS_BASIC_INTEGRITY), AppVerdict.PLAY_RECOGNIZED,
                LicensingVerdict.LICENSED, 2_000L);

        assertThat(detector.detect(previous, current)).isEmpty();
    }

    @Test
    void deviceUpgradeIsImprovement() {
        VerdictSnapshot previous = snapshot(Set.of(MEETS_BASIC_INTEGRITY), null, null);
        VerdictSnapshot current = snapshot(Set.of(MEETS_BASIC_INTEGRITY, MEETS_DEVICE_INTEGRITY), null, null);

        VerdictChange change = detector.detect(previous, current).orElseThrow();

        assertThat(change.title()).isEqualTo("Integrity Status Changed");
        assertThat(change.message()).isEqualTo("Device: BASIC -> DEVICE");
        assertThat(change.improvement()).isTrue();
    }

    @Test
    void deviceDowngradeIsNotImprovement() {
        VerdictSnapshot previous = snapshot(Set.of(MEETS_STRONG_INTEGRITY, MEETS_DEVICE_INTEGRITY), null, null);
        VerdictSnapshot current = snapshot(Set.of(), null, null);

        VerdictChange change = detector.detect(previous, current).orElseThrow();

        assertThat(change.message()).isEqualTo("Device: STRONG -> NONE");
        assertThat(change.improvement()).isFalse();
    }

    @Test
    void allCategoriesAreListedInOrder() {
        VerdictSnapshot previous = snapshot(Set.of(MEETS_BASIC_INTEGRITY), null, LicensingVerdict.LICENSED);
        VerdictSnapshot current = snapshot(Set.of(MEETS_DEVICE_INTEGRITY), AppVerdict.PLAY_RECOGNIZED,
                LicensingVerdict.UNLICENSED);

        Optional<VerdictChange> change = detector.detect(previous, current);

        assertThat(change).map(VerdictChange::message)
                .contains("Device: BASIC -> DEVICE, App: N/A -> PLAY_RECOGNIZED, License: LICENSED -> UNLICENSED");
    }

    @Test
    void appOnlyChangeIsNotImprovementWhenTierIsUnchanged() {
        VerdictSnapshot previous = snapshot(Set.of(MEETS_DEVICE_INTEGRITY), AppVerdict.PLAY_RECOGNIZED, null);
        VerdictSnapshot current = snapshot(Set.of(MEETS_DEVICE_INTEGRITY), AppVerdict.UNRECOGNIZED_VERSION, null);

        VerdictChange change = detector.detect(previous, current).orElseThrow();

        assertThat(change.message()).isEqualTo("App: PLAY_RECOGNIZED -> UNRECOGNIZED_VERSION");
        assertThat(change.improvement()).isFalse();
    }

    @Test
    void recoveryFromErrorComparesRetainedVerdicts() {
        VerdictSnapshot previous = snapshot(Set.of(MEETS_STRONG_INTEGRITY), null, null)
                .withFailure("Decryption failed: bad tag", 2_000L);
        VerdictSnapshot current = snapshot(Set.of(), null, null);

        VerdictChange change = detector.detect(previous, current).orElseThrow();

        assertThat(change.message()).isEqualTo("Device: STRONG -> NONE");
        assertThat(change.improvement()).isFalse();
    }

    @Test
    void improvementLadder() {
        assertThat(VerdictChangeDetector.isImprovement(OverallStatus.FAILED, Set.of(MEETS_BASIC_INTEGRITY))).isTrue();
        assertThat(VerdictChangeDetector.isImprovement(OverallStatus.BASIC, Set.of(MEETS_BASIC_INTEGRITY))).isFalse();
        assertThat(VerdictChangeDetector.isImprovement(OverallStatus.BASIC, Set.of(MEETS_STRONG_INTEGRITY))).isTrue();
        assertThat(VerdictChangeDetector.isImprovement(OverallStatus.DEVICE, Set.of(MEETS_DEVICE_INTEGRITY))).isFalse();
        assertThat(VerdictChangeDetector.isImprovement(OverallStatus.DEVICE, Set.of(MEETS_STRONG_INTEGRITY))).isTrue();
        assertThat(VerdictChangeDetector.isImprovement(OverallStatus.STRONG, Set.of(MEETS_STRONG_INTEGRITY))).isFalse();
        assertThat(VerdictChangeDetector.isImprovement(OverallStatus.ERROR, Set.of(MEETS_STRONG_INTEGRITY))).isFalse();
        assertThat(VerdictChangeDetector.isImprovement(OverallStatus.UNKNOWN, Set.of(MEETS_STRONG_INTEGRITY))).isFalse();
    }

    @Test
    void highestLabelFallsBackToNone() {
        assertThat(VerdictChangeDetector.highestLabel(Set.of(DeviceVerdict.MEETS_VIRTUAL_INTEGRITY))).isEqualTo("NONE");
        assertThat(VerdictChangeDetector.highestLabel(Set.of())).isEqualTo("NONE");
    }
}
