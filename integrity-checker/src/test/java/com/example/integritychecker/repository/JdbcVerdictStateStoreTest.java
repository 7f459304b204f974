package com.example.integritychecker.repository;

import com.example.integritychecker.model.AppVerdict;
import com.example.integritychecker.model.DeviceVerdict;
import com.example.integritychecker.model.LicensingVerdict;
import com.example.integritychecker.model.OverallStatus;
import com.example.integritychecker.model.VerdictSnapshot;
import com.example.integritychecker.service.IntegrityCheckException;
import com.example.integritychecker.service.IntegrityCheckException.Kind;
import com.example.integritychecker.util.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcVerdictStateStoreTest {

    private EmbeddedDatabase database;
    private JdbcClient jdbcClient;
    private MutableClock clock;
    private JdbcVerdictStateStore store;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("schema.sql")
                .build();
        jdbcClient = JdbcClient.create(database);
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z").toEpochMilli());
        store = new JdbcVerdictStateStore(jdbcClient, clock);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void emptyStoreReadsNeverChecked() throws Exception {
        assertThat(store.read()).isEqualTo(VerdictSnapshot.NEVER_CHECKED);
        assertThat(store.read().overallStatus()).isEqualTo(OverallStatus.UNKNOWN);
    }

    @Test
    void successSurvivesReopen() throws Exception {
        store.recordSuccess(Set.of(DeviceVerdict.MEETS_BASIC_INTEGRITY, DeviceVerdict.MEETS_DEVICE_INTEGRITY),
                AppVerdict.PLAY_RECOGNIZED, LicensingVerdict.LICENSED);

        VerdictSnapshot reopened = new JdbcVerdictStateStore(jdbcClient, clock).read();

        assertThat(reopened.deviceVerdicts())
                .containsExactly(DeviceVerdict.MEETS_DEVICE_INTEGRITY, DeviceVerdict.MEETS_BASIC_INTEGRITY);
        assertThat(reopened.appVerdict()).isEqualTo(AppVerdict.PLAY_RECOGNIZED);
        assertThat(reopened.licensingVerdict()).isEqualTo(LicensingVerdict.LICENSED);
        assertThat(reopened.lastCheckTimestamp()).isEqualTo(clock.millis());
        assertThat(reopened.success()).isTrue();
        assertThat(reopened.errorMessage()).isNull();
    }

    @Test
    void failureKeepsPreviousVerdicts() throws Exception {
        store.recordSuccess(Set.of(DeviceVerdict.MEETS_STRONG_INTEGRITY), AppVerdict.PLAY_RECOGNIZED, null);
        clock.advance(Duration.ofMinutes(5));

        VerdictSnapshot failed = store.recordFailure("Token request failed: offline");

        assertThat(failed.deviceVerdicts()).containsExactly(DeviceVerdict.MEETS_STRONG_INTEGRITY);
        assertThat(failed.appVerdict()).isEqualTo(AppVerdict.PLAY_RECOGNIZED);
        assertThat(failed.errorMessage()).isEqualTo("Token request failed: offline");
        assertThat(failed.overallStatus()).isEqualTo(OverallStatus.ERROR);
        assertThat(new JdbcVerdictStateStore(jdbcClient, clock).read()).isEqualTo(failed);
    }

    @Test
    void emptyVerdictSetRoundTrips() throws Exception {
        store.recordSuccess(Set.of(), null, null);

        VerdictSnapshot reopened = new JdbcVerdictStateStore(jdbcClient, clock).read();

        assertThat(reopened.deviceVerdicts()).isEmpty();
        assertThat(reopened.overallStatus()).isEqualTo(OverallStatus.FAILED);
    }

    @Test
    void unknownStoredLabelsAreSkipped() throws Exception {
        jdbcClient.sql("""
                INSERT INTO verdict_state (id, device_verdicts, app_verdict, licensing_verdict,
                    last_check_timestamp, last_check_success, last_error_message)
                VALUES (1, 'MEETS_BASIC_INTEGRITY,MEETS_FUTURE_INTEGRITY', 'RETIRED_LABEL', 'LICENSED', 42, TRUE, '')
                """).update();

        VerdictSnapshot snapshot = store.read();

        assertThat(snapshot.deviceVerdicts()).containsExactly(DeviceVerdict.MEETS_BASIC_INTEGRITY);
        assertThat(snapshot.appVerdict()).isNull();
        assertThat(snapshot.licensingVerdict()).isEqualTo(LicensingVerdict.LICENSED);
        assertThat(snapshot.errorMessage()).isNull();
    }

    @Test
    void subscribersSeeCurrentStateThenChanges() throws Exception {
        List<VerdictSnapshot> seen = Collections.synchronizedList(new ArrayList<>());
        VerdictStateStore.Subscription subscription = store.subscribe(seen::add);

        VerdictSnapshot first = store.recordSuccess(Set.of(DeviceVerdict.MEETS_BASIC_INTEGRITY), null, null);
        subscription.close();
        store.recordFailure("Malformed token: x");

        assertThat(seen).containsExactly(VerdictSnapshot.NEVER_CHECKED, first);
    }

    @Test
    void writeDuringInitialDeliveryReachesSubscriberAfterIt() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch initialDelivered = new CountDownLatch(1);
        CountDownLatch releaseInitial = new CountDownLatch(1);
        List<VerdictSnapshot> seen = Collections.synchronizedList(new ArrayList<>());
        try {
            Future<VerdictStateStore.Subscription> subscribing = executor.submit(() -> store.subscribe(snapshot -> {
                seen.add(snapshot);
                if (!snapshot.hasBeenChecked()) {
                    initialDelivered.countDown();
                    try {
                        releaseInitial.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            }));
            assertThat(initialDelivered.await(5, TimeUnit.SECONDS)).isTrue();

            Future<VerdictSnapshot> writing = executor.submit(
                    () -> store.recordSuccess(Set.of(DeviceVerdict.MEETS_DEVICE_INTEGRITY), null, null));
            assertThatThrownBy(() -> writing.get(200, TimeUnit.MILLISECONDS)).isInstanceOf(TimeoutException.class);

            releaseInitial.countDown();
            subscribing.get(5, TimeUnit.SECONDS);
            VerdictSnapshot written = writing.get(5, TimeUnit.SECONDS);

            assertThat(seen).containsExactly(VerdictSnapshot.NEVER_CHECKED, written);
        } finally {
            releaseInitial.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void failingSubscriberDoesNotBreakWrites() throws Exception {
        store.subscribe(snapshot -> {
            if (snapshot.hasBeenChecked()) {
                throw new IllegalStateException("listener bug");
            }
        });

        VerdictSnapshot written = store.recordSuccess(Set.of(DeviceVerdict.MEETS_DEVICE_INTEGRITY), null, null);

        assertThat(store.read()).isEqualTo(written);
    }

    @Test
    void concurrentReadersNeverSeeTornSnapshots() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        AtomicBoolean running = new AtomicBoolean(true);
        CountDownLatch started = new CountDownLatch(3);
        try {
            Future<?> writer = executor.submit(() -> {
                for (int i = 0; i < 200; i++) {
                    clock.advance(Duration.ofMillis(1));
                    if (i % 2 == 0) {
                        store.recordSuccess(Set.of(DeviceVerdict.MEETS_STRONG_INTEGRITY),
                                AppVerdict.PLAY_RECOGNIZED, LicensingVerdict.LICENSED);
                    } else {
                        store.recordFailure("Signature invalid: " + i);
                    }
                }
                return null;
            });

            List<Future<?>> readers = new ArrayList<>();
            for (int r = 0; r < 3; r++) {
                readers.add(executor.submit(() -> {
                    started.countDown();
                    while (running.get()) {
                        VerdictSnapshot snapshot = store.read();
                        if (snapshot.hasBeenChecked()) {
                            assertThat(snapshot.deviceVerdicts()).containsExactly(DeviceVerdict.MEETS_STRONG_INTEGRITY);
                            assertThat(snapshot.errorMessage() == null).isEqualTo(snapshot.success());
                        }
                    }
                    return null;
                }));
            }

            started.await(5, TimeUnit.SECONDS);
            writer.get(30, TimeUnit.SECONDS);
            running.set(false);
            for (Future<?> reader : readers) {
                reader.get(5, TimeUnit.SECONDS);
            }
        } finally {
            running.set(false);
            executor.shutdownNow();
        }
    }

    @Test
    void unavailableDatabaseIsReported() {
        jdbcClient.sql("DROP TABLE verdict_state").update();

        assertThatThrownBy(() -> store.read())
                .isInstanceOfSatisfying(IntegrityCheckException.class,
                        e -> assertThat(e.getKind()).isEqualTo(Kind.STORE_UNAVAILABLE));
    }

    @Test
    void verdictLabelsJoinInSeverityOrder() {
        assertThat(JdbcVerdictStateStore.joinVerdicts(VerdictSnapshot.NEVER_CHECKED.withSuccess(
                Set.of(DeviceVerdict.NO_INTEGRITY, DeviceVerdict.MEETS_STRONG_INTEGRITY), null, null, 1L).deviceVerdicts()))
                .isEqualTo("MEETS_STRONG_INTEGRITY,NO_INTEGRITY");
        assertThat(JdbcVerdictStateStore.splitVerdicts("")).isEmpty();
        assertThat(JdbcVerdictStateStore.splitVerdicts(null)).isEmpty();
    }
}
