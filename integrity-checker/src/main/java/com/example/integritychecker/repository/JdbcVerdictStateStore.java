package com.example.integritychecker.repository;

import com.example.integritychecker.model.AppVerdict;
import com.example.integritychecker.model.DeviceVerdict;
import com.example.integritychecker.model.LicensingVerdict;
import com.example.integritychecker.model.VerdictSnapshot;
import com.example.integritychecker.service.IntegrityCheckException;
import com.example.integritychecker.service.IntegrityCheckException.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Single-row {@code verdict_state} table fronted by a copy-on-write cache.
 * Writers are serialized; a new snapshot is published only after its row is written.
 */
@Repository
public class JdbcVerdictStateStore implements VerdictStateStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcVerdictStateStore.class);

    private static final int ROW_ID = 1;
    private static final String VERDICT_DELIMITER = ",";

    private final JdbcClient jdbcClient;
    private final Clock clock;

    private final AtomicReference<VerdictSnapshot> current = new AtomicReference<>();
    private final ReentrantLock writeLock = new ReentrantLock();
    private final List<Consumer<VerdictSnapshot>> subscribers = new CopyOnWriteArrayList<>();

    public JdbcVerdictStateStore(JdbcClient jdbcClient, Clock clock) {
        this.jdbcClient = jdbcClient;
        this.clock = clock;
    }

    @Override
    public VerdictSnapshot read() throws IntegrityCheckException {
        VerdictSnapshot snapshot = current.get();
        if (snapshot != null) {
            return snapshot;
        }
        writeLock.lock();
        try {
            snapshot = current.get();
            if (snapshot == null) {
                snapshot = load();
                current.set(snapshot);
            }
            return snapshot;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public VerdictSnapshot recordSuccess(Set<DeviceVerdict> deviceVerdicts, AppVerdict appVerdict,
                                         LicensingVerdict licensingVerdict) throws IntegrityCheckException {
        writeLock.lock();
        try {
            VerdictSnapshot previous = read();
            VerdictSnapshot next = previous.withSuccess(deviceVerdicts, appVerdict, licensingVerdict, clock.millis());
            return publish(previous, next);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public VerdictSnapshot recordFailure(String message) throws IntegrityCheckException {
        writeLock.lock();
        try {
            VerdictSnapshot previous = read();
            VerdictSnapshot next = previous.withFailure(message, clock.millis());
            return publish(previous, next);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Subscription subscribe(Consumer<VerdictSnapshot> listener) {
        Objects.requireNonNull(listener, "listener");
        writeLock.lock();
        try {
            subscribers.add(listener);
            deliver(listener, read());
        } catch (IntegrityCheckException e) {
            logger.warn("Could not deliver initial state to new subscriber: {}", e.toErrorMessage());
        } finally {
            writeLock.unlock();
        }
        return () -> subscribers.remove(listener);
    }

    private VerdictSnapshot publish(VerdictSnapshot previous, VerdictSnapshot next) throws IntegrityCheckException {
        save(next);
        current.set(next);
        logger.debug("Stored verdict state: success={}, verdicts={}", next.success(), next.deviceVerdicts());
        if (!next.equals(previous)) {
            for (Consumer<VerdictSnapshot> subscriber : subscribers) {
                deliver(subscriber, next);
            }
        }
        return next;
    }

    private void deliver(Consumer<VerdictSnapshot> subscriber, VerdictSnapshot snapshot) {
        try {
            subscriber.accept(snapshot);
        } catch (RuntimeException e) {
            logger.error("Verdict state subscriber failed", e);
        }
    }

    private VerdictSnapshot load() throws IntegrityCheckException {
        try {
            return jdbcClient.sql("SELECT * FROM verdict_state WHERE id = :id")
                .param("id", ROW_ID)
                .query((rs, rowNum) -> mapRow(rs))
                .optional()
                .orElse(VerdictSnapshot.NEVER_CHECKED);
        } catch (DataAccessException e) {
            throw new IntegrityCheckException(Kind.STORE_UNAVAILABLE, e.getMostSpecificCause().getMessage(), e);
        }
    }

    private void save(VerdictSnapshot snapshot) throws IntegrityCheckException {
        try {
            jdbcClient.sql("""
                MERGE INTO verdict_state
                (id, device_verdicts, app_verdict, licensing_verdict, last_check_timestamp, last_check_success, last_error_message)
                KEY (id)
                VALUES (:id, :deviceVerdicts, :appVerdict, :licensingVerdict, :lastCheckTimestamp, :success, :errorMessage)
                """)
                .param("id", ROW_ID)
                .param("deviceVerdicts", joinVerdicts(snapshot.deviceVerdicts()))
                .param("appVerdict", snapshot.appVerdict() == null ? null : snapshot.appVerdict().name())
                .param("licensingVerdict", snapshot.licensingVerdict() == null ? null : snapshot.licensingVerdict().name())
                .param("lastCheckTimestamp", snapshot.lastCheckTimestamp())
                .param("success", snapshot.success())
                .param("errorMessage", snapshot.errorMessage())
                .update();
        } catch (DataAccessException e) {
            throw new IntegrityCheckException(Kind.STORE_UNAVAILABLE, e.getMostSpecificCause().getMessage(), e);
        }
    }

    private VerdictSnapshot mapRow(ResultSet rs) throws SQLException {
        String errorMessage = rs.getString("last_error_message");
        return new VerdictSnapshot(
                splitVerdicts(rs.getString("device_verdicts")),
                AppVerdict.fromLabel(rs.getString("app_verdict")),
                LicensingVerdict.fromLabel(rs.getString("licensing_verdict")),
                rs.getLong("last_check_timestamp"),
                rs.getBoolean("last_check_success"),
                errorMessage == null || errorMessage.isEmpty() ? null : errorMessage
        );
    }

    static String joinVerdicts(Set<DeviceVerdict> verdicts) {
        return verdicts.stream().map(Enum::name).collect(Collectors.joining(VERDICT_DELIMITER));
    }

    static Set<DeviceVerdict> splitVerdicts(String stored) {
        Set<DeviceVerdict> verdicts = EnumSet.noneOf(DeviceVerdict.class);
        if (stored == null || stored.isEmpty()) {
            return verdicts;
        }
        for (String label : stored.split(VERDICT_DELIMITER)) {
            DeviceVerdict verdict = DeviceVerdict.fromLabel(label);
            if (verdict != null) {
                verdicts.add(verdict);
            } else if (!label.isBlank()) {
                logger.warn("Skipping unknown stored device verdict: {}", label);
            }
        }
        return verdicts;
    }
}
