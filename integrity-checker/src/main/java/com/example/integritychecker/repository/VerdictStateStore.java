package com.example.integritychecker.repository;

import com.example.integritychecker.model.AppVerdict;
import com.example.integritychecker.model.DeviceVerdict;
import com.example.integritychecker.model.LicensingVerdict;
import com.example.integritychecker.model.VerdictSnapshot;
import com.example.integritychecker.service.IntegrityCheckException;

import java.util.Set;
import java.util.function.Consumer;

/**
 * Holder of the single current {@link VerdictSnapshot}. Each write replaces the
 * whole record; readers see either the old or the new record, never a mix.
 */
public interface VerdictStateStore {

    VerdictSnapshot read() throws IntegrityCheckException;

    /**
     * Overwrites all verdicts, marks the check successful, clears the error and stamps the time.
     */
    VerdictSnapshot recordSuccess(Set<DeviceVerdict> deviceVerdicts, AppVerdict appVerdict,
                                  LicensingVerdict licensingVerdict) throws IntegrityCheckException;

    /**
     * Keeps the previous verdicts, marks the check failed, stores {@code message} and stamps the time.
     */
    VerdictSnapshot recordFailure(String message) throws IntegrityCheckException;

    /**
     * Delivers the current snapshot immediately and then every subsequent change.
     * Listeners run on the writing thread and must not block.
     */
    Subscription subscribe(Consumer<VerdictSnapshot> listener);

    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
