package com.example.integritychecker.display;

import com.example.integritychecker.model.VerdictSnapshot;

/**
 * Something that renders the current verdict state. Refreshing is idempotent and best-effort.
 */
public interface DisplaySurface {

    void refresh(VerdictSnapshot snapshot);
}
