package io.github.hide212131.rayskillkit.runtime.telemetry;

import java.util.List;

/** Append-only storage of retained events. */
public interface TelemetryStore {

    void append(TelemetryEvent event);

    /** Events in insertion order. */
    List<TelemetryEvent> readAll();

    void clear();
}
