package io.github.hide212131.rayskillkit.runtime.telemetry;

import java.util.ArrayList;
import java.util.List;

public final class InMemoryTelemetryStore implements TelemetryStore {

    private final List<TelemetryEvent> events = new ArrayList<>();

    @Override
    public synchronized void append(TelemetryEvent event) {
        events.add(event);
    }

    @Override
    public synchronized List<TelemetryEvent> readAll() {
        return List.copyOf(events);
    }

    @Override
    public synchronized void clear() {
        events.clear();
    }
}
