package io.github.hide212131.rayskillkit.runtime.feature;

import java.util.List;

public final class LogisticsFeatureBuilder extends AbstractFeatureBuilder {

    public static final String NAME = "logistics";

    private static final List<String> STATUSES = List.of("delayed", "loaded", "customs", "handoff", "failed", "signed");

    public LogisticsFeatureBuilder() {
        super(NAME);
    }

    @Override
    protected void collect(FeaturePayload payload, FeatureSignals signals) {
        signals.scaled(payload.number("weightKg"), 1000f)
                .scaled(payload.number("distanceKm"), 10_000f)
                .scaled(payload.number("priority"), 10f)
                .ratio(payload.number("deliveredStops"), payload.number("totalStops"))
                .count(payload.size("stops"), 20f)
                .keywords(payload.joinedText("status", "notes"), STATUSES)
                .flag(payload.flag("hazardous"))
                .length(payload.text("routeId"), 48)
                .formula(payload.text("routingFormula"));
    }
}
