package io.github.hide212131.rayskillkit.runtime.feature;

import java.util.List;

public final class TravelFeatureBuilder extends AbstractFeatureBuilder {

    public static final String NAME = "travel";

    private static final List<String> CONCERNS = List.of("flight", "hotel", "car", "visa", "delay", "emergency");

    public TravelFeatureBuilder() {
        super(NAME);
    }

    @Override
    protected void collect(FeaturePayload payload, FeatureSignals signals) {
        signals.scaled(payload.number("distanceKm"), 20_000f)
                .scaled(payload.number("durationHours"), 240f)
                .scaled(payload.number("budgetUsd"), 20_000f)
                .ratio(payload.number("completedSteps"), payload.number("totalSteps"))
                .count(payload.size("layovers"), 6f)
                .keywords(payload.joinedText("notes", "destination", "intent"), CONCERNS)
                .flag(payload.flag("international"))
                .length(payload.text("destination"), 64)
                .formula(payload.text("routingFormula"));
    }
}
