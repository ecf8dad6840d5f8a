package io.github.hide212131.rayskillkit.runtime.feature;

import java.util.List;

public final class SecurityFeatureBuilder extends AbstractFeatureBuilder {

    public static final String NAME = "security";

    private static final List<String> INCIDENTS = List.of("intrusion", "fire", "door", "window", "panic", "tamper");

    public SecurityFeatureBuilder() {
        super(NAME);
    }

    @Override
    protected void collect(FeaturePayload payload, FeatureSignals signals) {
        signals.scaled(payload.number("alertLevel"), 10f)
                .scaled(payload.number("sensorsTriggered"), 50f)
                .ratio(payload.number("resolvedIncidents"), payload.number("openIncidents"))
                .length(payload.text("location"), 128)
                .keywords(payload.joinedText("summary", "alerts"), INCIDENTS)
                .flag(payload.flag("verified"))
                .count(payload.size("cameras"), 50f)
                .formula(payload.text("thresholdFormula"));
    }
}
