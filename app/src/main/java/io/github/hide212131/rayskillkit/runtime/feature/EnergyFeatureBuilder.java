package io.github.hide212131.rayskillkit.runtime.feature;

import java.util.List;

public final class EnergyFeatureBuilder extends AbstractFeatureBuilder {

    public static final String NAME = "energy";

    private static final List<String> GRID_STATES =
            List.of("peak", "shortage", "maintenance", "surplus", "derate", "fault");

    public EnergyFeatureBuilder() {
        super(NAME);
    }

    @Override
    protected void collect(FeaturePayload payload, FeatureSignals signals) {
        signals.scaled(payload.number("consumptionMw"), 100_000f)
                .scaled(payload.number("productionMw"), 100_000f)
                .scaled(payload.number("renewableShare"), 1f)
                .ratio(payload.number("batteryLevel"), payload.number("batteryCapacity"))
                .count(payload.size("outages"), 20f)
                .keywords(payload.joinedText("gridStatus", "alerts"), GRID_STATES)
                .flag(payload.flag("peakDemand"))
                .length(payload.text("region"), 48)
                .formula(payload.text("loadForecastFormula"));
    }
}
