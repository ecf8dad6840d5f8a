package io.github.hide212131.rayskillkit.runtime.feature;

import java.util.List;

public final class AgricultureFeatureBuilder extends AbstractFeatureBuilder {

    public static final String NAME = "agriculture";

    private static final List<String> CROP_ISSUES =
            List.of("pest", "drought", "disease", "harvest", "fertilizer", "yield");

    public AgricultureFeatureBuilder() {
        super(NAME);
    }

    @Override
    protected void collect(FeaturePayload payload, FeatureSignals signals) {
        signals.scaled(payload.number("soilMoisture"), 100f)
                .scaled(payload.number("rainfallMm"), 500f)
                .scaled(payload.number("growthStage"), 10f)
                .scaled(payload.number("temperatureC"), 50f)
                .ratio(payload.number("healthyPlants"), payload.number("totalPlants"))
                .length(payload.text("crop"), 64)
                .keywords(payload.joinedText("cropStatus", "issues"), CROP_ISSUES)
                .flag(payload.flag("irrigationNeeded"))
                .scaled(payload.number("soilPh"), 14f);
    }
}
