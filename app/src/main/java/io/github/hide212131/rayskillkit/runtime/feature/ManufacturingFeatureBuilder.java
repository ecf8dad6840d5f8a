package io.github.hide212131.rayskillkit.runtime.feature;

import java.util.List;

public final class ManufacturingFeatureBuilder extends AbstractFeatureBuilder {

    public static final String NAME = "manufacturing";

    private static final List<String> LINE_ISSUES =
            List.of("blocked", "maintenance", "overheat", "quality", "materials", "idle");

    public ManufacturingFeatureBuilder() {
        super(NAME);
    }

    @Override
    protected void collect(FeaturePayload payload, FeatureSignals signals) {
        signals.scaled(payload.number("throughput"), 10_000f)
                .scaled(payload.number("downtimeMinutes"), 1_440f)
                .scaled(payload.number("defectRate"), 100f)
                .ratio(payload.number("completedUnits"), payload.number("plannedUnits"))
                .length(payload.text("lineStatus"), 128)
                .keywords(payload.joinedText("lineStatus", "alerts"), LINE_ISSUES)
                .flag(payload.flag("maintenanceRequired"))
                .scaled(payload.number("temperatureC"), 200f)
                .count(payload.size("alerts"), 15f);
    }
}
