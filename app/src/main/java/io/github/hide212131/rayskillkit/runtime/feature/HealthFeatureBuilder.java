package io.github.hide212131.rayskillkit.runtime.feature;

import java.util.List;

/**
 * Vital signs and symptom cues used by the {@code hc_} health skills. These feed awareness features only; the
 * decision layer adds the disclaimers.
 */
public final class HealthFeatureBuilder extends AbstractFeatureBuilder {

    public static final String NAME = "health";

    private static final List<String> SYMPTOMS = List.of("pain", "fever", "cough", "injury", "allergy", "infection");

    public HealthFeatureBuilder() {
        super(NAME);
    }

    @Override
    protected void collect(FeaturePayload payload, FeatureSignals signals) {
        signals.scaled(payload.number("heartRate"), 200f)
                .scaled(payload.number("temperatureC"), 45f)
                .scaled(payload.number("oxygenSaturation"), 100f)
                .scaled(payload.number("severity"), 5f)
                .length(payload.text("symptoms"), 256)
                .keywords(payload.joinedText("symptoms", "diagnosis"), SYMPTOMS)
                .flag(payload.flag("isEmergency"))
                .scaled(payload.number("medicationAdherence"), 100f)
                .count(payload.size("allergies"), 10f)
                .formula(payload.text("dosageFormula"));
    }
}
