package io.github.hide212131.rayskillkit.runtime.feature;

import java.util.List;

public final class FinanceFeatureBuilder extends AbstractFeatureBuilder {

    public static final String NAME = "finance";

    private static final List<String> USE_CASES = List.of("loan", "investment", "budget", "savings", "fraud", "insurance");

    public FinanceFeatureBuilder() {
        super(NAME);
    }

    @Override
    protected void collect(FeaturePayload payload, FeatureSignals signals) {
        signals.scaled(payload.number("amount"), 100_000f)
                .scaled(payload.number("termMonths"), 360f)
                .scaled(payload.number("interestRate"), 30f)
                .scaled(payload.number("riskScore"), 100f)
                .ratio(payload.number("approvedAmount"), payload.number("requestedAmount"))
                .flag(payload.flag("requiresManualReview"))
                .keywords(payload.joinedText("intent", "useCase"), USE_CASES)
                .count(payload.size("documents"), 20f)
                .formula(payload.text("amortizationFormula"));
    }
}
