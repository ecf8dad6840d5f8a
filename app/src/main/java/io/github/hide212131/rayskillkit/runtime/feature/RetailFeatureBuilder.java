package io.github.hide212131.rayskillkit.runtime.feature;

import java.util.List;
import java.util.Optional;

public final class RetailFeatureBuilder extends AbstractFeatureBuilder {

    public static final String NAME = "retail";

    private static final List<String> INTENTS = List.of("sale", "new", "bundle", "premium", "limited", "subscription");

    public RetailFeatureBuilder() {
        super(NAME);
    }

    @Override
    protected void collect(FeaturePayload payload, FeatureSignals signals) {
        Optional<Float> price = payload.number("price");

        signals.scaled(price, 2000f)
                .scaled(payload.number("discount"), 100f)
                .ratio(payload.number("inventory"), payload.number("capacity"))
                .scaled(payload.number("basketSize"), 50f)
                .length(payload.text("description"), 512)
                .keywords(payload.joinedText("intent", "productName", "description"), INTENTS)
                .delta(price, payload.number("listPrice"), 1f)
                .flag(payload.flag("loyalCustomer"))
                .formula(payload.text("pricingFormula"));
    }
}
