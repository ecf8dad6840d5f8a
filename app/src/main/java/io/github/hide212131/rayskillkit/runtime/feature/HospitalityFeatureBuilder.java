package io.github.hide212131.rayskillkit.runtime.feature;

import java.util.List;

public final class HospitalityFeatureBuilder extends AbstractFeatureBuilder {

    public static final String NAME = "hospitality";

    private static final List<String> PURPOSES = List.of("business", "leisure", "family", "spa", "event", "conference");

    public HospitalityFeatureBuilder() {
        super(NAME);
    }

    @Override
    protected void collect(FeaturePayload payload, FeatureSignals signals) {
        signals.ratio(payload.number("occupiedRooms"), payload.number("totalRooms"))
                .scaled(payload.number("stayLength"), 30f)
                .scaled(payload.number("guestRating"), 5f)
                .count(payload.size("amenities"), 25f)
                .keywords(payload.joinedText("preferences", "purpose"), PURPOSES)
                .flag(payload.flag("vipGuest"))
                .ratio(payload.number("cleanRooms"), payload.number("totalRooms"))
                .length(payload.text("roomType"), 64)
                .formula(payload.text("pricingModel"));
    }
}
