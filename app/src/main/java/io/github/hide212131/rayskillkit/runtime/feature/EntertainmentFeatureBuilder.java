package io.github.hide212131.rayskillkit.runtime.feature;

import java.util.List;

public final class EntertainmentFeatureBuilder extends AbstractFeatureBuilder {

    public static final String NAME = "entertainment";

    private static final List<String> GENRES = List.of("action", "comedy", "drama", "live", "kids", "sports");

    public EntertainmentFeatureBuilder() {
        super(NAME);
    }

    @Override
    protected void collect(FeaturePayload payload, FeatureSignals signals) {
        signals.scaled(payload.number("durationMinutes"), 240f)
                .scaled(payload.number("rating"), 10f)
                .length(payload.text("title"), 96)
                .keywords(payload.joinedText("genre", "mood", "query"), GENRES)
                .ratio(payload.number("ticketsSold"), payload.number("capacity"))
                .flag(payload.flag("isLive"))
                .scaled(payload.number("audienceAge"), 100f)
                .length(payload.text("query"), 256)
                .formula(payload.text("scheduleFormula"));
    }
}
