package io.github.hide212131.rayskillkit.runtime.feature;

import java.util.List;
import java.util.Optional;

/** Tutoring signals: grade, difficulty, answer accuracy, hints and an optional equation. */
public final class EducationFeatureBuilder extends AbstractFeatureBuilder {

    public static final String NAME = "education";

    private static final List<String> TOPICS = List.of("math", "science", "history", "language", "coding", "exam");

    public EducationFeatureBuilder() {
        super(NAME);
    }

    @Override
    protected void collect(FeaturePayload payload, FeatureSignals signals) {
        float correct = payload.number("correctCount").orElse(0f);
        float incorrect = payload.number("incorrectCount").orElse(0f);
        Optional<Float> attempts = Optional.of(correct + incorrect);

        signals.scaled(payload.number("gradeLevel"), 12f)
                .scaled(payload.number("difficulty"), 10f)
                .length(payload.text("question"), 256)
                .scaled(payload.number("timeRemaining"), 60f)
                .ratio(Optional.of(correct), attempts)
                .ratio(Optional.of(incorrect), attempts)
                .count(payload.size("hints"), 10f)
                .keywords(payload.joinedText("topic", "question"), TOPICS)
                .formula(payload.text("equation"))
                .flag(payload.flag("needsStepByStep"));
    }
}
