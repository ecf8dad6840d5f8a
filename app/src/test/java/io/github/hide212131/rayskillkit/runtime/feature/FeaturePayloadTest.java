package io.github.hide212131.rayskillkit.runtime.feature;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FeaturePayloadTest {

    @Test
    @DisplayName("Map から変換すると未対応の値と null は捨てられる")
    void conversionDropsUnsupportedValues() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("gradeLevel", 9);
        raw.put("subject", "化学");
        raw.put("needsStepByStep", true);
        raw.put("hints", List.of("balance", "count atoms"));
        raw.put("missing", null);
        raw.put("thread", new Thread());

        FeaturePayload payload = FeaturePayload.of(raw);

        assertThat(payload.size()).isEqualTo(4);
        assertThat(payload.get("missing")).isEmpty();
        assertThat(payload.get("thread")).isEmpty();
        assertThat(payload.number("gradeLevel")).contains(9f);
        assertThat(payload.text("subject")).contains("化学");
        assertThat(payload.flag("needsStepByStep")).isEqualTo(1f);
        assertThat(payload.size("hints")).contains(2f);
    }

    @Test
    void readersCoerceBetweenValueKinds() {
        FeaturePayload payload = FeaturePayload.builder()
                .text("price", " 12.5 ")
                .text("label", "not a number")
                .flag("member", true)
                .number("count", 3)
                .text("express", "TRUE")
                .build();

        assertThat(payload.number("price")).contains(12.5f);
        assertThat(payload.number("label")).isEmpty();
        assertThat(payload.number("member")).contains(1f);
        assertThat(payload.text("count")).contains("3.0");
        assertThat(payload.flag("express")).isEqualTo(1f);
        assertThat(payload.flag("count")).isEqualTo(1f);
        assertThat(payload.flag("absent")).isZero();
        assertThat(payload.size("label")).contains(12f);
    }

    @Test
    void joinedTextSkipsBlankAndMissingKeys() {
        FeaturePayload payload = FeaturePayload.builder()
                .text("topic", "math")
                .text("blank", "  ")
                .text("question", "solve x")
                .build();

        assertThat(payload.joinedText("topic", "blank", "nothing", "question")).contains("math solve x");
        assertThat(payload.joinedText("blank", "nothing")).isEmpty();
    }

    @Test
    void keepsInsertionOrderAndIsImmutable() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("b", 1);
        raw.put("a", 2);
        FeaturePayload payload = FeaturePayload.of(raw);
        raw.put("c", 3);

        assertThat(payload.asMap().keySet()).containsExactly("b", "a");
        assertThat(payload).isEqualTo(FeaturePayload.builder().number("b", 1).number("a", 2).build());
        assertThat(FeaturePayload.empty().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("配列内の null は変換時に捨てられる")
    void arrayElementsThatAreNullAreDropped() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("symptoms", new Object[] {"cough", null, "fever"});

        FeaturePayload payload = FeaturePayload.of(raw);

        assertThat(payload.get("symptoms")).contains(new FeatureValue.TextListValue(List.of("cough", "fever")));
        assertThat(payload.size("symptoms")).contains(2f);
    }
}
