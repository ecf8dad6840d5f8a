package io.github.hide212131.rayskillkit.runtime.decision;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DecisionEngineTest {

    private final DecisionEngine engine = new DecisionEngine();

    @Test
    @DisplayName("ゲートと同じ信頼度は proceed になる")
    void confidenceEqualToGateProceeds() {
        DecisionOutcome outcome = engine.decide("hc_gait_guard", 0.82f, "Walk carefully");

        assertThat(outcome.action()).isEqualTo(DecisionOutcome.PROCEED);
        assertThat(outcome.sigmaGate()).isEqualTo(0.82f);
    }

    @Test
    void belowGateAsksAndHealthMessageCarriesDisclaimer() {
        DecisionOutcome outcome = engine.decide("hc_med_sentinel", 0.87f, "Take your evening dose");

        assertThat(outcome.isAsk()).isTrue();
        assertThat(outcome.message())
                .startsWith("Take your evening dose\n\n")
                .contains("does not constitute medical advice")
                .contains("不构成医疗建议");
    }

    @Test
    void nonHealthMessagesAreUntouched() {
        DecisionOutcome outcome = engine.decide("travel_planner", 0.49f, "Book the 9am train");

        assertThat(outcome.action()).isEqualTo(DecisionOutcome.ASK);
        assertThat(outcome.message()).isEqualTo("Book the 9am train");
        assertThat(outcome.sigmaGate()).isEqualTo(SigmaGates.DEFAULT_GATE);
        assertThat(engine.decide("travel_planner", 0.5f, "").action()).isEqualTo(DecisionOutcome.PROCEED);
    }

    @Test
    void healthMessageWithoutBaseIsJustTheDisclaimer() {
        DecisionOutcome outcome = engine.decide("hc_sun_hydro", 0.9f, "");

        assertThat(outcome.action()).isEqualTo(DecisionOutcome.PROCEED);
        assertThat(outcome.message()).startsWith("This information is for general awareness only");
    }

    @Test
    @DisplayName("メタデータモード: ゲート未満の健康スキルは多言語の免責事項を持つ")
    void metadataModeAttachesDisclaimersBelowGate() {
        DecisionOutcome outcome = engine.decide(new DecisionRequest("d-1", "hc_gait_guard", 0.6f));

        assertThat(outcome.action()).isEqualTo("ask");
        assertThat(outcome.metadata()).containsEntry("sigmaGate", 0.82f).containsEntry("decisionId", "d-1");
        Map<String, List<String>> disclaimers = outcome.complianceDisclaimers().orElseThrow();
        assertThat(disclaimers).containsOnlyKeys("en-US", "zh-CN");
        disclaimers.values().forEach(lines -> assertThat(lines).isNotEmpty().allSatisfy(
                line -> assertThat(line).isNotBlank()));
    }

    @Test
    void metadataModeSurfacesSkillNameWhenConfident() {
        DecisionOutcome outcome = engine.decide(new DecisionRequest("d-2", "hc_gait_guard", 0.95f));

        assertThat(outcome.action()).isEqualTo("hc_gait_guard");
        assertThat(outcome.complianceDisclaimers()).isEmpty();
    }

    @Test
    void explicitOverrideWinsOverMetadataAndSkillGate() {
        DecisionRequest request = new DecisionRequest("d-3", "hc_med_sentinel", 0.7f, Map.of("sigmaGate", 0.95));

        assertThat(engine.decide(request).action()).isEqualTo("ask");
        assertThat(engine.decide(request).sigmaGate()).isEqualTo(0.95f);
        assertThat(engine.decide(request, 0.6f).action()).isEqualTo("hc_med_sentinel");
        assertThat(engine.decide(request, 0.6f).sigmaGate()).isEqualTo(0.6f);
    }

    @Test
    void metadataHealthFlagMarksNonPrefixedSkills() {
        DecisionRequest request = new DecisionRequest("d-4", "sleep_coach", 0.1f, Map.of("health", true));

        assertThat(engine.decide(request).complianceDisclaimers()).isPresent();
        assertThat(engine.decide(new DecisionRequest("d-5", "sleep_coach", 0.1f)).complianceDisclaimers())
                .isEmpty();
    }

    @Test
    void invalidGatesAreRejected() {
        assertThatThrownBy(() -> engine.decide(new DecisionRequest("d", "x", 0.5f), 1.5f))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.decide(new DecisionRequest("d", "x", 0.5f, Map.of("sigmaGate", "high"))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SigmaGates.defaults().withGate("x", -0.1f))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void customGatesApplyToSimpleMode() {
        DecisionEngine custom = new DecisionEngine(SigmaGates.defaults().withGate("retail_helper", 0.9f));

        assertThat(custom.decide("retail_helper", 0.85f, "").action()).isEqualTo("ask");
        assertThat(custom.gates().gateFor("hc_sun_hydro")).isEqualTo(0.78f);
        assertThat(custom.gates().hasGate("unknown")).isFalse();
    }

    @Test
    void requestConfidenceHelper() {
        DecisionRequest request = new DecisionRequest("d", "retail_helper", 0.5f);

        assertThat(request.isConfident()).isTrue();
        assertThat(request.isConfident(0.6f)).isFalse();
    }
}
