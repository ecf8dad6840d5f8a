package io.github.hide212131.rayskillkit.runtime.localization;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SkillPostProcessorsTest {

    private final SkillPostProcessors postProcessors = SkillPostProcessors.withDefaults();

    @Test
    @DisplayName("教育スキルは科目名入りの中国語要約を返す")
    void educationSummaryMentionsSubject() {
        LocalizedSkillSummary summary =
                postProcessors.postProcess("education_assistant", new float[] {0.2f}, Map.of("subject", "化学"));

        assertThat(summary.zhCN()).isEqualTo("已为化学准备个性化学习指导");
        assertThat(summary.english()).isEqualTo("Personalized study guidance prepared for 化学");
        assertThat(summary.isChineseTranslationAvailable()).isTrue();
    }

    @Test
    void educationSubjectDefaultsToStudy() {
        assertThat(postProcessors.postProcess("education_assistant", new float[0], Map.of("subject", " ")).zhCN())
                .isEqualTo("已为学习准备个性化学习指导");
    }

    @Test
    void retailSummaryUsesTopScoreAndPrice() {
        LocalizedSkillSummary summary = postProcessors.postProcess("retail_helper", new float[] {0.1f, 0.876f},
                Map.of("product", "登山鞋", "price", "¥399"));

        assertThat(summary.zhCN()).isEqualTo("推荐登山鞋，评分0.88，价格¥399");
        assertThat(summary.english()).isEqualTo("Retail recommendation for 登山鞋 (score 0.88), priced at ¥399");
    }

    @Test
    void travelSummaryClampsConfidence() {
        LocalizedSkillSummary summary = postProcessors.postProcess("travel_planner", new float[] {1.7f},
                Map.of("destination", "京都", "itinerary", "清水寺 → 祇园"));

        assertThat(summary.zhCN()).isEqualTo("已为京都规划行程，置信度100%：清水寺 → 祇园");
        assertThat(summary.english()).isEqualTo("Itinerary generated for 京都 with 100% confidence: 清水寺 → 祇园");
    }

    @Test
    void unknownSkillsFallBackToCompletionSummary() {
        LocalizedSkillSummary summary = postProcessors.postProcess("energy_optimizer", new float[0], Map.of());

        assertThat(summary.asMap()).containsExactly(
                Map.entry("en-US", "Skill energy_optimizer completed"),
                Map.entry("zh-CN", "技能energy_optimizer已完成"));
    }

    @Test
    void fallbackCanBeOverriddenByMetadata() {
        LocalizedSkillSummary summary = postProcessors.postProcess("energy_optimizer", null,
                Map.of("summary", "Peak load shifted", "summaryZh", "已转移峰值负荷"));

        assertThat(summary).isEqualTo(new LocalizedSkillSummary("Peak load shifted", "已转移峰值负荷"));
    }

    @Test
    void healthSkillsReportRiskWithDisclaimer() {
        LocalizedSkillSummary summary = postProcessors.postProcess("hc_sun_hydro", new float[] {0.42f}, Map.of());

        assertThat(summary.english()).startsWith("Health check hc_sun_hydro: risk score 0.42.")
                .contains("medical advice");
        assertThat(summary.zhCN()).contains("风险评分0.42").contains("不构成医疗建议");
    }

    @Test
    void registeredProcessorsReplaceDefaults() {
        postProcessors.register("energy_optimizer", (output, metadata) ->
                new LocalizedSkillSummary("saved " + output.length, ""));

        LocalizedSkillSummary summary = postProcessors.postProcess("energy_optimizer", new float[3], Map.of());

        assertThat(summary.english()).isEqualTo("saved 3");
        assertThat(summary.isChineseTranslationAvailable()).isFalse();
    }
}
