package io.github.hide212131.rayskillkit.runtime.localization;

import io.github.hide212131.rayskillkit.runtime.decision.ComplianceDisclaimers;
import io.github.hide212131.rayskillkit.runtime.decision.DecisionEngine;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * スキル ID ごとの要約を英語と簡体字中国語で作る。
 * <p>
 * Summaries per skill id. Health skills ({@code hc_} prefix) share one processor; other unknown ids get a generic
 * "completed" summary that {@code summary}/{@code summaryZh} metadata can replace.
 */
public final class SkillPostProcessors {

    private final Map<String, SkillPostProcessor> processors = new ConcurrentHashMap<>();

    public static SkillPostProcessors withDefaults() {
        SkillPostProcessors postProcessors = new SkillPostProcessors();
        postProcessors.register("education_assistant", SkillPostProcessors::education);
        postProcessors.register("retail_helper", SkillPostProcessors::retail);
        postProcessors.register("travel_planner", SkillPostProcessors::travel);
        return postProcessors;
    }

    public void register(String skillId, SkillPostProcessor processor) {
        processors.put(Objects.requireNonNull(skillId, "skillId"), Objects.requireNonNull(processor, "processor"));
    }

    public LocalizedSkillSummary postProcess(String skillId, float[] output, Map<String, ?> metadata) {
        Objects.requireNonNull(skillId, "skillId");
        float[] values = output == null ? new float[0] : output;
        Map<String, ?> context = metadata == null ? Map.of() : metadata;
        SkillPostProcessor processor = processors.get(skillId);
        if (processor != null) {
            return processor.process(values, context);
        }
        if (DecisionEngine.isHealthSkill(skillId)) {
            return health(skillId, values);
        }
        return fallback(skillId, context);
    }

    private static LocalizedSkillSummary education(float[] output, Map<String, ?> metadata) {
        String subject = text(metadata, "subject").orElse("学习");
        return new LocalizedSkillSummary(
                "Personalized study guidance prepared for " + subject,
                "已为" + subject + "准备个性化学习指导");
    }

    private static LocalizedSkillSummary retail(float[] output, Map<String, ?> metadata) {
        String product = text(metadata, "product").orElse("商品");
        Optional<String> price = text(metadata, "price");
        float score = max(output);
        StringBuilder english = new StringBuilder("Retail recommendation for ").append(product)
                .append(String.format(Locale.ROOT, " (score %.2f)", score));
        StringBuilder chinese = new StringBuilder("推荐").append(product)
                .append(String.format(Locale.ROOT, "，评分%.2f", score));
        price.ifPresent(value -> {
            english.append(", priced at ").append(value);
            chinese.append("，价格").append(value);
        });
        return new LocalizedSkillSummary(english.toString(), chinese.toString());
    }

    private static LocalizedSkillSummary travel(float[] output, Map<String, ?> metadata) {
        String destination = text(metadata, "destination").orElse("旅程");
        Optional<String> itinerary = text(metadata, "itinerary");
        float percent = Math.max(0f, Math.min(1f, max(output))) * 100f;
        StringBuilder english = new StringBuilder("Itinerary generated for ").append(destination)
                .append(String.format(Locale.ROOT, " with %.0f%% confidence", percent));
        StringBuilder chinese = new StringBuilder("已为").append(destination)
                .append(String.format(Locale.ROOT, "规划行程，置信度%.0f%%", percent));
        itinerary.ifPresent(value -> {
            english.append(": ").append(value);
            chinese.append("：").append(value);
        });
        return new LocalizedSkillSummary(english.toString(), chinese.toString());
    }

    /** Risk is the largest output clamped to [0, 1]. */
    private static LocalizedSkillSummary health(String skillId, float[] output) {
        float risk = Math.max(0f, Math.min(1f, max(output)));
        return new LocalizedSkillSummary(
                String.format(Locale.ROOT, "Health check %s: risk score %.2f. %s", skillId, risk,
                        ComplianceDisclaimers.forLocale(ComplianceDisclaimers.EN_US).get(0)),
                String.format(Locale.ROOT, "健康检查%s：风险评分%.2f。%s", skillId, risk,
                        ComplianceDisclaimers.forLocale(ComplianceDisclaimers.ZH_CN).get(0)));
    }

    private static LocalizedSkillSummary fallback(String skillId, Map<String, ?> metadata) {
        return new LocalizedSkillSummary(
                text(metadata, "summary").orElse("Skill " + skillId + " completed"),
                text(metadata, "summaryZh").orElse("技能" + skillId + "已完成"));
    }

    private static Optional<String> text(Map<String, ?> metadata, String key) {
        Object value = metadata.get(key);
        return value == null ? Optional.empty() : Optional.of(value.toString()).filter(s -> !s.isBlank());
    }

    private static float max(float[] output) {
        if (output.length == 0) {
            return 0f;
        }
        float max = output[0];
        for (float value : output) {
            max = Math.max(max, value);
        }
        return max;
    }
}
