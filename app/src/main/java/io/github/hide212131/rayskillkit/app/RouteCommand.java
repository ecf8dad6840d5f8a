package io.github.hide212131.rayskillkit.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hide212131.rayskillkit.runtime.SkillKit;
import io.github.hide212131.rayskillkit.runtime.decision.DecisionOutcome;
import io.github.hide212131.rayskillkit.runtime.decision.DecisionRequest;
import io.github.hide212131.rayskillkit.runtime.feature.FeaturePayload;
import io.github.hide212131.rayskillkit.runtime.localization.LocalizedSkillSummary;
import io.github.hide212131.rayskillkit.runtime.routing.RouteResult;
import io.github.hide212131.rayskillkit.runtime.skill.SkillRegistration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.UUID;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "route", description = "Route a JSON payload to a skill and print the decision")
final class RouteCommand extends KitCommand {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @ArgGroup(exclusive = true, multiplicity = "1")
    Target target;

    @Option(names = "--payload", required = true, description = "Payload as a JSON object")
    String payload;

    @Option(names = "--confidence", defaultValue = "1.0", description = "Confidence of the skill result")
    float confidence;

    @Option(names = "--metadata", description = "Decision and summary metadata (key=value)")
    Map<String, String> metadata = new LinkedHashMap<>();

    static final class Target {

        @Option(names = "--skill", required = true, description = "Skill id")
        String skillId;

        @Option(names = "--trigger", required = true, description = "Trigger phrase")
        String trigger;
    }

    RouteCommand(SkillKitFactory factory) {
        super(factory);
    }

    @Override
    int execute(SkillKit kit) {
        Map<String, Object> fields;
        try {
            fields = MAPPER.readValue(payload, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException e) {
            err().println("Invalid payload JSON: " + e.getOriginalMessage());
            return SkillKitCliApp.EXIT_ROUTE_FAILURE;
        }
        Optional<String> skillId = resolveSkillId(kit);
        if (skillId.isEmpty()) {
            err().println("Routing failed [not_found]: no skill bound to trigger '" + target.trigger + "'");
            return SkillKitCliApp.EXIT_ROUTE_FAILURE;
        }
        // JSON の null は空の入力として扱う
        FeaturePayload features = fields == null ? FeaturePayload.empty() : FeaturePayload.of(fields);
        RouteResult<float[]> result = kit.router().routeSkill(skillId.get(), features, float[].class);
        if (result instanceof RouteResult.Failure<float[]> failure) {
            err().printf("Routing failed [%s]: %s%n", failure.category().tag(), failure.exception().getMessage());
            return SkillKitCliApp.EXIT_ROUTE_FAILURE;
        }
        float[] vector = result.orElseThrow();
        out().println("Skill: " + skillId.get());
        out().println("Vector: " + format(vector));

        Map<String, Object> context = new LinkedHashMap<>(metadata);
        DecisionOutcome outcome = kit.decisionEngine().decide(
                new DecisionRequest(UUID.randomUUID().toString(), skillId.get(), confidence, context));
        out().printf(Locale.ROOT, "Decision: %s (confidence %.2f, gate %.2f)%n", outcome.action(),
                outcome.confidence(), outcome.sigmaGate());
        outcome.complianceDisclaimers().ifPresent(disclaimers -> disclaimers.forEach(
                (locale, lines) -> out().println("Disclaimer (" + locale + "): " + String.join(" ", lines))));

        LocalizedSkillSummary summary = kit.postProcessors().postProcess(skillId.get(), vector, context);
        summary.asMap().forEach((locale, text) -> out().println("Summary (" + locale + "): " + text));
        return 0;
    }

    private Optional<String> resolveSkillId(SkillKit kit) {
        if (target.skillId != null) {
            return Optional.of(target.skillId);
        }
        return kit.registry().getSkillByTrigger(target.trigger).map(SkillRegistration::id);
    }

    private static String format(float[] vector) {
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        for (float value : vector) {
            joiner.add(String.format(Locale.ROOT, "%.4f", value));
        }
        return joiner.toString();
    }
}
