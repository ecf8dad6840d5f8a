package io.github.hide212131.rayskillkit.runtime.routing;

import io.github.hide212131.rayskillkit.infra.observability.SkillTracer;
import io.github.hide212131.rayskillkit.runtime.skill.SkillRegistration;
import io.github.hide212131.rayskillkit.runtime.skill.SkillRegistry;
import io.github.hide212131.rayskillkit.runtime.skill.SkillTypes;
import io.github.hide212131.rayskillkit.runtime.telemetry.Telemetry;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * スキルを解決し、特徴量を構築して実行し、結果を記録する。
 * <p>
 * ルーティング上の問題は例外ではなく {@link RouteResult.Failure} として返す。
 */
public final class Router {

    private static final Logger LOGGER = LoggerFactory.getLogger(Router.class);
    static final String SPAN_NAME = "skill.route";
    static final String TRIGGER_PREFIX = "trigger:";

    private final SkillRegistry registry;
    private final Telemetry telemetry;
    private final SkillTracer tracer;

    public Router(SkillRegistry registry, Telemetry telemetry) {
        this(registry, telemetry, SkillTracer.noop());
    }

    public Router(SkillRegistry registry, Telemetry telemetry, SkillTracer tracer) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    public RouteResult<Object> routeSkill(String skillId, Object payload) {
        return routeSkill(skillId, payload, Object.class);
    }

    public <O> RouteResult<O> routeSkill(String skillId, Object payload, Class<O> outputType) {
        Objects.requireNonNull(outputType, "outputType");
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("skill.id", String.valueOf(skillId));
        return tracer.trace(SPAN_NAME, attributes, () -> {
            long started = System.nanoTime();
            Optional<SkillRegistration<?, ?, ?>> registration = registry.getRegistration(skillId);
            RouteResult<O> result = registration.isPresent()
                    ? execute(registration.get(), payload, outputType)
                    : RouteResult.failure(new SkillRouteException(skillId, RouteErrorCategory.NOT_FOUND,
                            "Skill not registered: " + skillId, null));
            record(skillId, result, elapsedMillis(started));
            return result;
        });
    }

    /** Routes to the skill bound to the trigger phrase. */
    public <O> RouteResult<O> routeByTrigger(String trigger, Object payload, Class<O> outputType) {
        Optional<SkillRegistration<?, ?, ?>> registration = registry.getSkillByTrigger(trigger);
        if (registration.isEmpty()) {
            SkillRouteException error = new SkillRouteException(null, RouteErrorCategory.NOT_FOUND,
                    "No skill bound to trigger '" + trigger + "'", null);
            LOGGER.warn(error.getMessage());
            recordFailure(TRIGGER_PREFIX + trigger, error, 0.0);
            return RouteResult.failure(error);
        }
        return routeSkill(registration.get().id(), payload, outputType);
    }

    private <P, F, R, O> RouteResult<O> execute(SkillRegistration<P, F, R> registration, Object payload,
            Class<O> outputType) {
        String skillId = registration.id();
        SkillTypes<P, F, R> types = registration.types();
        if (!types.acceptsPayload(payload)) {
            return failure(skillId, RouteErrorCategory.PAYLOAD_TYPE, "Skill %s expects %s but got %s".formatted(
                    skillId, types.payloadType().getName(),
                    payload == null ? "null" : payload.getClass().getName()), null);
        }
        F features;
        try {
            features = registration.descriptor().buildFeatures(types.payloadType().cast(payload));
        } catch (Exception | LinkageError | AssertionError e) {
            return failure(skillId, RouteErrorCategory.BUILD_FAILED,
                    "Feature building failed for " + skillId + ": " + e.getMessage(), e);
        }
        R output;
        try {
            output = registration.runner().runSkill(features);
        } catch (Exception | LinkageError | AssertionError e) {
            return failure(skillId, RouteErrorCategory.RUN_FAILED,
                    "Skill " + skillId + " failed: " + e.getMessage(), e);
        }
        if (!outputType.isInstance(output)) {
            return failure(skillId, RouteErrorCategory.OUTPUT_TYPE, "Skill %s produced %s, expected %s".formatted(
                    skillId, output == null ? "null" : output.getClass().getName(), outputType.getName()), null);
        }
        return RouteResult.success(outputType.cast(output));
    }

    private <O> RouteResult<O> failure(String skillId, RouteErrorCategory category, String message,
            Throwable cause) {
        return RouteResult.failure(new SkillRouteException(skillId, category, message, cause));
    }

    private void record(String skillId, RouteResult<?> result, double latencyMs) {
        if (result instanceof RouteResult.Failure<?> failure) {
            SkillRouteException error = failure.exception();
            LOGGER.warn("Route to {} failed ({}): {}", skillId, error.category().tag(), error.getMessage());
            tracer.recordFailure(error.category().tag(), error);
            recordFailure(String.valueOf(skillId), error, latencyMs);
        } else {
            try {
                telemetry.recordRouterSuccess(skillId, latencyMs);
            } catch (RuntimeException e) {
                LOGGER.warn("Failed to record route telemetry for {}: {}", skillId, e.getMessage());
            }
        }
    }

    /** Telemetry failures are logged; the route result stands. */
    private void recordFailure(String name, SkillRouteException error, double latencyMs) {
        try {
            telemetry.recordRouterFailure(name, error.category().tag(), error.getMessage(), latencyMs);
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to record route telemetry for {}: {}", name, e.getMessage());
        }
    }

    private static double elapsedMillis(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000.0;
    }
}
