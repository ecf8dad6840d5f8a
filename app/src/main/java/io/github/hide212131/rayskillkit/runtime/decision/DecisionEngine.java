package io.github.hide212131.rayskillkit.runtime.decision;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * スキル結果をそのまま実行してよいか、ユーザーへの確認が必要かを判定する。
 * 信頼度がゲートと等しい場合は実行側に倒す。
 */
public final class DecisionEngine {

    public static final String HEALTH_PREFIX = "hc_";

    private final SigmaGates gates;

    public DecisionEngine() {
        this(SigmaGates.defaults());
    }

    public DecisionEngine(SigmaGates gates) {
        this.gates = Objects.requireNonNull(gates, "gates");
    }

    /**
     * Simple mode: {@code ask} below the skill's gate, {@code proceed} otherwise. Health skill messages always
     * carry the disclaimer.
     */
    public DecisionOutcome decide(String skillId, float confidence, String baseMessage) {
        Objects.requireNonNull(skillId, "skillId");
        float gate = gates.gateFor(skillId);
        String action = confidence < gate ? DecisionOutcome.ASK : DecisionOutcome.PROCEED;
        String base = baseMessage == null ? "" : baseMessage;
        String message = isHealthSkill(skillId) ? ComplianceDisclaimers.appendTo(base) : base;
        return new DecisionOutcome(action, message, confidence, gate, Map.of());
    }

    public DecisionOutcome decide(DecisionRequest request) {
        return decide(request, null);
    }

    /**
     * Metadata mode. Gate precedence: {@code sigmaGateOverride}, a {@code sigmaGate} metadata entry, the skill's
     * gate. Disclaimers are attached only to health skills below the gate.
     *
     * @param sigmaGateOverride explicit gate, or {@code null}
     */
    public DecisionOutcome decide(DecisionRequest request, Float sigmaGateOverride) {
        Objects.requireNonNull(request, "request");
        float gate = sigmaGateOverride != null
                ? SigmaGates.checkGate("override", sigmaGateOverride)
                : metadataGate(request.metadata()).orElseGet(() -> gates.gateFor(request.skillName()));
        boolean below = request.confidence() < gate;
        boolean health = isHealthSkill(request.skillName()) || flagged(request.metadata().get("health"));

        Map<String, Object> metadata = new LinkedHashMap<>(request.metadata());
        metadata.put("sigmaGate", gate);
        metadata.put("decisionId", request.id());
        metadata.put("confidence", request.confidence());
        if (below && health) {
            metadata.put(DecisionOutcome.COMPLIANCE_DISCLAIMERS, ComplianceDisclaimers.asMetadata());
        }
        Object message = request.metadata().get("message");
        return new DecisionOutcome(below ? DecisionOutcome.ASK : request.skillName(),
                message == null ? "" : message.toString(), request.confidence(), gate, metadata);
    }

    public static boolean isHealthSkill(String skillId) {
        return skillId != null && skillId.startsWith(HEALTH_PREFIX);
    }

    public SigmaGates gates() {
        return gates;
    }

    private static Optional<Float> metadataGate(Map<String, Object> metadata) {
        Object value = metadata.get("sigmaGate");
        if (value == null) {
            return Optional.empty();
        }
        float gate;
        if (value instanceof Number number) {
            gate = number.floatValue();
        } else {
            try {
                gate = Float.parseFloat(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("sigmaGate metadata is not a number: " + value, e);
            }
        }
        return Optional.of(SigmaGates.checkGate("metadata", gate));
    }

    private static boolean flagged(Object value) {
        return value instanceof Boolean flag ? flag : value != null && Boolean.parseBoolean(value.toString());
    }
}
