package io.github.hide212131.rayskillkit.runtime.decision;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of gating a skill result on its confidence.
 *
 * @param action {@code ask}, {@code proceed}, or the skill name for confident metadata-mode decisions
 * @param sigmaGate threshold the confidence was compared against
 */
public record DecisionOutcome(String action, String message, float confidence, float sigmaGate,
        Map<String, Object> metadata) {

    public static final String ASK = "ask";
    public static final String PROCEED = "proceed";
    public static final String COMPLIANCE_DISCLAIMERS = "complianceDisclaimers";

    public DecisionOutcome {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(message, "message");
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata == null ? Map.of() : metadata));
    }

    public boolean isAsk() {
        return ASK.equals(action);
    }

    @SuppressWarnings("unchecked")
    public Optional<Map<String, List<String>>> complianceDisclaimers() {
        Object value = metadata.get(COMPLIANCE_DISCLAIMERS);
        return value instanceof Map<?, ?> map ? Optional.of((Map<String, List<String>>) map) : Optional.empty();
    }
}
