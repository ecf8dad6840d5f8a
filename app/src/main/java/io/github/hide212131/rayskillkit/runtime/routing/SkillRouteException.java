package io.github.hide212131.rayskillkit.runtime.routing;

import java.util.Objects;

/**
 * Failure of one route. Carried inside {@link RouteResult.Failure}; thrown only by
 * {@link RouteResult#orElseThrow()}.
 */
public class SkillRouteException extends RuntimeException {

    private final String skillId;
    private final RouteErrorCategory category;

    public SkillRouteException(String skillId, RouteErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.skillId = skillId;
        this.category = Objects.requireNonNull(category, "category");
    }

    public String skillId() {
        return skillId;
    }

    public RouteErrorCategory category() {
        return category;
    }
}
