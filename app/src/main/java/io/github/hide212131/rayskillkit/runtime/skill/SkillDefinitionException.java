package io.github.hide212131.rayskillkit.runtime.skill;

/** Raised when a skill definition document cannot be read, parsed or validated. */
public class SkillDefinitionException extends RuntimeException {

    public SkillDefinitionException(String message) {
        super(message);
    }

    public SkillDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
