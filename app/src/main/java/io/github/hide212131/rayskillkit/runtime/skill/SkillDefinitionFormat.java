package io.github.hide212131.rayskillkit.runtime.skill;

public enum SkillDefinitionFormat {
    JSON,
    YAML
}
