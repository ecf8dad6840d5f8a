package io.github.hide212131.rayskillkit.app;

import io.github.hide212131.rayskillkit.runtime.SkillKit;

/**
 * Creates a started {@link SkillKit} for one command invocation.
 */
@FunctionalInterface
interface SkillKitFactory {

    /**
     * @throws IllegalStateException on configuration errors
     */
    SkillKit create();
}
