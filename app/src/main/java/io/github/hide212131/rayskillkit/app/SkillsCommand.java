package io.github.hide212131.rayskillkit.app;

import io.github.hide212131.rayskillkit.runtime.SkillKit;
import io.github.hide212131.rayskillkit.runtime.skill.SkillRegistration;
import picocli.CommandLine.Command;

@Command(name = "skills", description = "List registered skills and their triggers")
final class SkillsCommand extends KitCommand {

    SkillsCommand(SkillKitFactory factory) {
        super(factory);
    }

    @Override
    int execute(SkillKit kit) {
        for (SkillRegistration<?, ?, ?> registration : kit.registry().registrations()) {
            String triggers = registration.triggers().isEmpty() ? "-" : String.join(", ", registration.triggers());
            out().printf("%-20s triggers: %s%n", registration.id(), triggers);
        }
        out().printf("%d skills%n", kit.registry().listSkills().size());
        return 0;
    }
}
