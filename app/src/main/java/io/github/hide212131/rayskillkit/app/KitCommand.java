package io.github.hide212131.rayskillkit.app;

import io.github.hide212131.rayskillkit.runtime.SkillKit;
import io.github.hide212131.rayskillkit.runtime.skill.SkillDefinitionException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * {@link SkillKit} を必要とするサブコマンドの基底クラス。 Configuration problems end the command with
 * {@link SkillKitCliApp#EXIT_CONFIGURATION_ERROR}.
 */
abstract class KitCommand implements Callable<Integer> {

    private final SkillKitFactory factory;

    @Spec
    CommandSpec commandSpec;

    KitCommand(SkillKitFactory factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    @Override
    public Integer call() {
        Optional<SkillKit> kit = createKit();
        if (kit.isEmpty()) {
            return SkillKitCliApp.EXIT_CONFIGURATION_ERROR;
        }
        return execute(kit.get());
    }

    abstract int execute(SkillKit kit);

    Optional<SkillKit> createKit() {
        try {
            return Optional.of(factory.create());
        } catch (IllegalStateException | SkillDefinitionException | UncheckedIOException e) {
            err().println("Configuration error: " + e.getMessage());
            return Optional.empty();
        }
    }

    PrintWriter out() {
        return commandSpec.commandLine().getOut();
    }

    PrintWriter err() {
        return commandSpec.commandLine().getErr();
    }
}
