package io.github.hide212131.rayskillkit.app;

import io.github.hide212131.rayskillkit.runtime.SkillKit;
import io.github.hide212131.rayskillkit.runtime.telemetry.TelemetryEvent;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "telemetry", description = "Print persisted telemetry events")
final class TelemetryCommand extends KitCommand {

    @Option(names = "--prefix", description = "Only events whose name starts with this prefix")
    String prefix;

    @Option(names = "--clear", description = "Delete persisted events after printing them")
    boolean clear;

    TelemetryCommand(SkillKitFactory factory) {
        super(factory);
    }

    @Override
    int execute(SkillKit kit) {
        List<TelemetryEvent> events = kit.telemetry().events().stream()
                .filter(event -> prefix == null || event.event().startsWith(prefix))
                .toList();
        for (TelemetryEvent event : events) {
            out().println(event.timestamp() + " " + event.event() + " " + event.attributes() + " "
                    + event.metrics());
        }
        out().println(events.size() + " events");
        if (clear) {
            kit.telemetry().clear();
        }
        return 0;
    }
}
