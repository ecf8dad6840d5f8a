package io.github.hide212131.rayskillkit.runtime.telemetry;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonLinesTelemetryStoreTest {

    @Test
    void writesOneJsonObjectPerLine(@TempDir Path tempDir) throws IOException {
        JsonLinesTelemetryStore store = new JsonLinesTelemetryStore(tempDir.resolve("nested"));

        store.append(new TelemetryEvent(Instant.parse("2024-05-01T10:00:00Z"), "tts.performance",
                Map.of("success", true), Map.of("tts.ms", 12)));

        List<String> lines = Files.readAllLines(store.file(), StandardCharsets.UTF_8);
        assertThat(lines).singleElement().satisfies(line -> assertThat(line)
                .startsWith("{\"timestamp\":\"2024-05-01T10:00:00Z\",\"event\":\"tts.performance\"")
                .contains("\"attributes\":{\"success\":true}")
                .contains("\"metrics\":{\"tts.ms\":12}"));
    }

    @Test
    void unreadableLinesAreSkippedWithoutLosingOthers(@TempDir Path tempDir) throws IOException {
        JsonLinesTelemetryStore store = new JsonLinesTelemetryStore(tempDir);
        store.append(new TelemetryEvent(Instant.EPOCH, "first", Map.of(), Map.of()));
        Files.writeString(store.file(), "{not json\n\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        store.append(new TelemetryEvent(Instant.EPOCH, "second", Map.of(), Map.of()));

        assertThat(store.readAll()).extracting(TelemetryEvent::event).containsExactly("first", "second");
    }

    @Test
    void missingFileReadsAsEmpty(@TempDir Path tempDir) {
        assertThat(new JsonLinesTelemetryStore(tempDir).readAll()).isEmpty();
    }
}
