package io.github.hide212131.rayskillkit.runtime.telemetry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * イベントを {@code events.jsonl} に 1 行 1 JSON オブジェクトで保存する。
 * <p>
 * {@code {"timestamp":"2024-05-01T10:00:00Z","event":"tts.performance","attributes":{...},"metrics":{...}}}
 */
public final class JsonLinesTelemetryStore implements TelemetryStore {

    public static final String FILE_NAME = "events.jsonl";

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonLinesTelemetryStore.class);
    private static final TypeReference<Map<String, Object>> ATTRIBUTES = new TypeReference<>() {};
    private static final TypeReference<Map<String, Number>> METRICS = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonLinesTelemetryStore(Path directory) {
        this(directory, new ObjectMapper());
    }

    JsonLinesTelemetryStore(Path directory, ObjectMapper objectMapper) {
        Objects.requireNonNull(directory, "directory");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create telemetry directory: " + directory, e);
        }
        this.file = directory.resolve(FILE_NAME);
    }

    public Path file() {
        return file;
    }

    @Override
    public void append(TelemetryEvent event) {
        String line = toJson(event) + "\n";
        lock.lock();
        try {
            Files.writeString(file, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append telemetry event to " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<TelemetryEvent> readAll() {
        List<String> lines;
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return List.of();
            }
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read telemetry events from " + file, e);
        } finally {
            lock.unlock();
        }
        List<TelemetryEvent> events = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                events.add(fromJson(line));
            } catch (JsonProcessingException | DateTimeParseException | IllegalArgumentException e) {
                LOGGER.warn("Skipping unreadable telemetry line {} in {}: {}", i + 1, file, e.getMessage());
            }
        }
        return List.copyOf(events);
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to clear telemetry file " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private String toJson(TelemetryEvent event) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("timestamp", event.timestamp().toString());
        node.put("event", event.event());
        node.set("attributes", objectMapper.valueToTree(event.attributes()));
        node.set("metrics", objectMapper.valueToTree(event.metrics()));
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize telemetry event " + event.event(), e);
        }
    }

    private TelemetryEvent fromJson(String line) throws JsonProcessingException {
        JsonNode node = objectMapper.readTree(line);
        JsonNode timestamp = node.get("timestamp");
        JsonNode event = node.get("event");
        if (timestamp == null || event == null) {
            throw new IllegalArgumentException("missing timestamp or event");
        }
        Map<String, Object> attributes = node.hasNonNull("attributes")
                ? objectMapper.convertValue(node.get("attributes"), ATTRIBUTES)
                : Map.of();
        Map<String, Number> metrics = node.hasNonNull("metrics")
                ? objectMapper.convertValue(node.get("metrics"), METRICS)
                : Map.of();
        return new TelemetryEvent(Instant.parse(timestamp.asText()), event.asText(), attributes, metrics);
    }
}
