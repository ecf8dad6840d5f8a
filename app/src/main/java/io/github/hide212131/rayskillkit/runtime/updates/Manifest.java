package io.github.hide212131.rayskillkit.runtime.updates;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Release manifest: {@code {"version":"1.0.0","files":["skills.json"],"digests":{"skills.json":"<sha256>"}}}.
 * The signature covers the exact bytes the manifest was read from.
 */
public record Manifest(String version, List<String> files, Map<String, String> digests) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public Manifest {
        Objects.requireNonNull(version, "version");
        files = List.copyOf(Objects.requireNonNull(files, "files"));
        Map<String, String> normalized = new LinkedHashMap<>();
        Objects.requireNonNull(digests, "digests")
                .forEach((file, digest) -> normalized.put(file, digest.toLowerCase(Locale.ROOT)));
        digests = Collections.unmodifiableMap(normalized);
    }

    /**
     * @throws IllegalArgumentException when the bytes are not a manifest document
     */
    public static Manifest parse(byte[] json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (IOException e) {
            throw new IllegalArgumentException("Manifest is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Manifest must be a JSON object");
        }
        JsonNode version = root.get("version");
        if (version == null || !version.isTextual() || version.asText().isBlank()) {
            throw new IllegalArgumentException("Manifest version must be a non-blank string");
        }
        JsonNode filesNode = root.get("files");
        if (filesNode == null || !filesNode.isArray()) {
            throw new IllegalArgumentException("Manifest files must be an array");
        }
        List<String> files = new ArrayList<>();
        for (JsonNode file : filesNode) {
            if (!file.isTextual()) {
                throw new IllegalArgumentException("Manifest files must be strings");
            }
            files.add(file.asText());
        }
        Map<String, String> digests = new LinkedHashMap<>();
        JsonNode digestsNode = root.get("digests");
        if (digestsNode != null && !digestsNode.isNull()) {
            if (!digestsNode.isObject()) {
                throw new IllegalArgumentException("Manifest digests must be an object");
            }
            digestsNode.fields().forEachRemaining(entry -> {
                if (!entry.getValue().isTextual()) {
                    throw new IllegalArgumentException("Digest of " + entry.getKey() + " must be a string");
                }
                digests.put(entry.getKey(), entry.getValue().asText());
            });
        }
        return new Manifest(version.asText(), files, digests);
    }

    public boolean lists(String file) {
        return files.contains(file);
    }

    public Optional<String> digestOf(String file) {
        return Optional.ofNullable(digests.get(file));
    }
}
