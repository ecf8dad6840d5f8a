package io.github.hide212131.rayskillkit.runtime.skill;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hide212131.rayskillkit.runtime.feature.FeatureBuilder;
import io.github.hide212131.rayskillkit.runtime.feature.FeatureBuilderRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Parses and validates skill definition documents.
 *
 * <pre>
 * {"skills": [{"id": "education_assistant", "featureBuilder": "education", "triggers": ["education"]}]}
 * </pre>
 *
 * JSON は Jackson、YAML は SnakeYAML で読み込み、同じ検証を通す。 The whole document is
 * validated before anything is returned.
 */
public final class SkillDefinitionLoader {

    /** 定義ファイルで許される入力次元の上限。 */
    static final int MAX_INPUT_DIM = 4096;

    private final ObjectMapper objectMapper;
    private final FeatureBuilderRegistry featureBuilders;

    public SkillDefinitionLoader(FeatureBuilderRegistry featureBuilders) {
        this(new ObjectMapper(), featureBuilders);
    }

    SkillDefinitionLoader(ObjectMapper objectMapper, FeatureBuilderRegistry featureBuilders) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.featureBuilders = Objects.requireNonNull(featureBuilders, "featureBuilders");
    }

    public List<SkillDefinition> load(SkillDefinitionSource source) {
        Objects.requireNonNull(source, "source");
        try (InputStream input = source.open()) {
            Object document = switch (source.format()) {
                case JSON -> readJson(input, source);
                case YAML -> readYaml(input, source);
            };
            return validate(document, source.name());
        } catch (IOException e) {
            throw new SkillDefinitionException("Failed to read skill definition: " + source.name(), e);
        }
    }

    private Object readJson(InputStream input, SkillDefinitionSource source) throws IOException {
        try {
            return objectMapper.readValue(input, Object.class);
        } catch (JsonProcessingException e) {
            throw new SkillDefinitionException("Malformed JSON skill definition: " + source.name(), e);
        }
    }

    private Object readYaml(InputStream input, SkillDefinitionSource source) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        try (Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8)) {
            return yaml.load(reader);
        } catch (YAMLException | IOException e) {
            throw new SkillDefinitionException("Malformed YAML skill definition: " + source.name(), e);
        }
    }

    private List<SkillDefinition> validate(Object document, String name) {
        if (!(document instanceof Map<?, ?> root)) {
            throw new SkillDefinitionException(name + ": root must be an object with a 'skills' list");
        }
        if (!(root.get("skills") instanceof List<?> entries)) {
            throw new SkillDefinitionException(name + ": 'skills' is missing or not a list");
        }
        List<SkillDefinition> definitions = new ArrayList<>(entries.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < entries.size(); i++) {
            SkillDefinition definition = parseEntry(entries.get(i), name + " skills[" + i + "]");
            if (!seen.add(definition.id())) {
                throw new SkillDefinitionException(name + ": duplicate skill id '" + definition.id() + "'");
            }
            definitions.add(definition);
        }
        return List.copyOf(definitions);
    }

    private SkillDefinition parseEntry(Object entry, String location) {
        if (!(entry instanceof Map<?, ?> map)) {
            throw new SkillDefinitionException(location + ": entry must be an object");
        }
        String id = requireText(map.get("id"), location + ".id");
        String builderName = requireText(map.get("featureBuilder"), location + ".featureBuilder");
        if (featureBuilders.find(builderName).isEmpty()) {
            throw new SkillDefinitionException(location + ": unknown feature builder '" + builderName + "'");
        }
        return new SkillDefinition(id, builderName, triggers(map.get("triggers"), location + ".triggers"),
                inputDim(map.get("inputDim"), location + ".inputDim"));
    }

    private static String requireText(Object value, String location) {
        if (!(value instanceof String text) || text.isBlank()) {
            throw new SkillDefinitionException(location + " must be a non-blank string");
        }
        return text.trim();
    }

    private static List<String> triggers(Object value, String location) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new SkillDefinitionException(location + " must be a list of strings");
        }
        List<String> triggers = new ArrayList<>(list.size());
        for (Object trigger : list) {
            if (!(trigger instanceof String text)) {
                throw new SkillDefinitionException(location + " must contain only strings");
            }
            triggers.add(text);
        }
        return triggers;
    }

    private static int inputDim(Object value, String location) {
        if (value == null) {
            return FeatureBuilder.DEFAULT_DIMENSION;
        }
        if (value instanceof Integer || value instanceof Long) {
            long dimension = ((Number) value).longValue();
            if (dimension > 0 && dimension <= MAX_INPUT_DIM) {
                return (int) dimension;
            }
        }
        throw new SkillDefinitionException(location + " must be a positive integer no greater than " + MAX_INPUT_DIM);
    }
}
