package io.github.hide212131.rayskillkit.runtime.skill;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Where a skill definition document comes from. The name is used for format detection and error messages.
 */
public interface SkillDefinitionSource {

    String BUNDLED_RESOURCE = "skills.json";

    String name();

    InputStream open() throws IOException;

    default SkillDefinitionFormat format() {
        String lower = name().toLowerCase(Locale.ROOT);
        if (lower.endsWith(".yaml") || lower.endsWith(".yml")) {
            return SkillDefinitionFormat.YAML;
        }
        return SkillDefinitionFormat.JSON;
    }

    static SkillDefinitionSource bundled() {
        return classpath(BUNDLED_RESOURCE);
    }

    static SkillDefinitionSource classpath(String resource) {
        Objects.requireNonNull(resource, "resource");
        return new SkillDefinitionSource() {
            @Override
            public String name() {
                return resource;
            }

            @Override
            public InputStream open() throws IOException {
                InputStream stream = SkillDefinitionSource.class.getClassLoader().getResourceAsStream(resource);
                if (stream == null) {
                    throw new IOException("Skill definition resource not found on classpath: " + resource);
                }
                return stream;
            }
        };
    }

    static SkillDefinitionSource file(Path path) {
        Objects.requireNonNull(path, "path");
        return new SkillDefinitionSource() {
            @Override
            public String name() {
                return path.toString();
            }

            @Override
            public InputStream open() throws IOException {
                return Files.newInputStream(path);
            }
        };
    }

    static SkillDefinitionSource bytes(String name, byte[] content) {
        Objects.requireNonNull(name, "name");
        byte[] copy = Objects.requireNonNull(content, "content").clone();
        return new SkillDefinitionSource() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public InputStream open() {
                return new ByteArrayInputStream(copy);
            }
        };
    }
}
