package io.github.hide212131.rayskillkit.runtime.skill;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.hide212131.rayskillkit.runtime.feature.FeatureBuilderRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SkillDefinitionLoaderTest {

    private final SkillDefinitionLoader loader = new SkillDefinitionLoader(FeatureBuilderRegistry.withDefaults());

    @Test
    @DisplayName("YAML 定義を読み込める")
    void loadsYamlDefinition() {
        List<SkillDefinition> definitions = loader.load(SkillDefinitionSource.classpath("definitions/skills.yaml"));

        assertThat(definitions).containsExactly(
                new SkillDefinition("education_assistant", "education", List.of("Education", "learning"), 64),
                new SkillDefinition("travel_planner", "travel", List.of("trip", "Journey"), 32));
    }

    @Test
    void loadsJsonFile(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("skills.json");
        Files.writeString(file, """
                {"skills":[{"id":"retail_helper","featureBuilder":"retail","triggers":["shop"],"inputDim":8}]}
                """, StandardCharsets.UTF_8);

        List<SkillDefinition> definitions = loader.load(SkillDefinitionSource.file(file));

        assertThat(definitions).singleElement()
                .satisfies(definition -> {
                    assertThat(definition.id()).isEqualTo("retail_helper");
                    assertThat(definition.inputDim()).isEqualTo(8);
                });
    }

    @Test
    void missingTriggersDefaultToEmpty() {
        List<SkillDefinition> definitions = load("""
                {"skills":[{"id":"energy_optimizer","featureBuilder":"energy"}]}
                """);

        assertThat(definitions.get(0).triggers()).isEmpty();
        assertThat(definitions.get(0).inputDim()).isEqualTo(64);
    }

    @Test
    void rejectsMalformedJson() {
        assertThatThrownBy(() -> load("{\"skills\": ["))
                .isInstanceOf(SkillDefinitionException.class)
                .hasMessageContaining("Malformed JSON");
    }

    @Test
    void rejectsMissingSkillsList() {
        assertThatThrownBy(() -> load("{\"skill\": []}"))
                .isInstanceOf(SkillDefinitionException.class)
                .hasMessageContaining("'skills'");
    }

    @Test
    void rejectsBlankIds() {
        assertThatThrownBy(() -> load("{\"skills\":[{\"id\":\" \",\"featureBuilder\":\"retail\"}]}"))
                .isInstanceOf(SkillDefinitionException.class)
                .hasMessageContaining("skills[0].id");
    }

    @Test
    void rejectsDuplicateIds() {
        assertThatThrownBy(() -> load("""
                {"skills":[{"id":"a","featureBuilder":"retail"},{"id":"a","featureBuilder":"travel"}]}
                """))
                .isInstanceOf(SkillDefinitionException.class)
                .hasMessageContaining("duplicate skill id 'a'");
    }

    @Test
    void rejectsNonStringTriggers() {
        assertThatThrownBy(() -> load("{\"skills\":[{\"id\":\"a\",\"featureBuilder\":\"retail\",\"triggers\":[1]}]}"))
                .isInstanceOf(SkillDefinitionException.class)
                .hasMessageContaining("triggers");
    }

    @Test
    void rejectsNonPositiveDimensions() {
        assertThatThrownBy(() -> load("{\"skills\":[{\"id\":\"a\",\"featureBuilder\":\"retail\",\"inputDim\":0}]}"))
                .isInstanceOf(SkillDefinitionException.class)
                .hasMessageContaining("inputDim");
    }

    @Test
    void rejectsDimensionsAboveTheLimit() {
        assertThat(load("{\"skills\":[{\"id\":\"a\",\"featureBuilder\":\"retail\",\"inputDim\":4096}]}"))
                .singleElement()
                .extracting(SkillDefinition::inputDim)
                .isEqualTo(4096);
        assertThatThrownBy(() -> load(
                "{\"skills\":[{\"id\":\"a\",\"featureBuilder\":\"retail\",\"inputDim\":1000000000}]}"))
                .isInstanceOf(SkillDefinitionException.class)
                .hasMessageContaining("inputDim")
                .hasMessageContaining("4096");
    }

    @Test
    void missingResourceIsReportedAsDefinitionError() {
        assertThatThrownBy(() -> loader.load(SkillDefinitionSource.classpath("definitions/absent.json")))
                .isInstanceOf(SkillDefinitionException.class)
                .hasMessageContaining("definitions/absent.json");
    }

    @Test
    void rejectsMalformedYaml() {
        assertThatThrownBy(() -> loader.load(SkillDefinitionSource.bytes("broken.yaml",
                "skills: [unclosed".getBytes(StandardCharsets.UTF_8))))
                .isInstanceOf(SkillDefinitionException.class)
                .hasMessageContaining("Malformed YAML");
    }

    private List<SkillDefinition> load(String json) {
        return loader.load(SkillDefinitionSource.bytes("inline.json", json.getBytes(StandardCharsets.UTF_8)));
    }
}
