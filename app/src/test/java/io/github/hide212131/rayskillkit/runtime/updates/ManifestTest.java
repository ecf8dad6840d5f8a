package io.github.hide212131.rayskillkit.runtime.updates;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class ManifestTest {

    @Test
    void parsesVersionFilesAndDigests() {
        Manifest manifest = Manifest.parse(("{\"version\":\"2.0.0\",\"files\":[\"skills.json\",\"notes.txt\"],"
                + "\"digests\":{\"skills.json\":\"ABCDEF\"}}").getBytes(StandardCharsets.UTF_8));

        assertThat(manifest.version()).isEqualTo("2.0.0");
        assertThat(manifest.lists("skills.json")).isTrue();
        assertThat(manifest.lists("other.json")).isFalse();
        assertThat(manifest.digestOf("skills.json")).contains("abcdef");
        assertThat(manifest.digestOf("notes.txt")).isEmpty();
    }

    @Test
    void rejectsDocumentsThatAreNotManifests() {
        assertThatThrownBy(() -> Manifest.parse("[]".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Manifest.parse("{\"files\":[]}".getBytes(StandardCharsets.UTF_8)))
                .hasMessageContaining("version");
        assertThatThrownBy(() -> Manifest.parse("{\"version\":\"1\",\"files\":\"a\"}".getBytes(StandardCharsets.UTF_8)))
                .hasMessageContaining("files");
        assertThatThrownBy(() -> Manifest.parse("{oops".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
