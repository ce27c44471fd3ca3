package io.github.hide212131.eden.env.runtime.manifest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.hide212131.eden.env.runtime.ManifestFormatException;
import io.github.hide212131.eden.env.runtime.UndefinedVariableException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ManifestLoaderTest {

    private final ManifestLoader loader = new ManifestLoader();

    @Test
    @DisplayName("variables と groups を順序どおりに読み込む")
    void loadsDefinitionsInOrder(@TempDir Path tempDir) throws IOException {
        Path manifestPath = tempDir.resolve("variables.yaml");
        Files.writeString(manifestPath, """
                variables:
                  - name: STUB_AI
                    source: static:stub_ai
                    default: true
                  - name: GEMINI_API_KEY
                    source: secret:gemini-api-key
                    optional: true
                    group: [ai, secrets]
                    condition:
                      STUB_AI: false
                  - name: APP_ID
                    source: app:id
                  - name: TEST_API_URL
                    source: derived:api-url
                groups:
                  ai: [STUB_AI]
                """);

        Manifest manifest = loader.load(manifestPath);

        assertThat(manifest.definitions()).extracting(VariableDefinition::name)
                .containsExactly("STUB_AI", "GEMINI_API_KEY", "APP_ID", "TEST_API_URL");
        VariableDefinition key = manifest.find("gemini_api_key").orElseThrow();
        assertThat(key.source()).isEqualTo(new VariableSource.Secret("gemini-api-key"));
        assertThat(key.required()).isFalse();
        assertThat(key.condition()).containsEntry("STUB_AI", false);
        assertThat(manifest.find("STUB_AI").orElseThrow().defaultValue()).isEqualTo("true");
        assertThat(manifest.find("APP_ID").orElseThrow().source()).isInstanceOf(VariableSource.AppIdentity.class);
        assertThat(manifest.group("ai")).containsExactly("STUB_AI", "GEMINI_API_KEY");
        assertThat(manifest.group("secrets")).containsExactly("GEMINI_API_KEY");
    }

    @Test
    @DisplayName("ファイルからの読み込みと文字列の解析は同じ定義を返す")
    void fileAndStringEntryPointsAgree(@TempDir Path tempDir) throws IOException {
        String yaml = """
                variables:
                  - name: PORT
                    source: static:port
                    default: 8080
                """;
        Path manifestPath = tempDir.resolve("variables.yaml");
        Files.writeString(manifestPath, yaml);

        Manifest fromFile = loader.load(manifestPath);
        Manifest fromString = loader.parse(yaml);

        assertThat(fromFile.definitions()).isEqualTo(fromString.definitions());
        assertThat(fromFile.find("PORT").orElseThrow().defaultValue()).isEqualTo("8080");
    }

    @Test
    void nonMappingFileIsFormatError(@TempDir Path tempDir) throws IOException {
        Path manifestPath = tempDir.resolve("variables.yaml");
        Files.writeString(manifestPath, "- just\n- a list\n");

        assertThatThrownBy(() -> loader.load(manifestPath)).isInstanceOf(ManifestFormatException.class);
        assertThatThrownBy(() -> loader.parse("plain scalar")).isInstanceOf(ManifestFormatException.class);
    }

    @Test
    @DisplayName("大文字小文字違いの重複名はエラー")
    void duplicateNamesIgnoringCaseAreRejected() {
        assertThatThrownBy(() -> loader.parse("""
                variables:
                  - name: PORT
                    source: static:port
                  - name: port
                    source: static:port
                """))
                .isInstanceOf(ManifestFormatException.class)
                .hasMessageContaining("PORT");
    }

    @Test
    @DisplayName("source の書式が不正ならエラー")
    void invalidSourceIsRejected() {
        assertThatThrownBy(() -> loader.parse("""
                variables:
                  - name: PORT
                    source: env:port
                """))
                .isInstanceOf(ManifestFormatException.class)
                .hasMessageContaining("env:port");
    }

    @Test
    void groupMemberMustBeDefined() {
        assertThatThrownBy(() -> loader.parse("""
                variables:
                  - name: PORT
                    source: static:port
                groups:
                  web: [PORT, HOST]
                """))
                .isInstanceOf(UndefinedVariableException.class)
                .hasMessageContaining("HOST");
    }

    @Test
    void selectExpandsGroupsAndKeepsManifestOrder() {
        Manifest manifest = loader.parse("""
                variables:
                  - name: A
                    source: static:a
                  - name: B
                    source: static:b
                    group: g
                  - name: C
                    source: static:c
                    group: g
                """);

        assertThat(manifest.select(List.of("c", "G", "A"))).extracting(VariableDefinition::name)
                .containsExactly("A", "B", "C");
    }

    @Test
    void missingFileIsReported(@TempDir Path tempDir) {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("none.yaml")))
                .isInstanceOf(ManifestFormatException.class)
                .hasMessageContaining("none.yaml");
    }

    @Test
    void optionalAndRequiredMustAgree() {
        assertThatThrownBy(() -> loader.parse("""
                variables:
                  - name: A
                    source: static:a
                    optional: true
                    required: true
                """))
                .isInstanceOf(ManifestFormatException.class);
    }
}
