package io.github.hide212131.eden.env.runtime.resolve;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EnvironmentProjectionTest {

    private final ResolvedSet resolved = new ResolvedSet(List.of(
            new StagedVariable("PORT", "8080", Provenance.ENVIRONMENT_CONFIG, true, false),
            new StagedVariable("GREETING", "it's \"quoted\"", Provenance.DEFAULT, true, false),
            new StagedVariable("STUB_AI", "true", Provenance.ENVIRONMENT_CONFIG, false, false),
            new StagedVariable("REGION", null, Provenance.UNRESOLVED, true, false)), null, null);

    @Test
    @DisplayName("inclusion=true かつ値のある変数だけが正確な名前で書き込まれる")
    void appliesOnlyIncludedVariables() {
        Map<String, String> target = new HashMap<>(Map.of("PATH", "/usr/bin"));

        new EnvironmentProjection(resolved).applyTo(target);

        assertThat(target).containsOnly(
                Map.entry("PATH", "/usr/bin"),
                Map.entry("PORT", "8080"),
                Map.entry("GREETING", "it's \"quoted\""));
    }

    @Test
    void rendersShellSafeExportLines() {
        String export = new EnvironmentProjection(resolved).renderExport();

        assertThat(export).isEqualTo("export PORT=8080\n" + "export GREETING='it'\"'\"'s \"quoted\"'\n");
    }

    @Test
    void rendersDotenvLines() {
        assertThat(new EnvironmentProjection(resolved).renderDotenv())
                .isEqualTo("PORT=8080\n" + "GREETING=\"it's \\\"quoted\\\"\"\n");
    }

    @Test
    void rendersJsonObject() throws Exception {
        JsonNode json = new ObjectMapper().readTree(new EnvironmentProjection(resolved).renderJson());

        assertThat(json.get("PORT").asText()).isEqualTo("8080");
        assertThat(json.has("STUB_AI")).isFalse();
        assertThat(json.size()).isEqualTo(2);
    }
}
