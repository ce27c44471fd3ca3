package io.github.hide212131.eden.env.runtime.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.hide212131.eden.env.runtime.ManifestFormatException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OverlayLoaderTest {

    @Test
    @DisplayName("選択した environment と test mode を読み込み、test mode を優先する")
    void loadsSelectedOverlays(@TempDir Path configDir) throws IOException {
        Files.writeString(configDir.resolve(OverlayLoader.ENVIRONMENTS_FILE), """
                environments:
                  dev:
                    Project_Id: eden-dev
                    local: false
                    port: 8080
                  prod:
                    project_id: eden-prod
                """);
        Files.writeString(configDir.resolve(OverlayLoader.TESTS_FILE), """
                modes:
                  unit:
                    local: true
                """);
        OverlayLoader loader = new OverlayLoader(configDir);

        StaticConfigProvider provider = new StaticConfigProvider(loader.loadTestMode("unit"),
                loader.loadEnvironment("dev"));

        assertThat(provider.find("project_id")).contains(
                new StaticConfigProvider.StaticValue("eden-dev", StaticConfigProvider.Layer.ENVIRONMENT));
        assertThat(provider.find("LOCAL")).contains(
                new StaticConfigProvider.StaticValue("true", StaticConfigProvider.Layer.TEST_MODE));
        assertThat(provider.lookup("port")).contains("8080");
        assertThat(provider.lookup("missing")).isEmpty();
        assertThat(loader.environmentNames()).containsExactly("dev", "prod");
    }

    @Test
    @DisplayName("存在しない environment を選ぶと利用可能な名前を含むエラー")
    void unknownEnvironmentListsAvailableNames(@TempDir Path configDir) throws IOException {
        Files.writeString(configDir.resolve(OverlayLoader.ENVIRONMENTS_FILE), """
                environments:
                  dev: {}
                  prod: {}
                """);

        assertThatThrownBy(() -> new OverlayLoader(configDir).loadEnvironment("staging"))
                .isInstanceOf(ManifestFormatException.class)
                .hasMessageContaining("staging")
                .hasMessageContaining("[dev, prod]");
    }

    @Test
    @DisplayName("ドキュメントが無い場合は空のオーバーレイ")
    void missingDocumentsAreLegal(@TempDir Path configDir) {
        OverlayLoader loader = new OverlayLoader(configDir);

        assertThat(loader.loadEnvironment("dev").isEmpty()).isTrue();
        assertThat(loader.loadTestMode(null)).isEqualTo(ConfigOverlay.empty());
        assertThat(loader.testModeNames()).isEmpty();
    }

    @Test
    void nestedValuesAreRejected(@TempDir Path configDir) throws IOException {
        Files.writeString(configDir.resolve(OverlayLoader.ENVIRONMENTS_FILE), """
                environments:
                  dev:
                    nested:
                      a: b
                """);

        assertThatThrownBy(() -> new OverlayLoader(configDir).loadEnvironment("dev"))
                .isInstanceOf(ManifestFormatException.class);
    }
}
