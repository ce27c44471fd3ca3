package io.github.hide212131.eden.env.runtime.provider;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AppConfigLoaderTest {

    @Test
    void readsIdAndSecretsManager(@TempDir Path configDir) throws IOException {
        Files.writeString(configDir.resolve(AppConfigLoader.APP_FILE), """
                id: eden-app
                secrets:
                  manager: Google
                """);

        AppConfig config = new AppConfigLoader().load(configDir);

        assertThat(config.id()).isEqualTo("eden-app");
        assertThat(config.secretsManager()).isEqualTo("google");
    }

    @Test
    void missingFileGivesEmptyConfig(@TempDir Path configDir) {
        assertThat(new AppConfigLoader().load(configDir)).isEqualTo(AppConfig.empty());
    }
}
