package io.github.hide212131.eden.env.infra.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.cdimascio.dotenv.Dotenv;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EngineConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    private Dotenv emptyDotenv() {
        return Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().directory(tempDir.toString()).load();
    }

    @Test
    @DisplayName("環境変数が空ならデフォルト値を使う")
    void defaultsWhenNothingIsSet() {
        EngineConfiguration config = new EngineConfigurationLoader(Map.of(), emptyDotenv()).load();

        assertThat(config.configDir()).isEqualTo(Path.of("config"));
        assertThat(config.manifestPath()).isEqualTo(Path.of("config", "variables.yaml"));
        assertThat(config.secretsFile()).isEqualTo(Path.of(".secrets"));
        assertThat(config.cacheDir()).isEqualTo(Path.of(System.getProperty("java.io.tmpdir")));
        assertThat(config.environment()).isNull();
        assertThat(config.testMode()).isNull();
        assertThat(config.secretsManager()).isNull();
        assertThat(config.remoteTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.maskedAccessToken()).isEqualTo("(none)");
    }

    @Test
    @DisplayName("環境変数が優先され、存在しない場合のみ .env を読む")
    void preferEnvironmentOverDotenv() throws IOException {
        Files.writeString(tempDir.resolve(".env"),
                """
                EDEN_CONFIG_DIR=from-dotenv
                EDEN_ENV=prod
                EDEN_TEST_MODE=e2e
                LOCAL_SECRETS_REPO=/var/eden/.secrets
                EDEN_ACCESS_TOKEN=ya29.abcdefghijkl
                """,
                StandardCharsets.UTF_8);
        Dotenv dotenv = Dotenv.configure().ignoreIfMalformed().ignoreIfMissing().directory(tempDir.toString()).load();

        EngineConfiguration config = new EngineConfigurationLoader(
                Map.of(
                        EngineConfigurationLoader.ENV_CONFIG_DIR, "settings",
                        EngineConfigurationLoader.ENV_ENVIRONMENT, "dev",
                        EngineConfigurationLoader.ENV_TEST_MODE, "  ",
                        EngineConfigurationLoader.ENV_SECRETS_MANAGER, "GOOGLE"),
                dotenv).load();

        assertThat(config.configDir()).isEqualTo(Path.of("settings"));
        assertThat(config.manifestPath()).isEqualTo(Path.of("settings", "variables.yaml"));
        assertThat(config.environment()).isEqualTo("dev");
        assertThat(config.testMode()).isNull();
        assertThat(config.secretsFile()).isEqualTo(Path.of("/var/eden/.secrets"));
        assertThat(config.secretsManager()).isEqualTo("google");
        assertThat(config.maskedAccessToken()).isEqualTo("****ijkl");
        assertThat(config.toString()).contains("accessToken=****ijkl").doesNotContain("ya29.abcdefghijkl");
    }

    @Test
    void explicitManifestPathWins() {
        EngineConfiguration config = new EngineConfigurationLoader(
                Map.of(EngineConfigurationLoader.ENV_MANIFEST, "deploy/vars.yaml"), emptyDotenv()).load();

        assertThat(config.manifestPath()).isEqualTo(Path.of("deploy/vars.yaml"));
    }

    @Test
    @DisplayName("未知のシークレットマネージャは例外を返す")
    void rejectsUnknownSecretsManager() {
        EngineConfigurationLoader loader = new EngineConfigurationLoader(
                Map.of(EngineConfigurationLoader.ENV_SECRETS_MANAGER, "vault"), emptyDotenv());

        assertThatThrownBy(loader::load)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(EngineConfigurationLoader.ENV_SECRETS_MANAGER);
    }

    @Test
    void rejectsNonPositiveTimeout() {
        assertThatThrownBy(new EngineConfigurationLoader(
                Map.of(EngineConfigurationLoader.ENV_REMOTE_TIMEOUT, "0"), emptyDotenv())::load)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(EngineConfigurationLoader.ENV_REMOTE_TIMEOUT);
        assertThatThrownBy(new EngineConfigurationLoader(
                Map.of(EngineConfigurationLoader.ENV_REMOTE_TIMEOUT, "soon"), emptyDotenv())::load)
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void withEnvironmentKeepsCurrentValueForNull() {
        EngineConfiguration config = new EngineConfigurationLoader(
                Map.of(EngineConfigurationLoader.ENV_ENVIRONMENT, "dev"), emptyDotenv()).load();

        assertThat(config.withEnvironment(null).environment()).isEqualTo("dev");
        assertThat(config.withEnvironment("prod").environment()).isEqualTo("prod");
        assertThat(config.withTestMode("unit").testMode()).isEqualTo("unit");
    }
}
