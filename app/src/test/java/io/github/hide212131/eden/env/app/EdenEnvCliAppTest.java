package io.github.hide212131.eden.env.app;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.hide212131.eden.env.infra.config.EngineConfiguration;
import io.github.hide212131.eden.env.runtime.secrets.FakeSecretManager;
import io.github.hide212131.eden.env.runtime.secrets.LocalEncryptedStore;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class EdenEnvCliAppTest {

    @TempDir
    Path tempDir;

    private EngineConfiguration configuration;

    @BeforeEach
    void writeConfiguration() throws IOException {
        Path configDir = Files.createDirectories(tempDir.resolve("config"));
        Files.writeString(configDir.resolve("variables.yaml"), """
                variables:
                  - name: PORT
                    source: static:port
                    default: "8080"
                  - name: GREETING
                    source: static:greeting
                    optional: true
                  - name: JWT_SECRET
                    source: secret:jwt-secret
                    group: secrets
                """);
        Files.writeString(configDir.resolve("environments.yaml"), """
                environments:
                  dev:
                    port: 9000
                    greeting: hello world
                """);
        configuration = new EngineConfiguration(configDir, configDir.resolve("variables.yaml"), null, null,
                tempDir.resolve(".secrets"), tempDir.resolve("cache"), null, null, null, null, Duration.ofSeconds(5));
    }

    private void useRemoteManager(FakeSecretManager remote) {
        configuration = new EngineConfiguration(configuration.configDir(), configuration.manifestPath(), null, null,
                configuration.secretsFile(), configuration.cacheDir(), "google", "eden-prod", "token-123",
                remote.baseUrl(), Duration.ofSeconds(5));
    }

    private Result execute(Map<String, String> processEnvironment, String... args) {
        return execute(() -> configuration, processEnvironment, args);
    }

    private static Result execute(Supplier<EngineConfiguration> configurationSupplier,
            Map<String, String> processEnvironment, String... args) {
        CommandLine commandLine = EdenEnvCliApp.commandLine(
                new EdenEnvCliApp(configurationSupplier, processEnvironment));
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        int exitCode = commandLine.execute(args);
        return new Result(exitCode, out.toString(), err.toString());
    }

    private Result execute(String... args) {
        return execute(Map.of(), args);
    }

    @Test
    @DisplayName("resolve は選択した変数だけを解決し、export 形式で出力する")
    void resolveExportsSelectedVariables() {
        Result result = execute("resolve", "--env", "dev", "--name", "PORT", "--name", "greeting",
                "--format", "export");

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).isEqualTo("export PORT=9000\nexport GREETING='hello world'\n");
    }

    @Test
    void resolveRendersJson() {
        Result result = execute("resolve", "--name", "PORT", "--format", "JSON");

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).contains("\"PORT\" : \"8080\"").doesNotContain("JWT_SECRET");
    }

    @Test
    @DisplayName("table 形式はシークレットをマスクする")
    void resolveTableMasksSecrets() {
        Result result = execute(Map.of("JWT_SECRET", "from-process-env"), "resolve", "--env", "dev");

        assertThat(result.exitCode()).isZero();
        assertThat(result.out())
                .contains("Configuration sources:")
                .contains("environment: dev")
                .contains("JWT_SECRET")
                .contains("****")
                .doesNotContain("from-process-env");
    }

    @Test
    @DisplayName("シークレットが取得できない場合は終了コード1で対処方法を表示する")
    void resolveFailureExplainsRemediation() {
        Result result = execute("resolve", "--group", "secrets");

        assertThat(result.exitCode()).isEqualTo(EdenEnvCliApp.EXIT_FAILURE);
        assertThat(result.out()).isEmpty();
        assertThat(result.err())
                .contains("Error: Secret 'jwt-secret' for variable 'JWT_SECRET'")
                .contains("  - Override it for this run: export JWT_SECRET=<value>");
    }

    @Test
    void unknownEnvironmentIsReported() {
        Result result = execute("resolve", "--env", "staging");

        assertThat(result.exitCode()).isEqualTo(EdenEnvCliApp.EXIT_FAILURE);
        assertThat(result.err()).contains("staging").contains("dev");
    }

    @Test
    @DisplayName("secrets サブコマンドでキャッシュ鍵の設定から取得までを行う")
    void secretsLifecycle() {
        assertThat(execute("secrets", "get-cached-key").out()).contains("Cached key: absent");

        Result noKey = execute("secrets", "set", "jwt-secret", "s3cr3t");
        assertThat(noKey.exitCode()).isEqualTo(EdenEnvCliApp.EXIT_FAILURE);
        assertThat(noKey.err()).contains("Error [KEY_UNAVAILABLE]").contains("  fix: ");

        assertThat(execute("secrets", "set-cached-key", "--passphrase", "p1").out()).startsWith("NEW (fingerprint ");
        assertThat(execute("secrets", "set", "jwt-secret", "first").out()).startsWith("Created jwt-secret (hash: ");
        assertThat(execute("secrets", "set", "jwt-secret", "s3cr3t").out()).startsWith("Updated jwt-secret");
        assertThat(execute("secrets", "get", "jwt-secret", "--show").out()).isEqualTo("s3cr3t\n");
        assertThat(execute("secrets", "get", "jwt-secret").out()).doesNotContain("s3cr3t").contains("hash: ");
        assertThat(execute("secrets", "list").out()).isEqualTo("jwt-secret\n");

        Result resolved = execute("resolve", "--group", "secrets", "--format", "env");
        assertThat(resolved.exitCode()).isZero();
        assertThat(resolved.out()).isEqualTo("JWT_SECRET=s3cr3t\n");
    }

    @Test
    @DisplayName("誤ったパスフレーズは INVALID となりキャッシュ鍵は変わらない")
    void wrongPassphraseIsRejected() {
        execute("secrets", "set-cached-key", "--passphrase", "p1");
        execute("secrets", "set", "jwt-secret", "s3cr3t");
        execute("secrets", "clear-cached-key");

        Result wrong = execute("secrets", "set-cached-key", "--passphrase", "wrong");

        assertThat(wrong.exitCode()).isEqualTo(EdenEnvCliApp.EXIT_FAILURE);
        assertThat(wrong.err()).contains("Error [INVALID]");
        assertThat(execute("secrets", "get-cached-key").out()).contains("Cached key: absent");
        assertThat(execute("secrets", "set-cached-key", "--passphrase", "p1").out()).startsWith("VALID_SET");
    }

    @Test
    @DisplayName("clear は --force なしでは何も削除しない")
    void clearRequiresForce() {
        execute("secrets", "set-cached-key", "--passphrase", "p1");
        execute("secrets", "set", "jwt-secret", "s3cr3t");

        Result refused = execute("secrets", "clear");
        assertThat(refused.exitCode()).isEqualTo(EdenEnvCliApp.EXIT_FAILURE);
        assertThat(refused.err()).contains("Re-run with --force.");
        assertThat(Files.exists(configuration.secretsFile())).isTrue();

        assertThat(execute("secrets", "clear", "--force").out()).startsWith("Deleted ");
        assertThat(Files.exists(configuration.secretsFile())).isFalse();
        assertThat(execute("secrets", "get-cached-key").out()).contains("Cached key: present");
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    @DisplayName("exec は解決した値を子プロセスに渡し、その終了コードを返す")
    void execPassesResolvedEnvironment() {
        Result matched = execute(Map.of("JWT_SECRET", "abc"), "exec", "--env", "dev", "--",
                "sh", "-c", "test \"$PORT\" = 9000 && test \"$JWT_SECRET\" = abc && exit 7");
        Result mismatched = execute(Map.of("JWT_SECRET", "abc"), "exec", "--", "sh", "-c",
                "test \"$PORT\" = 9000 || exit 3");

        assertThat(matched.exitCode()).isEqualTo(7);
        assertThat(mismatched.exitCode()).isEqualTo(3);
    }

    @Test
    void execFailsBeforeStartingWhenResolutionFails() {
        Result result = execute("exec", "--", "definitely-not-a-command");

        assertThat(result.exitCode()).isEqualTo(EdenEnvCliApp.EXIT_FAILURE);
        assertThat(result.err()).contains("JWT_SECRET");
    }

    @Test
    @DisplayName("設定の読み込みに失敗した場合はスタックトレースではなくエラーメッセージを表示する")
    void secretsReportsInvalidEngineConfiguration() {
        Supplier<EngineConfiguration> broken = () -> {
            throw new IllegalStateException("EDEN_SECRETS_MANAGER は local または google を指定してください: vault");
        };

        Result result = execute(broken, Map.of(), "secrets", "list");

        assertThat(result.exitCode()).isEqualTo(EdenEnvCliApp.EXIT_FAILURE);
        assertThat(result.err())
                .isEqualTo("Error: EDEN_SECRETS_MANAGER は local または google を指定してください: vault\n")
                .doesNotContain("at io.github");
    }

    @Test
    @DisplayName("local マネージャからの download は INVALID_OPERATION")
    void downloadRequiresRemoteManager() {
        Result result = execute("secrets", "download", tempDir.resolve("copy").toString(), "--passphrase", "p1");

        assertThat(result.exitCode()).isEqualTo(EdenEnvCliApp.EXIT_FAILURE);
        assertThat(result.err()).contains("Error [INVALID_OPERATION]").contains("EDEN_SECRETS_MANAGER=google");
        assertThat(Files.exists(tempDir.resolve("copy/.secrets"))).isFalse();
    }

    @Test
    @DisplayName("download はリモートの全シークレットを DIR/.secrets に暗号化して保存する")
    void downloadCopiesRemoteSecrets() throws IOException {
        Path copyDir = Files.createDirectories(tempDir.resolve("copy"));
        try (FakeSecretManager remote = new FakeSecretManager("eden-prod")
                .put("jwt-secret", "s3cr3t")
                .put("db-password", "pw")) {
            useRemoteManager(remote);

            Result result = execute("secrets", "download", copyDir.toString(), "--passphrase", "p1");

            assertThat(result.exitCode()).isZero();
            assertThat(result.out()).isEqualTo("Downloaded 2 secrets to " + copyDir.resolve(".secrets") + "\n");
        }
        LocalEncryptedStore copy = new LocalEncryptedStore(copyDir.resolve(".secrets"), configuration.cacheDir());
        assertThat(copy.list().orElseThrow()).containsExactly("jwt-secret", "db-password");
        assertThat(copy.get("jwt-secret", true).orElseThrow().value()).isEqualTo("s3cr3t");
        assertThat(Files.exists(configuration.secretsFile())).isFalse();
    }

    @Test
    void downloadReportsSkippedSecrets() throws IOException {
        try (FakeSecretManager remote = new FakeSecretManager("eden-prod").put("jwt-secret", "s").listOnly("gone")) {
            useRemoteManager(remote);

            Path copyDir = Files.createDirectories(tempDir.resolve("partial"));

            Result result = execute("secrets", "download", copyDir.toString(), "--passphrase", "p1");

            assertThat(result.exitCode()).isEqualTo(EdenEnvCliApp.EXIT_FAILURE);
            assertThat(result.err()).contains("Error [PARTIAL_DOWNLOAD]").contains("skipped: gone")
                    .contains("(1/2 written to ");
        }
    }

    @Test
    @DisplayName("google マネージャでは get と list がリモートを参照する")
    void getAndListReadRemoteManager() throws IOException {
        try (FakeSecretManager remote = new FakeSecretManager("eden-prod").put("jwt-secret", "remote-value")) {
            useRemoteManager(remote);

            assertThat(execute("secrets", "list").out()).isEqualTo("jwt-secret\n");
            assertThat(execute("secrets", "get", "jwt-secret", "--show").out()).isEqualTo("remote-value\n");

            Result missing = execute("secrets", "get", "nope");
            assertThat(missing.exitCode()).isEqualTo(EdenEnvCliApp.EXIT_FAILURE);
            assertThat(missing.err()).contains("Error [NOT_FOUND]: Secret 'nope'");
        }
    }

    private record Result(int exitCode, String out, String err) {
    }
}
