package io.github.hide212131.eden.env.infra.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 環境変数を優先し、未設定の場合のみ .env をフォールバックしてエンジン設定を解決する。
 */
public final class EngineConfigurationLoader {

    static final String ENV_CONFIG_DIR = "EDEN_CONFIG_DIR";
    static final String ENV_MANIFEST = "EDEN_MANIFEST";
    static final String ENV_ENVIRONMENT = "EDEN_ENV";
    static final String ENV_TEST_MODE = "EDEN_TEST_MODE";
    static final String ENV_SECRETS_REPO = "LOCAL_SECRETS_REPO";
    static final String ENV_SECRETS_CACHE = "LOCAL_SECRETS_CACHE";
    static final String ENV_SECRETS_MANAGER = "EDEN_SECRETS_MANAGER";
    static final String ENV_PROJECT_ID = "PROJECT_ID";
    static final String ENV_ACCESS_TOKEN = "EDEN_ACCESS_TOKEN";
    static final String ENV_SECRET_MANAGER_URL = "EDEN_SECRET_MANAGER_URL";
    static final String ENV_REMOTE_TIMEOUT = "EDEN_REMOTE_TIMEOUT_SECONDS";

    static final String DEFAULT_CONFIG_DIR = "config";
    static final String DEFAULT_MANIFEST_FILE = "variables.yaml";
    static final String DEFAULT_SECRETS_FILE = ".secrets";
    static final Duration DEFAULT_REMOTE_TIMEOUT = Duration.ofSeconds(10);

    private static final Set<String> SECRET_MANAGERS = Set.of("local", "google");

    private final Map<String, String> environment;
    private final Dotenv dotenv;

    public EngineConfigurationLoader() {
        this(System.getenv(), Dotenv.configure().ignoreIfMalformed().ignoreIfMissing().load());
    }

    public EngineConfigurationLoader(Map<String, String> environment, Dotenv dotenv) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
        this.dotenv = Objects.requireNonNull(dotenv, "dotenv");
    }

    public EngineConfiguration load() {
        Path configDir = Path.of(orDefault(resolveWithPriority(ENV_CONFIG_DIR), DEFAULT_CONFIG_DIR));
        String manifest = resolveWithPriority(ENV_MANIFEST);
        Path manifestPath = manifest == null ? configDir.resolve(DEFAULT_MANIFEST_FILE) : Path.of(manifest);
        Path secretsFile = Path.of(orDefault(resolveWithPriority(ENV_SECRETS_REPO), DEFAULT_SECRETS_FILE));
        Path cacheDir = Path.of(orDefault(resolveWithPriority(ENV_SECRETS_CACHE), System.getProperty("java.io.tmpdir")));

        String manager = resolveWithPriority(ENV_SECRETS_MANAGER);
        if (manager != null) {
            manager = manager.toLowerCase(Locale.ROOT);
            if (!SECRET_MANAGERS.contains(manager)) {
                throw new IllegalStateException(ENV_SECRETS_MANAGER + " は local または google を指定してください: " + manager);
            }
        }

        return new EngineConfiguration(
                configDir,
                manifestPath,
                resolveWithPriority(ENV_ENVIRONMENT),
                resolveWithPriority(ENV_TEST_MODE),
                secretsFile,
                cacheDir,
                manager,
                resolveWithPriority(ENV_PROJECT_ID),
                resolveWithPriority(ENV_ACCESS_TOKEN),
                resolveWithPriority(ENV_SECRET_MANAGER_URL),
                resolveTimeout());
    }

    private Duration resolveTimeout() {
        String value = resolveWithPriority(ENV_REMOTE_TIMEOUT);
        if (value == null) {
            return DEFAULT_REMOTE_TIMEOUT;
        }
        try {
            long seconds = Long.parseLong(value);
            if (seconds <= 0) {
                throw new IllegalStateException(ENV_REMOTE_TIMEOUT + " は正の整数で指定してください: " + value);
            }
            return Duration.ofSeconds(seconds);
        } catch (NumberFormatException ex) {
            throw new IllegalStateException(ENV_REMOTE_TIMEOUT + " は正の整数で指定してください: " + value, ex);
        }
    }

    private String resolveWithPriority(String key) {
        String value = environment.containsKey(key) ? environment.get(key) : dotenv.get(key);
        return trimToNull(value);
    }

    private static String orDefault(String value, String fallback) {
        return value == null ? fallback : value;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
