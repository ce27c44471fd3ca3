package io.github.hide212131.eden.env.infra.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * エンジン自体の設定 (manifest の場所、選択された environment / test mode、シークレットストア)。
 */
public record EngineConfiguration(
        Path configDir,
        Path manifestPath,
        String environment,
        String testMode,
        Path secretsFile,
        Path cacheDir,
        String secretsManager,
        String projectId,
        String accessToken,
        String secretManagerUrl,
        Duration remoteTimeout) {

    private static final int MASK_THRESHOLD = 8;
    private static final int MASK_SUFFIX_LENGTH = 4;

    public EngineConfiguration {
        Objects.requireNonNull(configDir, "configDir");
        Objects.requireNonNull(manifestPath, "manifestPath");
        Objects.requireNonNull(secretsFile, "secretsFile");
        Objects.requireNonNull(cacheDir, "cacheDir");
        Objects.requireNonNull(remoteTimeout, "remoteTimeout");
    }

    public EngineConfiguration withEnvironment(String value) {
        return value == null ? this : new EngineConfiguration(configDir, manifestPath, value, testMode, secretsFile,
                cacheDir, secretsManager, projectId, accessToken, secretManagerUrl, remoteTimeout);
    }

    public EngineConfiguration withTestMode(String value) {
        return value == null ? this : new EngineConfiguration(configDir, manifestPath, environment, value,
                secretsFile, cacheDir, secretsManager, projectId, accessToken, secretManagerUrl, remoteTimeout);
    }

    public String maskedAccessToken() {
        if (accessToken == null || accessToken.isBlank()) {
            return "(none)";
        }
        if (accessToken.length() <= MASK_THRESHOLD) {
            return "****";
        }
        return "****" + accessToken.substring(accessToken.length() - MASK_SUFFIX_LENGTH);
    }

    @Override
    public String toString() {
        return "EngineConfiguration[configDir=" + configDir + ", manifestPath=" + manifestPath
                + ", environment=" + environment + ", testMode=" + testMode + ", secretsFile=" + secretsFile
                + ", cacheDir=" + cacheDir + ", secretsManager=" + secretsManager + ", projectId=" + projectId
                + ", accessToken=" + maskedAccessToken() + ", secretManagerUrl=" + secretManagerUrl
                + ", remoteTimeout=" + remoteTimeout + "]";
    }
}
