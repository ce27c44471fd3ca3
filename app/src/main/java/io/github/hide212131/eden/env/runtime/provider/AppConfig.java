package io.github.hide212131.eden.env.runtime.provider;

import java.util.Locale;

/**
 * Contents of {@code app.yaml}.
 *
 * @param id application id served by {@code app:id}, may be {@code null}
 * @param secretsManager {@code local} or {@code google}, may be {@code null}
 */
public record AppConfig(String id, String secretsManager) {

    public static AppConfig empty() {
        return new AppConfig(null, null);
    }

    public AppConfig {
        secretsManager = secretsManager == null || secretsManager.isBlank()
                ? null
                : secretsManager.trim().toLowerCase(Locale.ROOT);
    }
}
