package io.github.hide212131.eden.env.app;

import io.github.hide212131.eden.env.infra.config.EngineConfiguration;
import io.github.hide212131.eden.env.runtime.manifest.Manifest;
import io.github.hide212131.eden.env.runtime.manifest.ManifestLoader;
import io.github.hide212131.eden.env.runtime.provider.AppConfig;
import io.github.hide212131.eden.env.runtime.provider.AppConfigLoader;
import io.github.hide212131.eden.env.runtime.provider.ApplicationIdentityProvider;
import io.github.hide212131.eden.env.runtime.provider.DerivedFunctionRegistry;
import io.github.hide212131.eden.env.runtime.provider.OverlayLoader;
import io.github.hide212131.eden.env.runtime.provider.ProviderSet;
import io.github.hide212131.eden.env.runtime.provider.SecretProvider;
import io.github.hide212131.eden.env.runtime.provider.StaticConfigProvider;
import io.github.hide212131.eden.env.runtime.resolve.Resolver;
import io.github.hide212131.eden.env.runtime.secrets.AccessTokenSource;
import io.github.hide212131.eden.env.runtime.secrets.LocalEncryptedStore;
import io.github.hide212131.eden.env.runtime.secrets.LocalSecretProvider;
import io.github.hide212131.eden.env.runtime.secrets.MetadataServerTokenSource;
import io.github.hide212131.eden.env.runtime.secrets.RemoteSecretManagerClient;
import io.github.hide212131.eden.env.runtime.secrets.RemoteSecretProvider;
import io.github.hide212131.eden.env.runtime.secrets.StaticAccessTokenSource;
import java.net.URI;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/** 設定からマニフェスト・プロバイダ・ストアを組み立てる。 */
final class EngineContext {

    static final String PROJECT_ID_KEY = "project_id";

    private final EngineConfiguration configuration;

    EngineContext(EngineConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    LocalEncryptedStore localStore() {
        return localStore(configuration.secretsFile());
    }

    LocalEncryptedStore localStore(Path secretsFile) {
        return new LocalEncryptedStore(secretsFile, configuration.cacheDir());
    }

    Resolver newResolver(Map<String, String> processEnvironment) {
        Manifest manifest = new ManifestLoader().load(configuration.manifestPath());
        return new Resolver(manifest, providers(), processEnvironment);
    }

    ProviderSet providers() {
        AppConfig appConfig = new AppConfigLoader().load(configuration.configDir());
        StaticConfigProvider staticConfig = staticConfig();
        SecretProvider secrets = RemoteSecretProvider.NAME.equals(secretsManager(appConfig))
                ? new RemoteSecretProvider(remoteClient(staticConfig))
                : new LocalSecretProvider(localStore());
        return new ProviderSet(
                staticConfig,
                secrets,
                new ApplicationIdentityProvider(appConfig.id()),
                DerivedFunctionRegistry.withBuiltins());
    }

    /** 設定値、app.yaml、既定値 (local) の順に決まるシークレットマネージャ名。 */
    String secretsManager() {
        return secretsManager(new AppConfigLoader().load(configuration.configDir()));
    }

    RemoteSecretManagerClient remoteClient() {
        return remoteClient(staticConfig());
    }

    private String secretsManager(AppConfig appConfig) {
        if (configuration.secretsManager() != null) {
            return configuration.secretsManager();
        }
        return appConfig.secretsManager() != null ? appConfig.secretsManager() : LocalSecretProvider.NAME;
    }

    private StaticConfigProvider staticConfig() {
        OverlayLoader overlays = new OverlayLoader(configuration.configDir());
        return new StaticConfigProvider(
                overlays.loadTestMode(configuration.testMode()),
                overlays.loadEnvironment(configuration.environment()));
    }

    private RemoteSecretManagerClient remoteClient(StaticConfigProvider staticConfig) {
        String projectId = configuration.projectId() != null
                ? configuration.projectId()
                : staticConfig.lookup(PROJECT_ID_KEY).orElse(null);
        AccessTokenSource tokens = configuration.accessToken() != null
                ? new StaticAccessTokenSource(configuration.accessToken())
                : new MetadataServerTokenSource(URI.create(MetadataServerTokenSource.DEFAULT_ENDPOINT),
                        configuration.remoteTimeout());
        String baseUrl = configuration.secretManagerUrl() != null
                ? configuration.secretManagerUrl()
                : RemoteSecretManagerClient.DEFAULT_BASE_URL;
        return new RemoteSecretManagerClient(baseUrl, projectId, tokens, configuration.remoteTimeout());
    }
}
