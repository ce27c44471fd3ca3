package io.github.hide212131.eden.env.runtime.provider;

import io.github.hide212131.eden.env.runtime.ManifestFormatException;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

/** {@code app.yaml} を読み込む。ファイルが無い場合は空設定。 */
public final class AppConfigLoader {

    public static final String APP_FILE = "app.yaml";

    public AppConfig load(Path configDir) {
        Objects.requireNonNull(configDir, "configDir");
        Path document = configDir.resolve(APP_FILE);
        if (!Files.exists(document)) {
            return AppConfig.empty();
        }
        Object loaded;
        try (Reader reader = Files.newBufferedReader(document)) {
            loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
        } catch (IOException ex) {
            throw new ManifestFormatException("app.yaml の読み込みに失敗しました: " + document, ex);
        }
        if (loaded == null) {
            return AppConfig.empty();
        }
        if (!(loaded instanceof Map<?, ?> root)) {
            throw new ManifestFormatException("app.yaml の形式が不正です。");
        }
        String id = root.get("id") == null ? null : String.valueOf(root.get("id"));
        String manager = null;
        Object secrets = root.get("secrets");
        if (secrets instanceof Map<?, ?> secretsMap && secretsMap.get("manager") != null) {
            manager = String.valueOf(secretsMap.get("manager"));
        } else if (secrets != null && !(secrets instanceof Map<?, ?>)) {
            throw new ManifestFormatException("app.yaml の secrets はマップである必要があります。");
        }
        return new AppConfig(id, manager);
    }
}
