package io.github.hide212131.eden.env.runtime.provider;

import io.github.hide212131.eden.env.runtime.ManifestFormatException;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

/**
 * {@code environments.yaml} / {@code tests.yaml} から選択されたオーバーレイを読み込む。
 *
 * <pre>
 * environments:
 *   dev:
 *     api_url: https://dev.example.com
 *     port: 8080
 * </pre>
 */
public final class OverlayLoader {

    public static final String ENVIRONMENTS_FILE = "environments.yaml";
    public static final String TESTS_FILE = "tests.yaml";

    private static final Logger LOGGER = LoggerFactory.getLogger(OverlayLoader.class);

    private final Path configDir;

    public OverlayLoader(Path configDir) {
        this.configDir = Objects.requireNonNull(configDir, "configDir");
    }

    public ConfigOverlay loadEnvironment(String environmentName) {
        return load(configDir.resolve(ENVIRONMENTS_FILE), "environments", "environment", environmentName);
    }

    public ConfigOverlay loadTestMode(String testMode) {
        return load(configDir.resolve(TESTS_FILE), "modes", "test mode", testMode);
    }

    /** Names declared in the environments document, in document order. */
    public List<String> environmentNames() {
        return List.copyOf(readSections(configDir.resolve(ENVIRONMENTS_FILE), "environments").keySet());
    }

    public List<String> testModeNames() {
        return List.copyOf(readSections(configDir.resolve(TESTS_FILE), "modes").keySet());
    }

    private ConfigOverlay load(Path document, String rootKey, String label, String selected) {
        if (selected == null || selected.isBlank()) {
            return ConfigOverlay.empty();
        }
        if (!Files.exists(document)) {
            LOGGER.warn("{} '{}' was selected but {} does not exist; using an empty overlay", label, selected,
                    document);
            return new ConfigOverlay(selected, Map.of());
        }
        Map<String, Object> sections = readSections(document, rootKey);
        Object section = sections.get(selected);
        if (section == null && !sections.containsKey(selected)) {
            throw new ManifestFormatException(label + " '" + selected + "' は " + document.getFileName()
                    + " に定義されていません。利用可能: " + sections.keySet());
        }
        Map<String, String> values = new LinkedHashMap<>();
        if (section != null) {
            if (!(section instanceof Map<?, ?> map)) {
                throw new ManifestFormatException(rootKey + "." + selected + " はマップである必要があります。");
            }
            map.forEach((key, value) -> {
                if (value != null) {
                    values.put(String.valueOf(key), scalar(rootKey + "." + selected + "." + key, value));
                }
            });
        }
        LOGGER.debug("Loaded {} '{}' with {} keys", label, selected, values.size());
        return new ConfigOverlay(selected, values);
    }

    private Map<String, Object> readSections(Path document, String rootKey) {
        if (!Files.exists(document)) {
            return Map.of();
        }
        Object loaded;
        try (Reader reader = Files.newBufferedReader(document)) {
            loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
        } catch (IOException ex) {
            throw new ManifestFormatException("設定ファイルの読み込みに失敗しました: " + document, ex);
        }
        if (loaded == null) {
            return Map.of();
        }
        if (!(loaded instanceof Map<?, ?> root)) {
            throw new ManifestFormatException(document.getFileName() + " の形式が不正です。");
        }
        Object sections = root.get(rootKey);
        if (sections == null) {
            return Map.of();
        }
        if (!(sections instanceof Map<?, ?> map)) {
            throw new ManifestFormatException(rootKey + " はマップである必要があります。");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((key, value) -> result.put(String.valueOf(key), value));
        return result;
    }

    private String scalar(String path, Object value) {
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            throw new ManifestFormatException(path + " はスカラー値である必要があります。");
        }
        if (value instanceof Boolean bool) {
            return bool ? "true" : "false";
        }
        return String.valueOf(value);
    }
}
