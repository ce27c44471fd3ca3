package io.github.hide212131.eden.env.runtime.manifest;

import io.github.hide212131.eden.env.runtime.ManifestFormatException;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

/**
 * Loads the variables manifest.
 *
 * <pre>
 * variables:
 *   - name: GEMINI_API_KEY
 *     source: secret:gemini-api-key
 *     condition:
 *       STUB_AI: false
 *     default: ...
 *     optional: true
 *     group: ai
 * groups:
 *   ai: [GEMINI_API_KEY, STUB_AI]
 * </pre>
 */
public final class ManifestLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(ManifestLoader.class);

    private static final Set<String> ALLOWED_KEYS = Set.of(
            "name",
            "source",
            "condition",
            "default",
            "optional",
            "required",
            "group",
            "description");

    public Manifest load(Path manifestPath) {
        Objects.requireNonNull(manifestPath, "manifestPath");
        if (!Files.exists(manifestPath)) {
            throw new ManifestFormatException("manifest が見つかりません: " + manifestPath);
        }
        try (Reader reader = Files.newBufferedReader(manifestPath)) {
            Object loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
            Manifest manifest = toManifest(loaded);
            LOGGER.debug("Loaded {} variable definitions from {}", manifest.definitions().size(), manifestPath);
            return manifest;
        } catch (IOException ex) {
            throw new ManifestFormatException("manifest の読み込みに失敗しました: " + manifestPath, ex);
        }
    }

    public Manifest parse(String yamlContent) {
        Objects.requireNonNull(yamlContent, "yamlContent");
        Object loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(yamlContent);
        return toManifest(loaded);
    }

    private Manifest toManifest(Object loaded) {
        if (!(loaded instanceof Map<?, ?> root)) {
            throw new ManifestFormatException("manifest の形式が不正です。");
        }
        Object variables = root.get("variables");
        if (!(variables instanceof List<?> entries)) {
            throw new ManifestFormatException("variables が未定義、または配列ではありません。");
        }
        List<VariableDefinition> definitions = new ArrayList<>();
        for (Object entry : entries) {
            if (!(entry instanceof Map<?, ?> map)) {
                throw new ManifestFormatException("variables の要素はマップである必要があります: " + entry);
            }
            definitions.add(toDefinition(map));
        }
        return new Manifest(definitions, parseGroups(root.get("groups")));
    }

    private VariableDefinition toDefinition(Map<?, ?> map) {
        String name = requireString(map, "name", null);
        for (Object key : map.keySet()) {
            if (!ALLOWED_KEYS.contains(String.valueOf(key))) {
                LOGGER.warn("Unknown key '{}' in definition of {}", key, name);
            }
        }
        VariableSource source = VariableSource.parse(requireString(map, "source", name));
        Map<String, Object> condition = parseCondition(name, map.get("condition"));
        Object defaultRaw = map.get("default");
        String defaultValue = defaultRaw == null ? null : scalarToString(name, defaultRaw);
        boolean required = resolveRequired(name, map);
        return new VariableDefinition(name, source, condition, defaultValue, required, parseGroupRef(name,
                map.get("group")));
    }

    private boolean resolveRequired(String name, Map<?, ?> map) {
        Object optional = map.get("optional");
        Object required = map.get("required");
        if (optional != null && !(optional instanceof Boolean)) {
            throw new ManifestFormatException(name + ": optional は true/false で指定してください。");
        }
        if (required != null && !(required instanceof Boolean)) {
            throw new ManifestFormatException(name + ": required は true/false で指定してください。");
        }
        if (optional != null && required != null && optional.equals(required)) {
            throw new ManifestFormatException(name + ": optional と required が矛盾しています。");
        }
        if (required != null) {
            return (Boolean) required;
        }
        return optional == null || !((Boolean) optional);
    }

    private Map<String, Object> parseCondition(String name, Object raw) {
        if (raw == null) {
            return Map.of();
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw new ManifestFormatException(name + ": condition はマップである必要があります。");
        }
        Map<String, Object> condition = new LinkedHashMap<>();
        map.forEach((key, value) -> condition.put(String.valueOf(key), value));
        return condition;
    }

    private List<String> parseGroupRef(String name, Object raw) {
        if (raw == null) {
            return List.of();
        }
        if (raw instanceof String single) {
            return List.of(single);
        }
        if (raw instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        throw new ManifestFormatException(name + ": group は文字列または配列で指定してください。");
    }

    private Map<String, List<String>> parseGroups(Object raw) {
        if (raw == null) {
            return Map.of();
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw new ManifestFormatException("groups はマップである必要があります。");
        }
        Map<String, List<String>> groups = new LinkedHashMap<>();
        map.forEach((group, members) -> {
            if (!(members instanceof List<?> list)) {
                throw new ManifestFormatException("groups." + group + " は配列である必要があります。");
            }
            groups.put(String.valueOf(group), list.stream().map(String::valueOf).toList());
        });
        return groups;
    }

    private String requireString(Map<?, ?> map, String key, String owner) {
        Object value = map.get(key);
        if (value == null || String.valueOf(value).isBlank()) {
            String prefix = owner == null ? "" : owner + ": ";
            throw new ManifestFormatException(prefix + key + " は必須です。");
        }
        return String.valueOf(value).trim();
    }

    static String scalarToString(String owner, Object value) {
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            throw new ManifestFormatException(owner + ": default はスカラー値である必要があります。");
        }
        if (value instanceof Boolean bool) {
            return bool ? "true" : "false";
        }
        return String.valueOf(value);
    }
}
