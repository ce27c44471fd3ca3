package io.github.hide212131.eden.env.runtime.manifest;

import io.github.hide212131.eden.env.runtime.ManifestFormatException;
import java.util.Objects;

/**
 * Where a variable's value comes from. Written in the manifest as {@code static:<key>},
 * {@code secret:<name>}, {@code app:id} or {@code derived:<function>}.
 */
public sealed interface VariableSource
        permits VariableSource.StaticConfig, VariableSource.Secret, VariableSource.AppIdentity,
        VariableSource.Derived {

    String STATIC_PREFIX = "static:";
    String SECRET_PREFIX = "secret:";
    String APP_PREFIX = "app:";
    String DERIVED_PREFIX = "derived:";

    /** Manifest notation of this source. */
    String notation();

    static VariableSource parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ManifestFormatException("source は必須です。");
        }
        String value = raw.trim();
        if (value.startsWith(STATIC_PREFIX)) {
            return new StaticConfig(requireSuffix(value, STATIC_PREFIX));
        }
        if (value.startsWith(SECRET_PREFIX)) {
            return new Secret(requireSuffix(value, SECRET_PREFIX));
        }
        if (value.startsWith(DERIVED_PREFIX)) {
            return new Derived(requireSuffix(value, DERIVED_PREFIX));
        }
        if (value.startsWith(APP_PREFIX)) {
            String attribute = requireSuffix(value, APP_PREFIX);
            if (!"id".equals(attribute)) {
                throw new ManifestFormatException("app: は app:id のみ対応しています: " + raw);
            }
            return new AppIdentity();
        }
        throw new ManifestFormatException(
                "source の形式が不正です (static:/secret:/app:id/derived: のいずれか): " + raw);
    }

    private static String requireSuffix(String value, String prefix) {
        String suffix = value.substring(prefix.length()).trim();
        if (suffix.isEmpty()) {
            throw new ManifestFormatException("source '" + value + "' に名前がありません。");
        }
        return suffix;
    }

    record StaticConfig(String key) implements VariableSource {
        public StaticConfig {
            Objects.requireNonNull(key, "key");
        }

        @Override
        public String notation() {
            return STATIC_PREFIX + key;
        }
    }

    record Secret(String name) implements VariableSource {
        public Secret {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String notation() {
            return SECRET_PREFIX + name;
        }
    }

    record AppIdentity() implements VariableSource {
        @Override
        public String notation() {
            return APP_PREFIX + "id";
        }
    }

    record Derived(String function) implements VariableSource {
        public Derived {
            Objects.requireNonNull(function, "function");
        }

        @Override
        public String notation() {
            return DERIVED_PREFIX + function;
        }
    }
}
