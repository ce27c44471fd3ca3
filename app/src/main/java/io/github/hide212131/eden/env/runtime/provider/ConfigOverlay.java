package io.github.hide212131.eden.env.runtime.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 名前付きの設定オーバーレイ (environment / test mode)。キーは大文字小文字を区別しない。
 *
 * @param name selected environment or test mode name, {@code null} when nothing was selected
 * @param values key/value pairs keyed by lower-case key
 */
public record ConfigOverlay(String name, Map<String, String> values) {

    public ConfigOverlay {
        Objects.requireNonNull(values, "values");
        Map<String, String> normalized = new LinkedHashMap<>();
        values.forEach((key, value) -> normalized.put(normalizeKey(key), value));
        values = Collections.unmodifiableMap(normalized);
    }

    public static ConfigOverlay empty() {
        return new ConfigOverlay(null, Map.of());
    }

    public Optional<String> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(normalizeKey(key)));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    static String normalizeKey(String key) {
        return key.trim().toLowerCase(Locale.ROOT);
    }
}
