package io.github.hide212131.eden.env.runtime.provider;

import java.util.Objects;
import java.util.Optional;

/** Serves {@code static:<key>} values: the test-mode overlay wins over the environment overlay. */
public final class StaticConfigProvider implements ValueProvider {

    /** Which overlay supplied a value. */
    public enum Layer {
        TEST_MODE,
        ENVIRONMENT
    }

    public record StaticValue(String value, Layer layer) {
        public StaticValue {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(layer, "layer");
        }
    }

    private final ConfigOverlay testMode;
    private final ConfigOverlay environment;

    public StaticConfigProvider(ConfigOverlay testMode, ConfigOverlay environment) {
        this.testMode = Objects.requireNonNull(testMode, "testMode");
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    public static StaticConfigProvider empty() {
        return new StaticConfigProvider(ConfigOverlay.empty(), ConfigOverlay.empty());
    }

    public Optional<StaticValue> find(String key) {
        Optional<String> fromTestMode = testMode.get(key);
        if (fromTestMode.isPresent()) {
            return Optional.of(new StaticValue(fromTestMode.get(), Layer.TEST_MODE));
        }
        return environment.get(key).map(value -> new StaticValue(value, Layer.ENVIRONMENT));
    }

    @Override
    public Optional<String> lookup(String key) {
        return find(key).map(StaticValue::value);
    }

    public ConfigOverlay testMode() {
        return testMode;
    }

    public ConfigOverlay environment() {
        return environment;
    }
}
