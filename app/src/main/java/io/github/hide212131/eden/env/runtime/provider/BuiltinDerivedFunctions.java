package io.github.hide212131.eden.env.runtime.provider;

import java.util.List;
import java.util.Optional;

/** Functions every registry starts with. */
public final class BuiltinDerivedFunctions {

    public static final String API_URL = "api-url";

    private BuiltinDerivedFunctions() {
    }

    /**
     * {@code http://localhost[:PORT]} when {@code LOCAL} is true, otherwise the configured
     * {@code API_URL}, otherwise no value. Port 80 is omitted.
     */
    public static DerivedFunction apiUrl() {
        return new DerivedFunction(API_URL, List.of("LOCAL", "PORT", "API_URL"), values -> {
            if (values.isTrue("LOCAL")) {
                Optional<String> port = values.get("PORT").map(String::trim).filter(value -> !value.isEmpty());
                if (port.isPresent() && !"80".equals(port.get())) {
                    return Optional.of("http://localhost:" + port.get());
                }
                return Optional.of("http://localhost");
            }
            return values.get("API_URL").filter(value -> !value.isBlank());
        });
    }
}
