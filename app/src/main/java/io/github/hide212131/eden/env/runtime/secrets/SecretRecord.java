package io.github.hide212131.eden.env.runtime.secrets;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/** One decrypted name/value pair. Only lives in memory for the duration of one store operation. */
public record SecretRecord(@JsonProperty("name") String name, @JsonProperty("value") String value) {

    public SecretRecord {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return "SecretRecord[name=" + name + ", value=****]";
    }
}
