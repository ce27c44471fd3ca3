package io.github.hide212131.eden.env.runtime.provider;

import java.util.Objects;

/** Result of one secret lookup: the value, or the exact reason it could not be produced. */
public sealed interface SecretLookup permits SecretLookup.Found, SecretLookup.Unavailable {

    static SecretLookup found(String value) {
        return new Found(value);
    }

    static SecretLookup unavailable(SecretUnavailability reason, String detail) {
        return new Unavailable(reason, detail);
    }

    record Found(String value) implements SecretLookup {
        public Found {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toString() {
            return "Found[value=****]";
        }
    }

    record Unavailable(SecretUnavailability reason, String detail) implements SecretLookup {
        public Unavailable {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
