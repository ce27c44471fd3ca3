package io.github.hide212131.eden.env.runtime.secrets;

import io.github.hide212131.eden.env.runtime.provider.SecretUnavailability;
import java.util.List;
import java.util.Objects;

/** Result of listing the secrets of a remote project. */
public sealed interface SecretListing permits SecretListing.Listed, SecretListing.Failed {

    static SecretListing listed(List<String> names) {
        return new Listed(names);
    }

    static SecretListing failed(SecretUnavailability reason, String detail) {
        return new Failed(reason, detail);
    }

    record Listed(List<String> names) implements SecretListing {
        public Listed {
            names = List.copyOf(names);
        }
    }

    record Failed(SecretUnavailability reason, String detail) implements SecretListing {
        public Failed {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
