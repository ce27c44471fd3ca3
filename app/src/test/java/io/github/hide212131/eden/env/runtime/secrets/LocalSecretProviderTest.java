package io.github.hide212131.eden.env.runtime.secrets;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.hide212131.eden.env.runtime.provider.SecretLookup;
import io.github.hide212131.eden.env.runtime.provider.SecretUnavailability;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalSecretProviderTest {

    @Test
    void mapsStoreFailuresToUnavailabilityReasons(@TempDir Path tempDir) {
        LocalEncryptedStore store = new LocalEncryptedStore(tempDir.resolve(".secrets"), tempDir.resolve("cache"));
        LocalSecretProvider provider = new LocalSecretProvider(store);

        assertThat(provider.find("k")).isEqualTo(SecretLookup.unavailable(SecretUnavailability.NO_SECRETS_FILE,
                "No local secrets file at " + store.secretsFile()));

        store.setCachedKey("p1").orElseThrow();
        store.set("k", "v").orElseThrow();

        assertThat(provider.lookup("k")).contains("v");
        assertThat(provider.find("other")).isInstanceOfSatisfying(SecretLookup.Unavailable.class,
                unavailable -> assertThat(unavailable.reason()).isEqualTo(SecretUnavailability.NOT_FOUND));
    }
}
