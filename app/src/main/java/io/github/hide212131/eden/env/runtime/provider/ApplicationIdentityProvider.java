package io.github.hide212131.eden.env.runtime.provider;

import java.util.Optional;

/** {@code app:id} の値を返す。 */
public final class ApplicationIdentityProvider implements ValueProvider {

    private final String applicationId;

    public ApplicationIdentityProvider(String applicationId) {
        this.applicationId = applicationId == null || applicationId.isBlank() ? null : applicationId.trim();
    }

    public Optional<String> applicationId() {
        return Optional.ofNullable(applicationId);
    }

    @Override
    public Optional<String> lookup(String key) {
        return applicationId();
    }
}
