package io.github.hide212131.eden.env.runtime.secrets;

import io.github.hide212131.eden.env.runtime.provider.SecretLookup;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * リモートのシークレットをすべてローカルの暗号化ストアへコピーする。
 * <p>
 * A secret the remote manager lists but cannot return is skipped and reported as
 * {@link DownloadResult#PARTIAL_DOWNLOAD}; a local write failure stops the copy at once.
 */
public final class SecretDownloader {

    private static final Logger LOGGER = LoggerFactory.getLogger(SecretDownloader.class);

    private final RemoteSecretManagerClient source;
    private final LocalEncryptedStore target;

    public SecretDownloader(RemoteSecretManagerClient source, LocalEncryptedStore target) {
        this.source = Objects.requireNonNull(source, "source");
        this.target = Objects.requireNonNull(target, "target");
    }

    public DownloadResult download() {
        SecretListing listing = source.listSecrets();
        if (listing instanceof SecretListing.Failed failed) {
            String detail = failed.detail() == null ? "" : " (" + failed.detail() + ")";
            return DownloadResult.failed(failed.reason().name(),
                    "Secrets " + failed.reason().describe(RemoteSecretProvider.NAME) + detail, 0, 0);
        }
        List<String> names = ((SecretListing.Listed) listing).names();
        List<String> skipped = new ArrayList<>();
        int downloaded = 0;
        for (String name : names) {
            SecretLookup lookup = source.accessLatest(name);
            if (lookup instanceof SecretLookup.Unavailable unavailable) {
                LOGGER.warn("Skipping secret '{}': {}", name, unavailable.reason());
                skipped.add(name);
                continue;
            }
            StoreResult<SecretInfo> written = target.set(name, ((SecretLookup.Found) lookup).value());
            if (written instanceof StoreResult.Failure<SecretInfo> failure) {
                return DownloadResult.failed(failure.failure().name(), failure.message(), downloaded, names.size());
            }
            downloaded++;
        }
        if (!skipped.isEmpty()) {
            return DownloadResult.failed(DownloadResult.PARTIAL_DOWNLOAD, "Only " + downloaded + "/" + names.size()
                    + " secrets downloaded successfully; skipped: " + String.join(", ", skipped),
                    downloaded, names.size());
        }
        LOGGER.info("Downloaded {} secrets into {}", downloaded, target.secretsFile());
        return DownloadResult.completed(downloaded);
    }
}
