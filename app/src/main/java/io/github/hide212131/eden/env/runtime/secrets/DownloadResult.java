package io.github.hide212131.eden.env.runtime.secrets;

/**
 * Outcome of {@link SecretDownloader#download()}.
 *
 * @param downloaded secrets written to the local store
 * @param total secrets listed by the remote manager
 * @param errorCode {@code null} on success, otherwise the failure code (a remote
 *     {@code SecretUnavailability}, a {@link StoreFailure} or {@link #PARTIAL_DOWNLOAD})
 * @param message human readable detail of the failure, {@code null} on success
 */
public record DownloadResult(int downloaded, int total, String errorCode, String message) {

    public static final String PARTIAL_DOWNLOAD = "PARTIAL_DOWNLOAD";

    static DownloadResult completed(int count) {
        return new DownloadResult(count, count, null, null);
    }

    static DownloadResult failed(String errorCode, String message, int downloaded, int total) {
        return new DownloadResult(downloaded, total, errorCode, message);
    }

    public boolean success() {
        return errorCode == null;
    }
}
