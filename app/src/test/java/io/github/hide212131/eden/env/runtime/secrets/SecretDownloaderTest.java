package io.github.hide212131.eden.env.runtime.secrets;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.hide212131.eden.env.runtime.provider.SecretUnavailability;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SecretDownloaderTest {

    @TempDir
    Path tempDir;

    private LocalEncryptedStore keyedStore() {
        LocalEncryptedStore store = new LocalEncryptedStore(tempDir.resolve("backup/.secrets"), tempDir.resolve("cache"));
        store.setCachedKey("p1").orElseThrow();
        return store;
    }

    private static RemoteSecretManagerClient client(FakeSecretManager remote, String projectId) {
        return new RemoteSecretManagerClient(remote.baseUrl(), projectId, new StaticAccessTokenSource("token"),
                Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("リモートの全シークレットをローカルの暗号化ファイルへコピーする")
    void copiesEverySecret() throws IOException {
        try (FakeSecretManager remote = new FakeSecretManager("eden-prod")
                .put("api-key", "k-123")
                .put("db-password", "pw 456")) {
            LocalEncryptedStore target = keyedStore();

            DownloadResult result = new SecretDownloader(client(remote, "eden-prod"), target).download();

            assertThat(result.success()).isTrue();
            assertThat(result.downloaded()).isEqualTo(2);
            assertThat(target.list().orElseThrow()).containsExactly("api-key", "db-password");
            assertThat(target.get("db-password", true).orElseThrow().value()).isEqualTo("pw 456");
        }
    }

    @Test
    @DisplayName("取得できないシークレットがあれば PARTIAL_DOWNLOAD で件数を報告する")
    void reportsPartialDownload() throws IOException {
        try (FakeSecretManager remote = new FakeSecretManager("eden-prod").put("api-key", "k").listOnly("revoked")) {
            LocalEncryptedStore target = keyedStore();

            DownloadResult result = new SecretDownloader(client(remote, "eden-prod"), target).download();

            assertThat(result.success()).isFalse();
            assertThat(result.errorCode()).isEqualTo(DownloadResult.PARTIAL_DOWNLOAD);
            assertThat(result.downloaded()).isEqualTo(1);
            assertThat(result.total()).isEqualTo(2);
            assertThat(result.message()).contains("1/2").contains("revoked");
            assertThat(target.list().orElseThrow()).containsExactly("api-key");
        }
    }

    @Test
    void emptyProjectWritesNothing() throws IOException {
        try (FakeSecretManager remote = new FakeSecretManager("eden-prod")) {
            LocalEncryptedStore target = keyedStore();

            DownloadResult result = new SecretDownloader(client(remote, "eden-prod"), target).download();

            assertThat(result).isEqualTo(DownloadResult.completed(0));
            assertThat(Files.exists(target.secretsFile())).isFalse();
        }
    }

    @Test
    @DisplayName("ローカルに鍵がなければ最初の書き込みで止まり、ストアの失敗コードを返す")
    void stopsOnLocalWriteFailure() throws IOException {
        try (FakeSecretManager remote = new FakeSecretManager("eden-prod").put("api-key", "k")) {
            LocalEncryptedStore target = new LocalEncryptedStore(tempDir.resolve(".secrets"), tempDir.resolve("cache"));

            DownloadResult result = new SecretDownloader(client(remote, "eden-prod"), target).download();

            assertThat(result.errorCode()).isEqualTo(StoreFailure.KEY_UNAVAILABLE.name());
            assertThat(result.downloaded()).isZero();
        }
    }

    @Test
    void listingFailureIsReported() throws IOException {
        try (FakeSecretManager remote = new FakeSecretManager("eden-prod")) {
            DownloadResult result = new SecretDownloader(client(remote, null), keyedStore()).download();

            assertThat(result.errorCode()).isEqualTo(SecretUnavailability.NO_PROJECT_ID.name());
            assertThat(remote.requests()).isEmpty();
        }
    }
}
