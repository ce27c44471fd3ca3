package io.github.hide212131.eden.env.runtime.secrets;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Passphrase-protected file of name/value pairs plus a host-cached derived key.
 * <p>
 * Every operation reads and decrypts the whole file, mutates it in memory, then encrypts and
 * replaces it atomically. The cached key lives at {@code <cacheRoot>/eden_key_<sha256(path)[:8]>}
 * so each secrets file keeps its own cache. A key that cannot decrypt the file never causes the
 * file or the cache to be removed.
 * <p>
 * Single writer only: concurrent invocations against the same files are not coordinated.
 */
@SuppressWarnings("PMD.TooManyMethods")
public final class LocalEncryptedStore {

    public static final String CACHE_FILE_PREFIX = "eden_key_";

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalEncryptedStore.class);
    private static final Set<PosixFilePermission> OWNER_ONLY = EnumSet.of(
            PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE);

    private final Path secretsFile;
    private final Path cachedKeyFile;
    private final SecretCipher cipher = new SecretCipher();

    public LocalEncryptedStore(Path secretsFile, Path cacheRoot) {
        Objects.requireNonNull(secretsFile, "secretsFile");
        Objects.requireNonNull(cacheRoot, "cacheRoot");
        this.secretsFile = secretsFile.toAbsolutePath().normalize();
        this.cachedKeyFile = cacheRoot.toAbsolutePath().normalize().resolve(cacheFileName(this.secretsFile));
    }

    static String cacheFileName(Path absoluteSecretsFile) {
        byte[] digest = SecretCipher.sha256(absoluteSecretsFile.toString().getBytes(StandardCharsets.UTF_8));
        return CACHE_FILE_PREFIX + HexFormat.of().formatHex(digest).substring(0, 8);
    }

    public Path secretsFile() {
        return secretsFile;
    }

    public Path cachedKeyFile() {
        return cachedKeyFile;
    }

    /** Never fails; an unreadable cache is reported as absent. */
    public CachedKeyStatus getCachedKeyStatus() {
        try {
            Optional<byte[]> key = readCachedKey();
            return key.map(bytes -> new CachedKeyStatus(true, SecretCipher.shortHash(bytes), cachedKeyFile))
                    .orElseGet(() -> CachedKeyStatus.absent(cachedKeyFile));
        } catch (IOException ex) {
            LOGGER.warn("Cached key {} could not be read: {}", cachedKeyFile, ex.getMessage());
            return CachedKeyStatus.absent(cachedKeyFile);
        }
    }

    public StoreResult<CachedKeyUpdate> setCachedKey(String passphrase) {
        if (passphrase == null || passphrase.isEmpty()) {
            throw new IllegalArgumentException("passphrase must not be empty");
        }
        byte[] newKey = cipher.deriveKey(passphrase);
        String fingerprint = SecretCipher.shortHash(newKey);
        try {
            Optional<byte[]> existing = readCachedKey();
            if (existing.isPresent() && Arrays.equals(existing.get(), newKey)) {
                return StoreResult.success(new CachedKeyUpdate(CachedKeyOutcome.NO_CHANGE, fingerprint));
            }
            Optional<byte[]> encrypted = readSecretsFile();
            if (encrypted.isEmpty()) {
                writeAtomically(cachedKeyFile, newKey);
                LOGGER.info("Cached a new key {} (no secrets file yet)", fingerprint);
                return StoreResult.success(new CachedKeyUpdate(CachedKeyOutcome.NEW, fingerprint));
            }
            if (!SecretCipher.isWellFormed(encrypted.get())) {
                return StoreResult.failure(StoreFailure.CORRUPTED, "Secrets file is truncated: " + secretsFile);
            }
            try {
                cipher.decrypt(newKey, encrypted.get());
            } catch (GeneralSecurityException ex) {
                LOGGER.warn("Passphrase does not decrypt {}; cached key left untouched", secretsFile);
                return StoreResult.success(new CachedKeyUpdate(CachedKeyOutcome.INVALID, fingerprint));
            }
            writeAtomically(cachedKeyFile, newKey);
            CachedKeyOutcome outcome = existing.isEmpty() ? CachedKeyOutcome.VALID_SET : CachedKeyOutcome.VALID_CHANGE;
            LOGGER.info("Cached key {} ({})", fingerprint, outcome);
            return StoreResult.success(new CachedKeyUpdate(outcome, fingerprint));
        } catch (IOException ex) {
            return ioFailure("set cached key", ex);
        }
    }

    public StoreResult<SecretInfo> get(String name, boolean reveal) {
        Objects.requireNonNull(name, "name");
        StoreResult<SecretsDocument> loaded = loadExisting();
        if (loaded instanceof StoreResult.Failure<SecretsDocument> failure) {
            return StoreResult.failure(failure.failure(), failure.message());
        }
        return loaded.orElseThrow().find(name)
                .map(record -> StoreResult.success(SecretInfo.of(record.name(), record.value(), reveal)))
                .orElseGet(() -> notFound(name));
    }

    /** Creates or replaces {@code name}. The first write needs a key cached through the NEW outcome. */
    public StoreResult<SecretInfo> set(String name, String value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        if (name.isBlank()) {
            throw new IllegalArgumentException("secret name must not be blank");
        }
        try {
            Optional<byte[]> key = readCachedKey();
            if (key.isEmpty()) {
                return keyUnavailable();
            }
            StoreResult<SecretsDocument> loaded = readSecretsFile().isPresent()
                    ? decryptDocument(key.get())
                    : StoreResult.success(SecretsDocument.empty());
            if (loaded instanceof StoreResult.Failure<SecretsDocument> failure) {
                return StoreResult.failure(failure.failure(), failure.message());
            }
            SecretsDocument updated = loaded.orElseThrow().with(name, value);
            writeDocument(key.get(), updated);
            LOGGER.info("Stored secret '{}' ({} secrets in {})", name, updated.secrets().size(), secretsFile);
            return StoreResult.success(SecretInfo.of(name, value, false));
        } catch (IOException ex) {
            return ioFailure("set secret", ex);
        }
    }

    public StoreResult<SecretInfo> delete(String name) {
        Objects.requireNonNull(name, "name");
        StoreResult<SecretsDocument> loaded = loadExisting();
        if (loaded instanceof StoreResult.Failure<SecretsDocument> failure) {
            return StoreResult.failure(failure.failure(), failure.message());
        }
        SecretsDocument document = loaded.orElseThrow();
        Optional<SecretRecord> record = document.find(name);
        if (record.isEmpty()) {
            return notFound(name);
        }
        try {
            writeDocument(readCachedKey().orElseThrow(), document.without(name));
            LOGGER.info("Deleted secret '{}'", name);
            return StoreResult.success(SecretInfo.of(name, record.get().value(), false));
        } catch (IOException ex) {
            return ioFailure("delete secret", ex);
        }
    }

    /** Names in file order. No secrets file means an empty list. */
    public StoreResult<List<String>> list() {
        try {
            if (readSecretsFile().isEmpty()) {
                return StoreResult.success(List.of());
            }
        } catch (IOException ex) {
            return ioFailure("list secrets", ex);
        }
        return loadExisting().map(SecretsDocument::names);
    }

    public StoreResult<Boolean> exists(String name) {
        Objects.requireNonNull(name, "name");
        try {
            if (readSecretsFile().isEmpty()) {
                return StoreResult.success(false);
            }
        } catch (IOException ex) {
            return ioFailure("check secret", ex);
        }
        return loadExisting().map(document -> document.find(name).isPresent());
    }

    /**
     * Re-encrypts the file under a key derived from {@code newPassphrase}. The file is written
     * before the cache, so an interruption leaves a file the old cached key still opens.
     */
    public StoreResult<CachedKeyStatus> rotateKey(String newPassphrase) {
        if (newPassphrase == null || newPassphrase.isEmpty()) {
            throw new IllegalArgumentException("passphrase must not be empty");
        }
        try {
            Optional<byte[]> oldKey = readCachedKey();
            if (oldKey.isEmpty()) {
                return keyUnavailable();
            }
            byte[] newKey = cipher.deriveKey(newPassphrase);
            if (readSecretsFile().isPresent()) {
                StoreResult<SecretsDocument> loaded = decryptDocument(oldKey.get());
                if (loaded instanceof StoreResult.Failure<SecretsDocument> failure) {
                    return StoreResult.failure(failure.failure(), failure.message());
                }
                writeDocument(newKey, loaded.orElseThrow());
            }
            writeAtomically(cachedKeyFile, newKey);
            String fingerprint = SecretCipher.shortHash(newKey);
            LOGGER.info("Rotated secrets key to {}", fingerprint);
            return StoreResult.success(new CachedKeyStatus(true, fingerprint, cachedKeyFile));
        } catch (IOException ex) {
            return ioFailure("rotate key", ex);
        }
    }

    /** Deletes the secrets file only; the cached key stays. */
    public StoreResult<Boolean> clear() {
        try {
            boolean deleted = Files.deleteIfExists(secretsFile);
            LOGGER.info("Secrets file {} {}", secretsFile, deleted ? "deleted" : "did not exist");
            return StoreResult.success(deleted);
        } catch (IOException ex) {
            return ioFailure("clear secrets", ex);
        }
    }

    /** Deletes the cached key only; the secrets file stays. */
    public StoreResult<Boolean> clearCachedKey() {
        try {
            return StoreResult.success(Files.deleteIfExists(cachedKeyFile));
        } catch (IOException ex) {
            return ioFailure("clear cached key", ex);
        }
    }

    /** Loads the document for operations that need an existing file. */
    private StoreResult<SecretsDocument> loadExisting() {
        try {
            if (readSecretsFile().isEmpty()) {
                return StoreResult.failure(StoreFailure.NO_SECRETS_FILE, "No local secrets file at " + secretsFile);
            }
            Optional<byte[]> key = readCachedKey();
            if (key.isEmpty()) {
                return keyUnavailable();
            }
            return decryptDocument(key.get());
        } catch (IOException ex) {
            return ioFailure("load secrets", ex);
        }
    }

    private StoreResult<SecretsDocument> decryptDocument(byte[] key) throws IOException {
        byte[] encrypted = readSecretsFile().orElseThrow();
        if (!SecretCipher.isWellFormed(encrypted)) {
            return StoreResult.failure(StoreFailure.CORRUPTED, "Secrets file is truncated: " + secretsFile);
        }
        byte[] plaintext;
        try {
            plaintext = cipher.decrypt(key, encrypted);
        } catch (GeneralSecurityException ex) {
            return StoreResult.failure(StoreFailure.KEY_INVALID,
                    "Cached key " + SecretCipher.shortHash(key) + " cannot decrypt " + secretsFile);
        }
        try {
            return StoreResult.success(SecretsDocument.fromJson(plaintext));
        } catch (IOException ex) {
            return StoreResult.failure(StoreFailure.CORRUPTED,
                    "Secrets file decrypts to an unreadable document: " + ex.getMessage());
        }
    }

    private void writeDocument(byte[] key, SecretsDocument document) throws IOException {
        writeAtomically(secretsFile, cipher.encrypt(key, document.toJson()));
    }

    /** Empty files count as absent. */
    private Optional<byte[]> readSecretsFile() throws IOException {
        if (!Files.isRegularFile(secretsFile)) {
            return Optional.empty();
        }
        byte[] data = Files.readAllBytes(secretsFile);
        return data.length == 0 ? Optional.empty() : Optional.of(data);
    }

    private Optional<byte[]> readCachedKey() throws IOException {
        if (!Files.isRegularFile(cachedKeyFile)) {
            return Optional.empty();
        }
        byte[] key = Files.readAllBytes(cachedKeyFile);
        if (key.length != SecretCipher.KEY_LENGTH) {
            LOGGER.warn("Ignoring cached key {} with unexpected length {}", cachedKeyFile, key.length);
            return Optional.empty();
        }
        return Optional.of(key);
    }

    private void writeAtomically(Path target, byte[] data) throws IOException {
        Path directory = target.getParent();
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
        try {
            restrictPermissions(temp);
            Files.write(temp, data);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                LOGGER.debug("Atomic move not supported for {}, falling back to replace", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private void restrictPermissions(Path path) throws IOException {
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(path, OWNER_ONLY);
        }
    }

    private static <T> StoreResult<T> keyUnavailable() {
        return StoreResult.failure(StoreFailure.KEY_UNAVAILABLE, "No cached key. Set the cached key first.");
    }

    private static <T> StoreResult<T> notFound(String name) {
        return StoreResult.failure(StoreFailure.NOT_FOUND, "Secret '" + name + "' not found");
    }

    private <T> StoreResult<T> ioFailure(String operation, IOException ex) {
        LOGGER.warn("Failed to {} ({}): {}", operation, secretsFile, ex.getMessage());
        return StoreResult.failure(StoreFailure.IO_ERROR, "Failed to " + operation + ": " + ex.getMessage());
    }
}
