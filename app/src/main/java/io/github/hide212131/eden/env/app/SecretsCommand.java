package io.github.hide212131.eden.env.app;

import io.github.hide212131.eden.env.runtime.EnvironmentResolutionException;
import io.github.hide212131.eden.env.runtime.provider.SecretLookup;
import io.github.hide212131.eden.env.runtime.provider.SecretUnavailability;
import io.github.hide212131.eden.env.runtime.secrets.CachedKeyOutcome;
import io.github.hide212131.eden.env.runtime.secrets.CachedKeyStatus;
import io.github.hide212131.eden.env.runtime.secrets.CachedKeyUpdate;
import io.github.hide212131.eden.env.runtime.secrets.DownloadResult;
import io.github.hide212131.eden.env.runtime.secrets.LocalEncryptedStore;
import io.github.hide212131.eden.env.runtime.secrets.RemoteSecretProvider;
import io.github.hide212131.eden.env.runtime.secrets.SecretDownloader;
import io.github.hide212131.eden.env.runtime.secrets.SecretInfo;
import io.github.hide212131.eden.env.runtime.secrets.SecretListing;
import io.github.hide212131.eden.env.runtime.secrets.StoreResult;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Consumer;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * シークレットの操作 (secrets)。失敗時は失敗コードと1行の対処方法を表示する。
 * <p>
 * {@code get} and {@code list} read from the configured secret manager; the other subcommands
 * manage the local encrypted store, and {@code download} copies the remote manager into it.
 */
@Command(name = "secrets", description = "ローカルの暗号化シークレットを管理します。", mixinStandardHelpOptions = true,
        subcommands = {
            SecretsCommand.Get.class,
            SecretsCommand.Set.class,
            SecretsCommand.Delete.class,
            SecretsCommand.ListSecrets.class,
            SecretsCommand.GetCachedKey.class,
            SecretsCommand.SetCachedKey.class,
            SecretsCommand.RotateKey.class,
            SecretsCommand.Clear.class,
            SecretsCommand.ClearCachedKey.class,
            SecretsCommand.Download.class })
@SuppressWarnings("PMD.ExcessiveImports")
public final class SecretsCommand {

    @ParentCommand
    private EdenEnvCliApp root;

    @SuppressWarnings("PMD.UnnecessaryConstructor")
    public SecretsCommand() {
        // for picocli
    }

    EdenEnvCliApp root() {
        return root;
    }

    EngineContext context() {
        return root.context(null, null);
    }

    LocalEncryptedStore store() {
        return context().localStore();
    }

    /** Shared plumbing of the store subcommands. */
    abstract static class StoreCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @ParentCommand
        SecretsCommand parent;

        @Override
        public Integer call() {
            try {
                return execute();
            } catch (EnvironmentResolutionException ex) {
                return EdenEnvCliApp.reportFailure(spec.commandLine().getErr(), ex);
            } catch (IllegalStateException ex) {
                return EdenEnvCliApp.reportFailure(spec.commandLine().getErr(), ex.getMessage());
            }
        }

        abstract Integer execute();

        PrintWriter out() {
            return spec.commandLine().getOut();
        }

        <T> Integer handle(StoreResult<T> result, Consumer<T> onSuccess) {
            if (result instanceof StoreResult.Failure<T> failure) {
                return failed(failure.failure().name(), failure.message(), failure.failure().remediation());
            }
            onSuccess.accept(result.orElseThrow());
            out().flush();
            return CommandLine.ExitCode.OK;
        }

        Integer failed(String code, String message, String remediation) {
            PrintWriter err = spec.commandLine().getErr();
            err.println("Error [" + code + "]: " + message);
            err.println("  fix: " + remediation);
            err.flush();
            return EdenEnvCliApp.EXIT_FAILURE;
        }

        Integer unavailable(SecretUnavailability reason, String detail, String secretName) {
            String subject = secretName == null ? "Secrets " : "Secret '" + secretName + "' ";
            String suffix = detail == null || detail.isBlank() ? "" : " (" + detail + ")";
            return failed(reason.name(), subject + reason.describe(RemoteSecretProvider.NAME) + suffix,
                    reason.remediation(secretName == null ? "<name>" : secretName));
        }

        boolean usesRemoteManager(EngineContext context) {
            return RemoteSecretProvider.NAME.equals(context.secretsManager());
        }
    }

    @Command(name = "get", description = "シークレットを取得します (既定ではハッシュのみ表示)。")
    static final class Get extends StoreCommand {

        @Parameters(index = "0", paramLabel = "NAME")
        private String name;

        @Option(names = "--show", description = "値を表示する")
        private boolean show;

        @Override
        Integer execute() {
            EngineContext context = parent.context();
            if (!usesRemoteManager(context)) {
                return handle(context.localStore().get(name, show), this::print);
            }
            SecretLookup lookup = context.remoteClient().accessLatest(name);
            if (lookup instanceof SecretLookup.Unavailable missing) {
                return unavailable(missing.reason(), missing.detail(), name);
            }
            print(SecretInfo.of(name, ((SecretLookup.Found) lookup).value(), show));
            out().flush();
            return CommandLine.ExitCode.OK;
        }

        private void print(SecretInfo info) {
            if (show) {
                out().println(info.value());
            } else {
                out().println(info.name() + " (hash: " + info.hash() + ")");
            }
        }
    }

    @Command(name = "set", description = "シークレットを保存します。")
    static final class Set extends StoreCommand {

        @Parameters(index = "0", paramLabel = "NAME")
        private String name;

        @Parameters(index = "1", paramLabel = "VALUE")
        private String value;

        @Override
        Integer execute() {
            LocalEncryptedStore store = parent.store();
            StoreResult<Boolean> exists = store.exists(name);
            boolean existed = exists.isSuccess() && exists.orElseThrow();
            return handle(store.set(name, value), info ->
                    out().println((existed ? "Updated " : "Created ") + info.name() + " (hash: " + info.hash() + ")"));
        }
    }

    @Command(name = "delete", description = "シークレットを削除します。")
    static final class Delete extends StoreCommand {

        @Parameters(index = "0", paramLabel = "NAME")
        private String name;

        @Override
        Integer execute() {
            return handle(parent.store().delete(name), info -> out().println("Deleted " + info.name()));
        }
    }

    @Command(name = "list", description = "シークレット名を一覧表示します。")
    static final class ListSecrets extends StoreCommand {

        @Override
        Integer execute() {
            EngineContext context = parent.context();
            if (!usesRemoteManager(context)) {
                return handle(context.localStore().list(), this::print);
            }
            SecretListing listing = context.remoteClient().listSecrets();
            if (listing instanceof SecretListing.Failed failed) {
                return unavailable(failed.reason(), failed.detail(), null);
            }
            print(((SecretListing.Listed) listing).names());
            out().flush();
            return CommandLine.ExitCode.OK;
        }

        private void print(List<String> names) {
            if (names.isEmpty()) {
                out().println("(no secrets)");
            }
            names.forEach(out()::println);
        }
    }

    @Command(name = "get-cached-key", description = "キャッシュ鍵の状態を表示します。")
    static final class GetCachedKey extends StoreCommand {

        @Override
        Integer execute() {
            CachedKeyStatus status = parent.store().getCachedKeyStatus();
            if (status.present()) {
                out().println("Cached key: present (fingerprint " + status.fingerprint() + ")");
            } else {
                out().println("Cached key: absent");
            }
            out().println("Cache file: " + status.cacheFile());
            out().flush();
            return CommandLine.ExitCode.OK;
        }
    }

    @Command(name = "set-cached-key", description = "パスフレーズから鍵を導出してキャッシュします。")
    static final class SetCachedKey extends StoreCommand {

        @Option(names = "--passphrase", required = true, interactive = true, arity = "0..1",
                description = "パスフレーズ (値を省略すると入力を求めます)")
        private String passphrase;

        @Override
        Integer execute() {
            StoreResult<CachedKeyUpdate> result = parent.store().setCachedKey(passphrase);
            if (result.isSuccess() && result.orElseThrow().outcome() == CachedKeyOutcome.INVALID) {
                PrintWriter err = spec.commandLine().getErr();
                err.println("Error [INVALID]: passphrase cannot decrypt the existing secrets file;"
                        + " the cached key was left unchanged");
                err.println("  fix: retry with the correct passphrase, or eden-env secrets clear --force");
                err.flush();
                return EdenEnvCliApp.EXIT_FAILURE;
            }
            return handle(result, update ->
                    out().println(update.outcome() + " (fingerprint " + update.fingerprint() + ")"));
        }
    }

    @Command(name = "rotate-key", description = "新しいパスフレーズでシークレットファイルを再暗号化します。")
    static final class RotateKey extends StoreCommand {

        @Option(names = "--passphrase", required = true, interactive = true, arity = "0..1",
                description = "新しいパスフレーズ")
        private String passphrase;

        @Override
        Integer execute() {
            return handle(parent.store().rotateKey(passphrase), status ->
                    out().println("Rotated key (fingerprint " + status.fingerprint() + ")"));
        }
    }

    @Command(name = "clear", description = "シークレットファイルを削除します (キャッシュ鍵は残ります)。")
    static final class Clear extends StoreCommand {

        @Option(names = "--force", description = "確認なしで削除する")
        private boolean force;

        @Override
        Integer execute() {
            LocalEncryptedStore store = parent.store();
            if (!force) {
                return EdenEnvCliApp.reportFailure(spec.commandLine().getErr(),
                        "This deletes every secret in " + store.secretsFile() + ". Re-run with --force.");
            }
            return handle(store.clear(), deleted ->
                    out().println(deleted ? "Deleted " + store.secretsFile() : "No secrets file to delete"));
        }
    }

    @Command(name = "clear-cached-key", description = "キャッシュ鍵を削除します (シークレットファイルは残ります)。")
    static final class ClearCachedKey extends StoreCommand {

        @Override
        Integer execute() {
            LocalEncryptedStore store = parent.store();
            return handle(store.clearCachedKey(), deleted ->
                    out().println(deleted ? "Deleted " + store.cachedKeyFile() : "No cached key to delete"));
        }
    }

    @Command(name = "download", description = "リモートのシークレットをすべてローカルの暗号化ファイルへコピーします。")
    static final class Download extends StoreCommand {

        static final String SECRETS_FILE_NAME = ".secrets";

        @Parameters(index = "0", paramLabel = "DIR", description = "secrets ファイルを作成するディレクトリ")
        private Path directory;

        @Option(names = "--env", paramLabel = "NAME", description = "project_id を読む environment overlay")
        private String environment;

        @Option(names = "--passphrase", interactive = true, arity = "0..1",
                description = "DIR のファイル用のパスフレーズ (省略時はキャッシュ済みの鍵を使う)")
        private String passphrase;

        @Override
        Integer execute() {
            EngineContext context = parent.root().context(environment, null);
            if (!usesRemoteManager(context)) {
                return failed("INVALID_OPERATION", "Cannot download from the local secret manager",
                        "export EDEN_SECRETS_MANAGER=google or set secrets.manager: google in app.yaml");
            }
            LocalEncryptedStore target = context.localStore(directory.resolve(SECRETS_FILE_NAME));
            if (passphrase != null) {
                StoreResult<CachedKeyUpdate> cached = target.setCachedKey(passphrase);
                if (cached.isSuccess() && cached.orElseThrow().outcome() == CachedKeyOutcome.INVALID) {
                    return failed("INVALID", "passphrase cannot decrypt " + target.secretsFile(),
                            "retry with the passphrase of the existing file, or choose an empty DIR");
                }
                if (cached instanceof StoreResult.Failure<CachedKeyUpdate> failure) {
                    return failed(failure.failure().name(), failure.message(), failure.failure().remediation());
                }
            }
            DownloadResult result = new SecretDownloader(context.remoteClient(), target).download();
            if (!result.success()) {
                return failed(result.errorCode(), result.message() + " (" + result.downloaded() + "/"
                        + result.total() + " written to " + target.secretsFile() + ")",
                        "fix the reported problem and run eden-env secrets download again");
            }
            out().println("Downloaded " + result.downloaded() + " secrets to " + target.secretsFile());
            out().flush();
            return CommandLine.ExitCode.OK;
        }
    }
}
