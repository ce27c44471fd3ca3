package io.github.hide212131.eden.env.app;

import io.github.hide212131.eden.env.runtime.EnvironmentResolutionException;
import io.github.hide212131.eden.env.runtime.resolve.EnvironmentProjection;
import io.github.hide212131.eden.env.runtime.resolve.ResolvedSet;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/** 解決した環境変数を渡して子プロセスを実行する (exec)。終了コードは子プロセスのもの。 */
@Command(name = "exec", description = "解決済みの環境でコマンドを実行します。", mixinStandardHelpOptions = true)
public final class ExecCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @ParentCommand
    private EdenEnvCliApp root;

    @Option(names = "--env", paramLabel = "NAME", description = "environment overlay")
    private String environment;

    @Option(names = "--test-mode", paramLabel = "MODE", description = "test mode overlay")
    private String testMode;

    @Option(names = "--group", paramLabel = "GROUP", description = "解決するグループ (複数指定可)")
    private List<String> groups = new ArrayList<>();

    @Parameters(arity = "1..*", paramLabel = "COMMAND", description = "実行するコマンドと引数 (-- の後に指定)")
    private List<String> command = new ArrayList<>();

    @SuppressWarnings("PMD.UnnecessaryConstructor")
    public ExecCommand() {
        // for picocli
    }

    @Override
    public Integer call() {
        ResolvedSet resolved;
        try {
            resolved = root.context(environment, testMode)
                    .newResolver(root.processEnvironment())
                    .resolve(groups);
        } catch (EnvironmentResolutionException ex) {
            return EdenEnvCliApp.reportFailure(spec.commandLine().getErr(), ex);
        } catch (IllegalStateException ex) {
            return EdenEnvCliApp.reportFailure(spec.commandLine().getErr(), ex.getMessage());
        }

        ProcessBuilder builder = new ProcessBuilder(command).inheritIO();
        new EnvironmentProjection(resolved).applyTo(builder.environment());
        try {
            return builder.start().waitFor();
        } catch (IOException ex) {
            return EdenEnvCliApp.reportFailure(spec.commandLine().getErr(),
                    "コマンドを起動できません: " + String.join(" ", command) + " (" + ex.getMessage() + ")");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return EdenEnvCliApp.reportFailure(spec.commandLine().getErr(), "コマンドの実行が中断されました");
        }
    }
}
