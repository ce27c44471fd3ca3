package io.github.hide212131.eden.env.app;

import io.github.hide212131.eden.env.runtime.EnvironmentResolutionException;
import io.github.hide212131.eden.env.runtime.resolve.ConfigurationReport;
import io.github.hide212131.eden.env.runtime.resolve.EnvironmentProjection;
import io.github.hide212131.eden.env.runtime.resolve.ResolvedSet;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/** 変数を解決して表示する (resolve)。 */
@Command(name = "resolve", description = "マニフェストの変数を解決して出力します。", mixinStandardHelpOptions = true)
public final class ResolveCommand implements Callable<Integer> {

    enum Format {
        TABLE,
        ENV,
        EXPORT,
        JSON
    }

    @Spec
    private CommandSpec spec;

    @ParentCommand
    private EdenEnvCliApp root;

    @Option(names = "--env", paramLabel = "NAME", description = "environment overlay (未指定時は EDEN_ENV)")
    private String environment;

    @Option(names = "--test-mode", paramLabel = "MODE", description = "test mode overlay (未指定時は EDEN_TEST_MODE)")
    private String testMode;

    @Option(names = "--group", paramLabel = "GROUP", description = "解決するグループ (複数指定可)")
    private List<String> groups = new ArrayList<>();

    @Option(names = "--name", paramLabel = "NAME", description = "解決する変数 (複数指定可)")
    private List<String> names = new ArrayList<>();

    @Option(names = "--format", paramLabel = "FORMAT", defaultValue = "table",
            description = "出力形式: ${COMPLETION-CANDIDATES}")
    private Format format = Format.TABLE;

    @Option(names = "--show-secrets", description = "table 形式でシークレットをマスクしない")
    private boolean showSecrets;

    @SuppressWarnings("PMD.UnnecessaryConstructor")
    public ResolveCommand() {
        // for picocli
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        List<String> selection = new ArrayList<>(groups);
        selection.addAll(names);
        try {
            ResolvedSet resolved = root.context(environment, testMode)
                    .newResolver(root.processEnvironment())
                    .resolve(selection);
            EnvironmentProjection projection = new EnvironmentProjection(resolved);
            switch (format) {
                case ENV -> out.print(projection.renderDotenv());
                case EXPORT -> out.print(projection.renderExport());
                case JSON -> out.println(projection.renderJson());
                default -> out.print(new ConfigurationReport(showSecrets).render(resolved));
            }
            out.flush();
            return CommandLine.ExitCode.OK;
        } catch (EnvironmentResolutionException ex) {
            return EdenEnvCliApp.reportFailure(err, ex);
        } catch (IllegalStateException ex) {
            return EdenEnvCliApp.reportFailure(err, ex.getMessage());
        }
    }
}
