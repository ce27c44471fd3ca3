package io.github.hide212131.eden.env.app;

import io.github.hide212131.eden.env.infra.config.EngineConfiguration;
import io.github.hide212131.eden.env.infra.config.EngineConfigurationLoader;
import io.github.hide212131.eden.env.runtime.EnvironmentResolutionException;
import java.io.PrintWriter;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/** eden-env CLI のルートコマンド。 */
@Command(name = "eden-env", description = "設定値とシークレットを解決します。", mixinStandardHelpOptions = true,
        subcommands = { ResolveCommand.class, ExecCommand.class, SecretsCommand.class })
public final class EdenEnvCliApp {

    static final int EXIT_FAILURE = 1;

    private final Supplier<EngineConfiguration> configuration;
    private final Map<String, String> processEnvironment;

    public EdenEnvCliApp() {
        this(() -> new EngineConfigurationLoader().load(), System.getenv());
    }

    EdenEnvCliApp(Supplier<EngineConfiguration> configuration, Map<String, String> processEnvironment) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.processEnvironment = Map.copyOf(Objects.requireNonNull(processEnvironment, "processEnvironment"));
    }

    public static void main(String[] args) {
        int exitCode = commandLine(new EdenEnvCliApp()).execute(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static CommandLine commandLine(EdenEnvCliApp app) {
        return new CommandLine(app).setCaseInsensitiveEnumValuesAllowed(true);
    }

    EngineContext context(String environment, String testMode) {
        return new EngineContext(configuration.get().withEnvironment(environment).withTestMode(testMode));
    }

    Map<String, String> processEnvironment() {
        return processEnvironment;
    }

    /** Prints the failure and its remediation steps; returns the failure exit code. */
    static int reportFailure(PrintWriter err, EnvironmentResolutionException ex) {
        err.println("Error: " + ex.getMessage());
        for (String step : ex.guidance()) {
            err.println("  - " + step);
        }
        err.flush();
        return EXIT_FAILURE;
    }

    static int reportFailure(PrintWriter err, String message) {
        err.println("Error: " + message);
        err.flush();
        return EXIT_FAILURE;
    }
}
