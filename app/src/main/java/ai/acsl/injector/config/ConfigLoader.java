package ai.acsl.injector.config;

import ai.acsl.injector.cli.CliArguments;
import ai.acsl.injector.inject.SourceLayout;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_MODE = "INJECTOR_MODE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_DIAGNOSTICS = "INJECTOR_DIAGNOSTICS";
    static final String ENV_WORKERS = "INJECTOR_WORKERS";
    static final String ENV_INCLUDE_PATTERN = "INJECTOR_INCLUDE_PATTERN";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        return new Config(
                resolveMode(arguments),
                Optional.ofNullable(arguments.reference()),
                Optional.ofNullable(arguments.candidate()),
                Optional.ofNullable(arguments.fragments()),
                Optional.ofNullable(arguments.output()),
                Optional.ofNullable(arguments.manifest()),
                Optional.ofNullable(arguments.verifierLog()),
                resolveWorkers(arguments),
                resolveDiagnostics(arguments),
                resolveLogFormat(arguments),
                resolveIncludePattern());
    }

    private Mode resolveMode(CliArguments arguments) {
        Mode cliMode = arguments.mode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.get(ENV_MODE)
                .filter(ConfigLoader::isNotBlank)
                .map(Mode::from)
                .orElse(Mode.INJECT);
    }

    private boolean resolveDiagnostics(CliArguments arguments) {
        if (arguments.diagnostics()) {
            return true;
        }
        return environmentReader.get(ENV_DIAGNOSTICS)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private int resolveWorkers(CliArguments arguments) {
        Integer cliWorkers = arguments.workers();
        if (cliWorkers != null) {
            if (cliWorkers < 1) {
                throw new IllegalArgumentException("--workers must be at least 1");
            }
            return cliWorkers;
        }
        return environmentReader.get(ENV_WORKERS)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(ConfigLoader::parseWorkerCount)
                .orElse(Runtime.getRuntime().availableProcessors());
    }

    private Pattern resolveIncludePattern() {
        Optional<String> raw = environmentReader.get(ENV_INCLUDE_PATTERN).filter(ConfigLoader::isNotBlank);
        if (raw.isEmpty()) {
            return SourceLayout.DEFAULT_INCLUDE_PATTERN;
        }
        try {
            return Pattern.compile(raw.get());
        } catch (PatternSyntaxException ex) {
            throw new IllegalArgumentException(ENV_INCLUDE_PATTERN + " is not a valid regular expression", ex);
        }
    }

    private static int parseWorkerCount(String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(ENV_WORKERS + " must be at least 1");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_WORKERS + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
