package ai.acsl.injector.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.acsl.injector.cli.CliArguments;
import ai.acsl.injector.inject.SourceLayout;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--mode", "compare",
                "--reference", "skeleton.c",
                "--candidate", "completion.c",
                "--workers", "3",
                "--diagnostics",
                "--log-format", "json");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.COMPARE);
        assertThat(config.reference()).contains(Path.of("skeleton.c"));
        assertThat(config.candidate()).contains(Path.of("completion.c"));
        assertThat(config.fragments()).isEmpty();
        assertThat(config.workers()).isEqualTo(3);
        assertThat(config.diagnostics()).isTrue();
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.includePattern()).isSameAs(SourceLayout.DEFAULT_INCLUDE_PATTERN);
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_MODE, "proof-summary");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "json");
        envValues.put(ConfigLoader.ENV_DIAGNOSTICS, "1");
        envValues.put(ConfigLoader.ENV_WORKERS, "4");
        envValues.put(ConfigLoader.ENV_INCLUDE_PATTERN, "^#import\\s");
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--verifier-log", "wp.log");

        Config config = new ConfigLoader(key -> Optional.ofNullable(envValues.get(key))).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.PROOF_SUMMARY);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.diagnostics()).isTrue();
        assertThat(config.workers()).isEqualTo(4);
        assertThat(config.includePattern().pattern()).isEqualTo("^#import\\s");
    }

    @Test
    void prefersCliOverEnvironment() {
        Map<String, String> envValues = Map.of(ConfigLoader.ENV_MODE, "batch", ConfigLoader.ENV_WORKERS, "8");
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--mode", "inspect", "--reference", "skeleton.c", "--workers", "2");

        Config config = new ConfigLoader(key -> Optional.ofNullable(envValues.get(key))).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.INSPECT);
        assertThat(config.workers()).isEqualTo(2);
    }

    @Test
    void appliesDefaults() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--reference", "a.c", "--candidate", "b.c", "--fragments", "f.json");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.INJECT);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.diagnostics()).isFalse();
        assertThat(config.workers()).isEqualTo(Runtime.getRuntime().availableProcessors());
        assertThat(config.output()).isEmpty();
    }

    @Test
    void requiresFilesOfSelectedMode() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--reference", "a.c", "--candidate", "b.c");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class)
                .hasMessage("--fragments must be provided in inject mode");
    }

    @Test
    void batchModeNeedsOutputDirectory() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--mode", "batch", "--manifest", "jobs.json");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown).hasMessage("--output must be provided in batch mode");
    }

    @Test
    void rejectsInvalidWorkerValues() {
        CliArguments fromCli = CommandLine.populateCommand(new CliArguments(), "--mode", "inspect", "--reference", "a.c", "--workers", "0");
        CliArguments fromEnv = CommandLine.populateCommand(new CliArguments(), "--mode", "inspect", "--reference", "a.c");

        Throwable cliError = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(fromCli));
        Throwable envError = catchThrowable(() -> new ConfigLoader(
                key -> key.equals(ConfigLoader.ENV_WORKERS) ? Optional.of("many") : Optional.empty()).load(fromEnv));

        assertThat(cliError).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--workers");
        assertThat(envError).isInstanceOf(IllegalArgumentException.class).hasMessage("INJECTOR_WORKERS must be an integer");
    }

    @Test
    void rejectsInvalidIncludePattern() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--mode", "inspect", "--reference", "a.c");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(
                key -> key.equals(ConfigLoader.ENV_INCLUDE_PATTERN) ? Optional.of("([") : Optional.empty()).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessageContaining(ConfigLoader.ENV_INCLUDE_PATTERN);
    }

    @Test
    void parsesModeNamesLeniently() {
        assertThat(Mode.from("Proof-Summary")).isEqualTo(Mode.PROOF_SUMMARY);
        assertThat(Mode.from(" ")).isEqualTo(Mode.INJECT);
        assertThat(catchThrowable(() -> Mode.from("deploy"))).hasMessage("Unsupported mode: deploy");
    }
}
