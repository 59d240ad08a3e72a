package ai.acsl.injector.cli;

import ai.acsl.injector.config.LogFormat;
import ai.acsl.injector.config.Mode;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "acsl-spec-injector", mixinStandardHelpOptions = true, version = "acsl-spec-injector 0.1.0",
        description = "Checks that a C completion keeps the skeleton's structure and splices ACSL specifications into it")
public class CliArguments {

    @CommandLine.Option(names = "--mode", converter = ModeConverter.class,
            description = "Execution mode: inject, compare, inspect, batch or proof-summary")
    private Mode mode;

    @CommandLine.Option(names = "--reference", description = "Skeleton C source", paramLabel = "FILE")
    private Path reference;

    @CommandLine.Option(names = "--candidate", description = "Completed C source", paramLabel = "FILE")
    private Path candidate;

    @CommandLine.Option(names = "--fragments", description = "JSON fragment sequence", paramLabel = "FILE")
    private Path fragments;

    @CommandLine.Option(names = "--output", description = "Annotated output file (inject) or directory (batch)", paramLabel = "PATH")
    private Path output;

    @CommandLine.Option(names = "--manifest", description = "Batch manifest", paramLabel = "FILE")
    private Path manifest;

    @CommandLine.Option(names = "--workers", description = "Worker threads for batch mode", paramLabel = "COUNT")
    private Integer workers;

    @CommandLine.Option(names = "--verifier-log", description = "Captured verifier output", paramLabel = "FILE")
    private Path verifierLog;

    @CommandLine.Option(names = "--diagnostics", description = "Log structure reports while validating")
    private boolean diagnostics;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Mode mode() {
        return mode;
    }

    public Path reference() {
        return reference;
    }

    public Path candidate() {
        return candidate;
    }

    public Path fragments() {
        return fragments;
    }

    public Path output() {
        return output;
    }

    public Path manifest() {
        return manifest;
    }

    public Integer workers() {
        return workers;
    }

    public Path verifierLog() {
        return verifierLog;
    }

    public boolean diagnostics() {
        return diagnostics;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
