package ai.acsl.injector.cli;

import ai.acsl.injector.batch.BatchInjectionService;
import ai.acsl.injector.batch.BatchJob;
import ai.acsl.injector.batch.BatchOutcome;
import ai.acsl.injector.batch.BatchResult;
import ai.acsl.injector.config.Config;
import ai.acsl.injector.config.ConfigLoader;
import ai.acsl.injector.config.SystemEnvironmentReader;
import ai.acsl.injector.inject.InjectionPlanner;
import ai.acsl.injector.inject.MalformedFragmentListException;
import ai.acsl.injector.inject.TextSplicer;
import ai.acsl.injector.io.AnnotatedSourceWriter;
import ai.acsl.injector.io.BatchManifestReader;
import ai.acsl.injector.io.FragmentFileReader;
import ai.acsl.injector.io.SourceFiles;
import ai.acsl.injector.logging.LoggingConfigurator;
import ai.acsl.injector.pipeline.InjectionResult;
import ai.acsl.injector.pipeline.SpecInjectionService;
import ai.acsl.injector.proof.ProofOutputParser;
import ai.acsl.injector.proof.ProofSummary;
import ai.acsl.injector.structure.CodeStructure;
import ai.acsl.injector.structure.ComparisonResult;
import ai.acsl.injector.structure.StructureComparator;
import ai.acsl.injector.structure.StructureExtractor;
import ai.acsl.injector.structure.StructureReport;
import ai.acsl.injector.tree.SourceParseException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and the injection pipeline. Results go to
 * stdout, logs and errors to stderr.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_INVALID_INPUT = 2;

    private final ConfigLoader configLoader;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()),
                new PrintWriter(System.out, true), new PrintWriter(System.err, true));
    }

    CliApplication(ConfigLoader configLoader, PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            err.println(ex.getMessage());
            commandLine.usage(err);
            err.flush();
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            out.flush();
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            out.flush();
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        try {
            Config config = configLoader.load(cliArguments);
            LoggingConfigurator.configure(config.logFormat(), config.diagnostics());
            LOGGER.debug("Running in {} mode", config.mode().label());
            return switch (config.mode()) {
                case INJECT -> inject(config);
                case COMPARE -> compare(config);
                case INSPECT -> inspect(config);
                case BATCH -> batch(config);
                case PROOF_SUMMARY -> proofSummary(config);
            };
        } catch (MalformedFragmentListException ex) {
            return invalidInput("Malformed fragments: " + ex.getMessage());
        } catch (SourceParseException ex) {
            return invalidInput("Parse failure: " + ex.getMessage());
        } catch (UncheckedIOException | IllegalArgumentException ex) {
            return invalidInput(ex.getMessage());
        } finally {
            out.flush();
            err.flush();
        }
    }

    private int inject(Config config) {
        String reference = SourceFiles.read(config.reference().orElseThrow());
        String candidate = SourceFiles.read(config.candidate().orElseThrow());
        Object fragments = new FragmentFileReader().read(config.fragments().orElseThrow());

        InjectionResult result = createInjectionService(config).validateAndInject(reference, candidate, fragments);
        if (!result.success()) {
            err.println(result.diagnostic().orElse("Injection failed"));
            return EXIT_FAILED;
        }
        String annotated = result.annotatedText().orElseThrow();
        if (config.output().isPresent()) {
            Path written = new AnnotatedSourceWriter().write(config.output().get(), annotated);
            LOGGER.info("Wrote annotated source to {}", written);
        } else {
            out.println(annotated);
        }
        return EXIT_OK;
    }

    private int compare(Config config) {
        StructureExtractor extractor = new StructureExtractor();
        CodeStructure reference = extractor.extract(SourceFiles.read(config.reference().orElseThrow()));
        CodeStructure candidate = extractor.extract(SourceFiles.read(config.candidate().orElseThrow()));
        ComparisonResult result = new StructureComparator().compare(reference, candidate);
        out.print(new StructureReport().renderComparison(reference, candidate, result));
        return result.matches() ? EXIT_OK : EXIT_FAILED;
    }

    private int inspect(Config config) {
        CodeStructure structure = new StructureExtractor().extract(SourceFiles.read(config.reference().orElseThrow()));
        out.print(new StructureReport().render(structure));
        return EXIT_OK;
    }

    private int batch(Config config) {
        List<BatchJob> jobs = new BatchManifestReader().read(config.manifest().orElseThrow());
        BatchOutcome outcome = new BatchInjectionService(createInjectionService(config), config.workers()).run(jobs);
        Path outputDirectory = config.output().orElseThrow();
        AnnotatedSourceWriter writer = new AnnotatedSourceWriter();
        for (BatchResult result : outcome.results()) {
            if (result.success()) {
                Path written = writer.writeJob(outputDirectory, result.jobId(), result.result().annotatedText().orElseThrow());
                out.println("ok " + result.jobId() + " -> " + written);
            } else {
                out.println("failed " + result.jobId() + ": " + result.result().diagnostic().orElse(""));
            }
        }
        out.println(outcome.succeededJobs() + "/" + outcome.results().size() + " jobs succeeded");
        return outcome.allSucceeded() ? EXIT_OK : EXIT_FAILED;
    }

    private int proofSummary(Config config) {
        ProofSummary summary = new ProofOutputParser().parse(SourceFiles.read(config.verifierLog().orElseThrow()));
        if (summary.hasGoalCounts()) {
            out.println(String.format(Locale.ROOT, "Proved goals: %d / %d (%.1f%%)",
                    summary.provedGoals().getAsInt(), summary.totalGoals().getAsInt(), summary.ratio() * 100));
        } else {
            out.println("No goal summary found");
        }
        summary.failedGoals().forEach(goal -> out.println("not proved: " + goal));
        summary.warnings().forEach(warning -> out.println("warning: " + warning));
        out.println(summary.fullyProved() ? "Fully proved" : "Not fully proved");
        return summary.fullyProved() ? EXIT_OK : EXIT_FAILED;
    }

    private SpecInjectionService createInjectionService(Config config) {
        return new SpecInjectionService(new StructureExtractor(), new StructureComparator(), new InjectionPlanner(),
                new TextSplicer(config.includePattern()), config.diagnostics());
    }

    private int invalidInput(String message) {
        LOGGER.error(message);
        err.println(message);
        return EXIT_INVALID_INPUT;
    }
}
