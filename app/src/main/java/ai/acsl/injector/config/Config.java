package ai.acsl.injector.config;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values. Each mode checks
 * that the files it reads were given.
 */
public record Config(
        Mode mode,
        Optional<Path> reference,
        Optional<Path> candidate,
        Optional<Path> fragments,
        Optional<Path> output,
        Optional<Path> manifest,
        Optional<Path> verifierLog,
        int workers,
        boolean diagnostics,
        LogFormat logFormat,
        Pattern includePattern
) {

    public Config {
        Objects.requireNonNull(mode, "mode");
        reference = reference == null ? Optional.empty() : reference;
        candidate = candidate == null ? Optional.empty() : candidate;
        fragments = fragments == null ? Optional.empty() : fragments;
        output = output == null ? Optional.empty() : output;
        manifest = manifest == null ? Optional.empty() : manifest;
        verifierLog = verifierLog == null ? Optional.empty() : verifierLog;
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        Objects.requireNonNull(includePattern, "includePattern");
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1");
        }
        switch (mode) {
            case INJECT -> {
                require(reference, "--reference", mode);
                require(candidate, "--candidate", mode);
                require(fragments, "--fragments", mode);
            }
            case COMPARE -> {
                require(reference, "--reference", mode);
                require(candidate, "--candidate", mode);
            }
            case INSPECT -> require(reference, "--reference", mode);
            case BATCH -> {
                require(manifest, "--manifest", mode);
                require(output, "--output", mode);
            }
            case PROOF_SUMMARY -> require(verifierLog, "--verifier-log", mode);
        }
    }

    private static void require(Optional<Path> value, String option, Mode mode) {
        if (value.isEmpty()) {
            throw new IllegalArgumentException(option + " must be provided in " + mode.label() + " mode");
        }
    }
}
