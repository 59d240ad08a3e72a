package ai.acsl.injector.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes annotated sources to disk, creating parent directories as needed.
 */
public class AnnotatedSourceWriter {

    private static final String EXTENSION = ".c";

    public Path write(Path target, String annotatedText) {
        if (target == null || annotatedText == null) {
            throw new IllegalArgumentException("target and annotatedText must be provided");
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, annotatedText, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            return target;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write annotated source: " + target, ex);
        }
    }

    /**
     * Writes the output of a batch job as {@code <directory>/<job id>.c}; characters outside
     * {@code [A-Za-z0-9._-]} in the id become underscores.
     */
    public Path writeJob(Path directory, String jobId, String annotatedText) {
        if (directory == null || jobId == null) {
            throw new IllegalArgumentException("directory and jobId must be provided");
        }
        return write(directory.resolve(fileNameFor(jobId)), annotatedText);
    }

    static String fileNameFor(String jobId) {
        return jobId.replaceAll("[^A-Za-z0-9._-]", "_") + EXTENSION;
    }
}
