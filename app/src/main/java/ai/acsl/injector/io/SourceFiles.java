package ai.acsl.injector.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * UTF-8 file reads for source texts and verifier logs.
 */
public final class SourceFiles {

    private SourceFiles() {
    }

    public static String read(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path must be provided");
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read file: " + path, ex);
        }
    }
}
