package ai.acsl.injector.io;

import ai.acsl.injector.batch.BatchJob;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads batch jobs from a JSON manifest of
 * {@code {"id": ..., "reference": ..., "candidate": ..., "fragments": ...}} entries. Relative paths resolve
 * against the manifest's directory.
 */
public class BatchManifestReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchManifestReader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final FragmentFileReader fragmentReader;

    public BatchManifestReader() {
        this(new FragmentFileReader());
    }

    public BatchManifestReader(FragmentFileReader fragmentReader) {
        this.fragmentReader = Objects.requireNonNull(fragmentReader, "fragmentReader");
    }

    public List<BatchJob> read(Path manifest) {
        if (manifest == null) {
            throw new IllegalArgumentException("manifest must be provided");
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(Files.readString(manifest, StandardCharsets.UTF_8));
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Manifest is not valid JSON: " + manifest, ex);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read manifest: " + manifest, ex);
        }
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("Manifest must be a JSON array of jobs: " + manifest);
        }

        Path baseDirectory = manifest.toAbsolutePath().getParent();
        List<BatchJob> jobs = new ArrayList<>(root.size());
        Set<String> seenIds = new HashSet<>();
        for (int i = 0; i < root.size(); i++) {
            JsonNode entry = root.get(i);
            if (!entry.isObject()) {
                throw new IllegalArgumentException("Manifest entry " + i + " must be an object");
            }
            String id = requireText(entry, "id", i);
            if (!seenIds.add(id)) {
                throw new IllegalArgumentException("Duplicate job id in manifest: " + id);
            }
            Path reference = resolve(baseDirectory, requireText(entry, "reference", i));
            Path candidate = resolve(baseDirectory, requireText(entry, "candidate", i));
            Path fragments = resolve(baseDirectory, requireText(entry, "fragments", i));
            jobs.add(new BatchJob(id, SourceFiles.read(reference), SourceFiles.read(candidate), fragmentReader.read(fragments)));
        }
        LOGGER.info("Loaded {} jobs from {}", jobs.size(), manifest);
        return jobs;
    }

    private static String requireText(JsonNode entry, String field, int index) {
        JsonNode value = entry.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new IllegalArgumentException("Manifest entry " + index + " is missing \"" + field + "\"");
        }
        return value.asText();
    }

    private static Path resolve(Path baseDirectory, String raw) {
        Path path = Path.of(raw);
        if (path.isAbsolute() || baseDirectory == null) {
            return path;
        }
        return baseDirectory.resolve(path).normalize();
    }
}
