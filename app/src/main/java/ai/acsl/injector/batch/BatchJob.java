package ai.acsl.injector.batch;

import java.util.Objects;

/**
 * One independent validate-and-inject request. {@code fragments} is the raw sequence as decoded from JSON
 * and is validated when the job runs.
 */
public record BatchJob(String id, String referenceText, String candidateText, Object fragments) {

    public BatchJob {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        Objects.requireNonNull(referenceText, "referenceText");
        Objects.requireNonNull(candidateText, "candidateText");
    }
}
