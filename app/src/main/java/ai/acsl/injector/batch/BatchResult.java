package ai.acsl.injector.batch;

import ai.acsl.injector.pipeline.InjectionResult;
import java.util.Objects;

/**
 * Result of a single batch job.
 */
public record BatchResult(String jobId, InjectionResult result) {

    public BatchResult {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(result, "result");
    }

    public boolean success() {
        return result.success();
    }
}
