package ai.acsl.injector.batch;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate of a batch run, results in job order.
 */
public record BatchOutcome(List<BatchResult> results, List<String> failedJobs) {

    public BatchOutcome {
        results = List.copyOf(Objects.requireNonNull(results, "results"));
        failedJobs = List.copyOf(Objects.requireNonNull(failedJobs, "failedJobs"));
    }

    public int succeededJobs() {
        return results.size() - failedJobs.size();
    }

    public boolean allSucceeded() {
        return failedJobs.isEmpty();
    }
}
