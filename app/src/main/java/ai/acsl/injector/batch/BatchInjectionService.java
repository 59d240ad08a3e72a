package ai.acsl.injector.batch;

import ai.acsl.injector.inject.MalformedFragmentListException;
import ai.acsl.injector.pipeline.InjectionResult;
import ai.acsl.injector.pipeline.SpecInjectionService;
import ai.acsl.injector.tree.SourceParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs independent jobs through {@link SpecInjectionService} on a fixed worker pool. A failing job never
 * affects the others.
 */
public class BatchInjectionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchInjectionService.class);
    static final String MDC_JOB = "job";

    private final SpecInjectionService injectionService;
    private final int workers;

    public BatchInjectionService(SpecInjectionService injectionService, int workers) {
        this.injectionService = Objects.requireNonNull(injectionService, "injectionService");
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1");
        }
        this.workers = workers;
    }

    public BatchOutcome run(List<BatchJob> jobs) {
        if (jobs == null || jobs.isEmpty()) {
            return new BatchOutcome(List.of(), List.of());
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(workers, jobs.size()), workerFactory());
        try {
            List<Future<BatchResult>> futures = new ArrayList<>(jobs.size());
            for (BatchJob job : jobs) {
                futures.add(executor.submit(() -> runJob(job)));
            }
            List<BatchResult> results = new ArrayList<>(jobs.size());
            List<String> failedJobs = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                BatchResult result = await(jobs.get(i), futures.get(i));
                results.add(result);
                if (!result.success()) {
                    failedJobs.add(result.jobId());
                }
            }
            LOGGER.info("Batch finished: {} succeeded, {} failed", results.size() - failedJobs.size(), failedJobs.size());
            return new BatchOutcome(results, failedJobs);
        } finally {
            executor.shutdownNow();
        }
    }

    private BatchResult runJob(BatchJob job) {
        MDC.put(MDC_JOB, job.id());
        try {
            InjectionResult result = injectionService.validateAndInject(job.referenceText(), job.candidateText(), job.fragments());
            if (result.success()) {
                LOGGER.info("Injected fragments for job {}", job.id());
            } else {
                LOGGER.warn("Job {} rejected: {}", job.id(), result.diagnostic().orElse(""));
            }
            return new BatchResult(job.id(), result);
        } catch (MalformedFragmentListException ex) {
            LOGGER.error("Job {} has malformed fragments: {}", job.id(), ex.getMessage());
            return new BatchResult(job.id(), InjectionResult.failed("Malformed fragments: " + ex.getMessage()));
        } catch (SourceParseException ex) {
            LOGGER.error("Job {} could not be parsed: {}", job.id(), ex.getMessage());
            return new BatchResult(job.id(), InjectionResult.failed("Parse failure: " + ex.getMessage()));
        } finally {
            MDC.remove(MDC_JOB);
        }
    }

    private BatchResult await(BatchJob job, Future<BatchResult> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for job " + job.id(), ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            LOGGER.error("Job {} failed unexpectedly", job.id(), cause);
            return new BatchResult(job.id(), InjectionResult.failed("Unexpected failure: " + cause.getMessage()));
        }
    }

    private static ThreadFactory workerFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "injector-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
