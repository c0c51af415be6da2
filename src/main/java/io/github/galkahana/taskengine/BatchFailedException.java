package io.github.galkahana.taskengine;

/**
 * Thrown by {@link PartitionedBatch#process} when at least one partition did not succeed.
 * The full {@link BatchReport} is attached so callers can inspect partial results.
 */
public class BatchFailedException extends RuntimeException {

    private final transient BatchReport<?> report;

    public BatchFailedException(BatchReport<?> report) {
        super(describe(report), firstError(report));
        this.report = report;
    }

    public BatchReport<?> getReport() {
        return report;
    }

    private static String describe(BatchReport<?> report) {
        ResultAggregator.Summary summary = report.summary();
        return "Batch " + report.outcome() + ": " + summary.failed() + " failed, " + summary.cancelled()
                + " cancelled out of " + summary.total();
    }

    private static Throwable firstError(BatchReport<?> report) {
        return report.results().stream()
                .filter(TaskResult::isFailure)
                .map(TaskResult::error)
                .findFirst()
                .orElse(null);
    }
}
