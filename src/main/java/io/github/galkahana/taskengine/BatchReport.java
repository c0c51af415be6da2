package io.github.galkahana.taskengine;

import java.time.Duration;
import java.util.List;

/**
 * Everything {@link BatchCoordinator#run} learned about a batch.
 *
 * @param results One result per submitted task, index-aligned with the task list
 * @param outcome Batch-level end state
 * @param summary Result counts by status
 * @param elapsed Wall time from dispatch of the first item until the last result was recorded
 */
public record BatchReport<T>(List<TaskResult<T>> results, BatchOutcome outcome,
                             ResultAggregator.Summary summary, Duration elapsed) {

    public TaskResult<T> get(int index) {
        return results.get(index);
    }

    public int size() {
        return results.size();
    }

    public boolean allSucceeded() {
        return summary.succeeded() == results.size();
    }

    /**
     * @return Values of the successful results, in submission order
     */
    public List<T> successfulValues() {
        return results.stream()
                .filter(TaskResult::isSuccess)
                .map(TaskResult::value)
                .toList();
    }
}
