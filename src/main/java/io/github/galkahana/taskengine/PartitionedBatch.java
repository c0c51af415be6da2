package io.github.galkahana.taskengine;

import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.stream.IntStream;

/**
 * Partition-based map-reduce on top of {@link BatchCoordinator}.
 * <p>
 * Work is split into {@code numPartitions} tasks. Each receives its index, the partition count, the shared data
 * and the cancellation token, and selects the slice of work it owns. The shared data is passed explicitly and
 * typed, so task bodies never reach for global state.
 *
 * <pre>{@code
 * record Lookup(DataSource db, int pageSize) {}
 *
 * PartitionedBatch<Lookup, Long> counting = new PartitionedBatch<>(8);
 * Long total = counting.process(pool, new Lookup(db, 500),
 *     partition -> countRows(partition.data(), partition.index(), partition.total(), partition.token()),
 *     Long::sum, 0L, CancellationToken.create(Duration.ofMinutes(1)));
 * }</pre>
 *
 * @param <D> Shared data type passed to all partitions
 * @param <O> Output type of one partition
 * @param numPartitions Number of partitions to split work into (should be >= the pool size to avoid idle workers)
 */
public record PartitionedBatch<D, O>(int numPartitions) {

    public PartitionedBatch {
        if (numPartitions < 1) throw new IllegalArgumentException("numPartitions must be >= 1, got " + numPartitions);
    }

    /**
     * Information passed to each partition.
     *
     * @param index Zero-based partition index (0 to total-1)
     * @param total Total number of partitions
     * @param data Shared data for all partitions
     * @param token Token governing this partition's execution
     */
    public record Partition<D>(int index, int total, D data, CancellationToken token) {}

    /**
     * Per-partition processing function.
     */
    @FunctionalInterface
    public interface PartitionFunction<D, O> {
        O apply(Partition<D> partition) throws Exception;
    }

    /**
     * Run all partitions as one batch.
     *
     * @return Report with one result per partition, index-aligned with the partition index
     */
    public BatchReport<O> run(WorkerPool pool, D sharedData, PartitionFunction<D, O> processor,
                              CancellationToken token) throws InterruptedException {
        Objects.requireNonNull(processor, "processor");

        List<Task<O>> tasks = IntStream.range(0, numPartitions)
                .mapToObj(i -> partitionTask(i, sharedData, processor))
                .toList();

        return new BatchCoordinator().run(pool, tasks, token);
    }

    /**
     * Run all partitions and fold their outputs in partition order.
     *
     * @param accumulator Function to combine partition results
     * @param initialValue Initial accumulator value
     * @return Accumulated result from all partitions
     * @throws BatchFailedException If any partition failed or was cancelled
     */
    public <A> A process(WorkerPool pool, D sharedData, PartitionFunction<D, O> processor,
                         BiFunction<A, O, A> accumulator, A initialValue,
                         CancellationToken token) throws InterruptedException {
        BatchReport<O> report = run(pool, sharedData, processor, token);
        if (!report.allSucceeded()) throw new BatchFailedException(report);

        A accumulated = initialValue;
        for (TaskResult<O> result : report.results()) {
            accumulated = accumulator.apply(accumulated, result.value());
        }
        return accumulated;
    }

    /**
     * Run all partitions for their side effects only.
     *
     * @throws BatchFailedException If any partition failed or was cancelled
     */
    public void process(WorkerPool pool, D sharedData, PartitionFunction<D, O> processor,
                        CancellationToken token) throws InterruptedException {
        process(pool, sharedData, processor, (a, o) -> null, null, token);
    }

    // Index is bound per task, never read from a shared loop variable
    private Task<O> partitionTask(int index, D sharedData, PartitionFunction<D, O> processor) {
        return token -> processor.apply(new Partition<>(index, numPartitions, sharedData, token));
    }
}
