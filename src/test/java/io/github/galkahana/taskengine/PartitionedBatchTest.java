package io.github.galkahana.taskengine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

public class PartitionedBatchTest {

    private static final int NUM_PARTITIONS = 6;
    private static final int NUM_WORKERS = 4;

    private WorkerPool pool;

    @BeforeEach
    public void setUp() {
        pool = new WorkerPool(NUM_WORKERS);
    }

    @AfterEach
    public void tearDown() throws Exception {
        pool.shutdown(true);
    }

    @Test
    public void testWithAccumulation_ReturnsAggregatedResult() throws Exception {
        // Arrange
        List<String> testData = List.of(
            "The quick brown fox",
            "jumps over the lazy dog",
            "Lorem ipsum dolor sit amet",
            "consectetur adipiscing elit",
            "sed do eiusmod tempor",
            "incididunt ut labore et dolore"
        );
        int expectedLetters = testData.stream()
                .mapToInt(PartitionedBatchTest::countLetters)
                .sum();

        PartitionedBatch<List<String>, Integer> batch = new PartitionedBatch<>(NUM_PARTITIONS);

        // Act
        Integer totalLetters = batch.process(
            pool,
            testData,
            this::countLettersInPartition,
            Integer::sum,
            0,
            CancellationToken.create()
        );

        // Assert
        assertEquals(expectedLetters, totalLetters.intValue());
    }

    @Test
    public void testWithoutAccumulation_ProcessesEachItemOnce() throws Exception {
        // Arrange
        List<Integer> numbers = IntStream.range(0, 20)
            .boxed()
            .collect(Collectors.toList());
        ConcurrentHashMap<Integer, AtomicInteger> processedCounts = new ConcurrentHashMap<>();

        PartitionedBatch<List<Integer>, Void> batch = new PartitionedBatch<>(NUM_PARTITIONS);

        // Act
        batch.process(
            pool,
            numbers,
            partition -> {
                partition.data().stream()
                    .filter(num -> Math.abs(num.hashCode()) % partition.total() == partition.index())
                    .forEach(num -> processedCounts.computeIfAbsent(num, k -> new AtomicInteger(0)).incrementAndGet());
                return null;
            },
            CancellationToken.create()
        );

        // Assert
        for (Integer num : numbers) {
            int count = processedCounts.getOrDefault(num, new AtomicInteger(0)).get();
            assertEquals(1, count, "Number " + num + " should be processed exactly once");
        }
    }

    @Test
    public void testPartitions_ReceiveDistinctIndicesAndSharedData() throws Exception {
        // Arrange
        record Settings(String prefix) {}
        PartitionedBatch<Settings, String> batch = new PartitionedBatch<>(NUM_PARTITIONS);

        // Act
        BatchReport<String> report = batch.run(
            pool,
            new Settings("part"),
            partition -> partition.data().prefix() + "-" + partition.index() + "/" + partition.total(),
            CancellationToken.create()
        );

        // Assert
        for (int i = 0; i < NUM_PARTITIONS; i++) {
            assertEquals("part-" + i + "/" + NUM_PARTITIONS, report.get(i).value());
        }
    }

    @Test
    public void testPersistentFailures_ThrowsWithReport() {
        // Arrange
        PartitionedBatch<List<Integer>, Integer> batch = new PartitionedBatch<>(NUM_PARTITIONS);

        // Act & Assert
        BatchFailedException ex = assertThrows(BatchFailedException.class, () ->
            batch.process(
                pool,
                List.of(1, 2, 3),
                partition -> {
                    if (partition.index() == 2) throw new IllegalStateException("Persistent failure");
                    return partition.index();
                },
                Integer::sum,
                0,
                CancellationToken.create()
            ));

        assertEquals("Persistent failure", ex.getCause().getMessage());
        BatchReport<?> report = ex.getReport();
        assertEquals(NUM_PARTITIONS - 1, report.summary().succeeded());
        assertTrue(report.get(2).isFailure());
    }

    @Test
    public void testTransientFailures_RecoverWithPoolRetries() throws Exception {
        // Arrange
        WorkerPool retryingPool = new WorkerPool(PoolConfig.of(NUM_WORKERS).withRetries(3, Duration.ZERO));
        ConcurrentHashMap<Integer, AtomicInteger> attemptCounts = new ConcurrentHashMap<>();
        PartitionedBatch<List<Integer>, Integer> batch = new PartitionedBatch<>(NUM_PARTITIONS);
        List<Integer> numbers = IntStream.range(0, 10).boxed().toList();

        // Act
        Integer sum;
        try {
            sum = batch.process(
                retryingPool,
                numbers,
                partition -> {
                    int attempt = attemptCounts.computeIfAbsent(partition.index(), k -> new AtomicInteger(0))
                            .incrementAndGet();
                    if (attempt <= 2) throw new RuntimeException("Simulated failure on attempt " + attempt);
                    return partition.data().stream()
                        .filter(num -> num % partition.total() == partition.index())
                        .mapToInt(Integer::intValue)
                        .sum();
                },
                Integer::sum,
                0,
                CancellationToken.create()
            );
        } finally {
            retryingPool.shutdown(true);
        }

        // Assert
        assertEquals(45, sum.intValue(), "Sum should be correct after retries");
        for (int i = 0; i < NUM_PARTITIONS; i++) {
            assertEquals(3, attemptCounts.get(i).get(), "Partition " + i + " should have 3 attempts");
        }
    }

    @Test
    public void testCancelledToken_ThrowsWithoutRunningPartitions() {
        // Arrange
        AtomicInteger invocations = new AtomicInteger(0);
        CancellationToken token = CancellationToken.create();
        token.cancel();
        PartitionedBatch<String, Integer> batch = new PartitionedBatch<>(NUM_PARTITIONS);

        // Act & Assert
        BatchFailedException ex = assertThrows(BatchFailedException.class, () ->
            batch.process(pool, "data", partition -> invocations.incrementAndGet(), Integer::sum, 0, token));
        assertEquals(BatchOutcome.PARTIALLY_CANCELLED, ex.getReport().outcome());
        assertEquals(0, invocations.get());
    }

    @Test
    public void testUsingDifferentPartitionCounts_YieldsSameResults() throws Exception {
        // Arrange
        List<String> testData = List.of(
            "alpha", "beta", "gamma", "delta", "epsilon",
            "zeta", "eta", "theta", "iota", "kappa"
        );

        // Act
        Integer result4Partitions = new PartitionedBatch<List<String>, Integer>(4)
            .process(pool, testData, this::countLettersInPartition, Integer::sum, 0, CancellationToken.create());
        Integer result8Partitions = new PartitionedBatch<List<String>, Integer>(8)
            .process(pool, testData, this::countLettersInPartition, Integer::sum, 0, CancellationToken.create());
        Integer result2Partitions = new PartitionedBatch<List<String>, Integer>(2)
            .process(pool, testData, this::countLettersInPartition, Integer::sum, 0, CancellationToken.create());

        // Assert
        assertEquals(result4Partitions, result8Partitions,
            "Results should be consistent regardless of partition count");
        assertEquals(result4Partitions, result2Partitions,
            "Results should be consistent regardless of partition count");
    }

    @Test
    public void testInvalidPartitionCount_IsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PartitionedBatch<String, String>(0));
    }

    private Integer countLettersInPartition(PartitionedBatch.Partition<List<String>> partition) {
        return partition.data().stream()
            .filter(line -> Math.abs(line.hashCode()) % partition.total() == partition.index())
            .mapToInt(PartitionedBatchTest::countLetters)
            .sum();
    }

    private static int countLetters(String line) {
        return (int) line.chars().filter(Character::isLetter).count();
    }
}
