package ir.ac.sbu.kgwalk.utils;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

/**
 * Utility class for multi-core programming
 */
public class MultiCoreUtils {

    public static final int BATCH_SIZE = 256;

    /**
     * Receives a range [start, end) of indexes to process on the given worker.
     */
    public interface BatchTask {
        void process(int thread, int start, int end);
    }

    /**
     * Splits [0, len) into batches of batchSize and lets threads workers of the pool pick batches
     * until none is left. Returns once every batch is processed. With a single thread the batches
     * run on the caller's thread.
     */
    public static void forEachBatch(ForkJoinPool forkJoinPool, int threads, int len, int batchSize,
                                    BatchTask task) {
        if (threads == 1 || len <= batchSize) {
            for (int start = 0; start < len; start += batchSize)
                task.process(0, start, Math.min(len, start + batchSize));
            return;
        }

        AtomicInteger batchSelector = new AtomicInteger(0);
        try {
            forkJoinPool.submit(() -> IntStream.range(0, threads).parallel().forEach(thread -> {
                while (true) {
                    int start = batchSelector.getAndAdd(batchSize);
                    if (start >= len)
                        break;
                    int end = Math.min(len, batchSize + start);
                    task.process(thread, start, end);
                }
            })).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for batches", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Batch processing failed", e.getCause());
        }
    }
}
