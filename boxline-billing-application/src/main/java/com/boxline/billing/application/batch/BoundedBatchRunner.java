package com.boxline.billing.application.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Runs independent items in fixed-size batches.
 *
 * Rules:
 * - Items of one batch run in parallel, batches run one after another with a pause in between.
 * - Every item gets a result. A thrown exception or a timeout becomes the item's failure result.
 * - Results keep the input order.
 */
public final class BoundedBatchRunner {

    private static final Logger log = LoggerFactory.getLogger(BoundedBatchRunner.class);

    private final int batchSize;
    private final Duration interBatchDelay;
    private final Duration itemTimeout;

    public BoundedBatchRunner(int batchSize, Duration interBatchDelay, Duration itemTimeout) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        this.batchSize = batchSize;
        this.interBatchDelay = interBatchDelay == null ? Duration.ZERO : interBatchDelay;
        this.itemTimeout = Objects.requireNonNull(itemTimeout, "itemTimeout");
    }

    public <T, R> List<R> run(List<T> items, Function<T, R> task, BiFunction<T, Exception, R> onFailure) {
        List<R> results = new ArrayList<>(items.size());
        if (items.isEmpty()) {
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(batchSize, items.size()), r -> {
            Thread t = new Thread(r, "billing-batch");
            t.setDaemon(true);
            return t;
        });
        try {
            for (int from = 0; from < items.size(); from += batchSize) {
                if (from > 0) {
                    pause();
                }
                List<T> batch = items.subList(from, Math.min(from + batchSize, items.size()));
                List<Future<R>> futures = new ArrayList<>(batch.size());
                for (T item : batch) {
                    futures.add(executor.submit(() -> task.apply(item)));
                }
                for (int i = 0; i < batch.size(); i++) {
                    results.add(await(batch.get(i), futures.get(i), onFailure));
                }
            }
        } finally {
            executor.shutdownNow();
        }
        return results;
    }

    private <T, R> R await(T item, Future<R> future, BiFunction<T, Exception, R> onFailure) {
        try {
            return future.get(itemTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Batch item timed out after {}ms. item={}", itemTimeout.toMillis(), item);
            return onFailure.apply(item, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            return onFailure.apply(item, cause instanceof Exception ? (Exception) cause : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return onFailure.apply(item, e);
        }
    }

    private void pause() {
        if (interBatchDelay.isZero() || interBatchDelay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(interBatchDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
