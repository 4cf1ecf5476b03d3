/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.parcelgeo.enricher.batch;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a {@link BatchJob} over an input iterator into a {@link BatchSink}: items an earlier
 * run already wrote are skipped, complete items are passed through, everything else is
 * processed, and results are written as they finish so a crash after item N leaves items
 * 1..N in the sink.
 *
 * <p>With more than one worker, items are processed on a fixed pool while the calling
 * thread stays the only writer and writes in input order. At most
 * {@code workers * windowSize} items are in flight.
 */
@Slf4j
public class ResumableBatchDriver {

    private final int workers;
    private final int windowSize;

    public ResumableBatchDriver(int workers, int windowSize) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1");
        }
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be at least 1");
        }
        this.workers = workers;
        this.windowSize = windowSize;
    }

    public static ResumableBatchDriver sequential() {
        return new ResumableBatchDriver(1, 1);
    }

    /**
     * @param limit maximum number of items to write in this run; zero or less for no limit
     */
    public <T> BatchSummary run(Iterator<T> input, BatchJob<T> job, BatchSink<T> sink, int limit) throws IOException {
        Counters counters = new Counters();
        ExecutorService executor = workers > 1 ? Executors.newFixedThreadPool(workers, workerThreads()) : null;
        Deque<Pending<T>> pending = new ArrayDeque<>();
        int maxInFlight = workers * windowSize;
        int accepted = 0;
        boolean limitReached = false;

        try {
            while (input.hasNext()) {
                if (limit > 0 && accepted >= limit) {
                    limitReached = true;
                    break;
                }
                T item = input.next();
                counters.read++;

                if (job.isAlreadyWritten(item)) {
                    counters.alreadyWritten++;
                    continue;
                }
                accepted++;

                if (job.isComplete(item)) {
                    counters.passedThrough++;
                    pending.addLast(new Pending<>(item, CompletableFuture.completedFuture(item), true));
                } else if (executor == null) {
                    pending.addLast(new Pending<>(item, processNow(job, item), false));
                } else {
                    pending.addLast(new Pending<>(item, executor.submit(() -> job.process(item)), false));
                }

                while (pending.size() >= maxInFlight || (executor == null && !pending.isEmpty())) {
                    writeNext(pending, job, sink, counters);
                }
            }

            while (!pending.isEmpty()) {
                writeNext(pending, job, sink, counters);
            }
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
        }

        BatchSummary summary = new BatchSummary(counters.read, counters.alreadyWritten, counters.passedThrough,
                counters.processed, counters.failed, counters.written, limitReached);
        log.debug("Batch finished: {}", summary);
        return summary;
    }

    private static <T> Future<T> processNow(BatchJob<T> job, T item) {
        try {
            return CompletableFuture.completedFuture(job.process(item));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private <T> void writeNext(Deque<Pending<T>> pending, BatchJob<T> job, BatchSink<T> sink,
                               Counters counters) throws IOException {
        Pending<T> next = pending.removeFirst();
        T result;
        try {
            result = next.result().get();
            if (!next.passThrough()) {
                counters.processed++;
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            Exception failure = cause instanceof Exception ex ? ex : new RuntimeException(cause);
            log.error("Processing failed for {}: {}", next.item(), failure.getMessage(), failure);
            counters.processed++;
            counters.failed++;
            result = job.onFailure(next.item(), failure);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for batch item");
        }
        sink.write(result);
        counters.written++;
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "batch-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record Pending<T>(T item, Future<T> result, boolean passThrough) {}

    private static final class Counters {
        private int read;
        private int alreadyWritten;
        private int passedThrough;
        private int processed;
        private int failed;
        private int written;
    }
}
