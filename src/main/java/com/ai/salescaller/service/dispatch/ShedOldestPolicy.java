package com.ai.salescaller.service.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Rejection policy of the dispatch pool: when the queue is full the oldest job that has not started
 * is dropped to make room for the new one. After shutdown new jobs are dropped.
 */
public class ShedOldestPolicy implements RejectedExecutionHandler {

    private static final Logger log = LoggerFactory.getLogger(ShedOldestPolicy.class);

    private final AtomicInteger shed = new AtomicInteger();

    @Override
    public void rejectedExecution(Runnable job, ThreadPoolExecutor pool) {
        if (pool.isShutdown()) {
            shed.incrementAndGet();
            log.warn("Dispatch pool is shut down; dropping a job");
            return;
        }
        Runnable oldest = pool.getQueue().poll();
        if (oldest != null) {
            shed.incrementAndGet();
            log.warn("Dispatch queue full ({}), shedding the oldest queued job", pool.getQueue().size() + 1);
        }
        pool.execute(job);
    }

    /** Jobs dropped so far. */
    public int getShedCount() {
        return shed.get();
    }
}
