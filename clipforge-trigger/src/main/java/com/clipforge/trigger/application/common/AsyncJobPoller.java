package com.clipforge.trigger.application.common;

import com.clipforge.domain.production.model.valobj.JobHandle;
import com.clipforge.domain.production.model.valobj.JobPollResult;
import com.clipforge.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

/**
 * 异步任务轮询器：按固定间隔在共享的调度线程上轮询，不占用调用方线程。
 * <p>
 * 每次 {@link #poll} 创建独立会话，会话之间无共享可变状态。
 * 会话在以下情况结束：后端返回 success/fail，超出墙钟预算（TIMEOUT），
 * 取消令牌为真或返回的 future 被取消（CANCELLED），
 * 连续瞬时错误达到上限（FAILED）。
 * </p>
 */
@Slf4j
@Component
public class AsyncJobPoller {

    private final ScheduledExecutorService scheduler;
    private final long intervalMs;
    private final long wallClockBudgetMs;
    private final int maxConsecutiveErrors;
    private final long backoffMaxMs;

    @Autowired
    public AsyncJobPoller(@Qualifier("jobPollScheduler") ScheduledExecutorService scheduler,
                          @Value("${clipforge.poller.interval-ms:10000}") long intervalMs,
                          @Value("${clipforge.poller.wall-clock-budget-ms:1200000}") long wallClockBudgetMs,
                          @Value("${clipforge.poller.max-consecutive-errors:5}") int maxConsecutiveErrors,
                          @Value("${clipforge.poller.backoff-max-ms:60000}") long backoffMaxMs) {
        this.scheduler = scheduler;
        this.intervalMs = Math.max(intervalMs, 1L);
        this.wallClockBudgetMs = Math.max(wallClockBudgetMs, this.intervalMs);
        this.maxConsecutiveErrors = Math.max(maxConsecutiveErrors, 1);
        this.backoffMaxMs = Math.max(backoffMaxMs, this.intervalMs);
    }

    public CompletableFuture<PollOutcome> poll(JobHandle handle,
                                               Function<JobHandle, JobPollResult> pollFunction,
                                               BooleanSupplier cancellationToken) {
        if (handle == null || pollFunction == null) {
            throw new IllegalArgumentException("handle and pollFunction are required");
        }
        PollSession session = new PollSession(handle, pollFunction,
                cancellationToken == null ? () -> false : cancellationToken);
        session.scheduleNext(intervalMs);
        return session.future;
    }

    public long getWallClockBudgetMs() {
        return wallClockBudgetMs;
    }

    private static boolean isRetryable(RuntimeException ex) {
        return ex instanceof AppException appException && appException.isRetryable();
    }

    long backoffDelay(int consecutiveErrors) {
        long delay = intervalMs;
        for (int i = 1; i < consecutiveErrors && delay < backoffMaxMs; i++) {
            delay = delay * 2;
        }
        return Math.min(delay, backoffMaxMs);
    }

    private final class PollSession implements Runnable {

        private final JobHandle handle;
        private final Function<JobHandle, JobPollResult> pollFunction;
        private final BooleanSupplier cancellationToken;
        private final CompletableFuture<PollOutcome> future = new CompletableFuture<>();
        private final long startNanos = System.nanoTime();
        private volatile ScheduledFuture<?> pending;
        private int pollCount;
        private int consecutiveErrors;

        private PollSession(JobHandle handle,
                            Function<JobHandle, JobPollResult> pollFunction,
                            BooleanSupplier cancellationToken) {
            this.handle = handle;
            this.pollFunction = pollFunction;
            this.cancellationToken = cancellationToken;
            future.whenComplete((outcome, error) -> {
                ScheduledFuture<?> scheduled = pending;
                if (scheduled != null) {
                    scheduled.cancel(false);
                }
            });
        }

        @Override
        public void run() {
            if (future.isDone()) {
                return;
            }
            if (cancellationToken.getAsBoolean()) {
                complete(PollOutcome.cancelled(pollCount));
                return;
            }
            if (elapsedMs() >= wallClockBudgetMs) {
                complete(PollOutcome.timeout(pollCount, "Polling exceeded " + wallClockBudgetMs + " ms"));
                return;
            }

            JobPollResult result;
            try {
                pollCount++;
                result = pollFunction.apply(handle);
            } catch (RuntimeException ex) {
                if (!isRetryable(ex)) {
                    complete(PollOutcome.failed(pollCount, "Poll failed: " + ex.getMessage()));
                    return;
                }
                consecutiveErrors++;
                if (consecutiveErrors >= maxConsecutiveErrors) {
                    complete(PollOutcome.failed(pollCount,
                            "Giving up after " + consecutiveErrors + " consecutive transient errors: " + ex.getMessage()));
                    return;
                }
                long delay = backoffDelay(consecutiveErrors);
                log.warn("Transient poll error, backing off. externalId={}, consecutiveErrors={}, delayMs={}, error={}",
                        handle.externalId(), consecutiveErrors, delay, ex.getMessage());
                scheduleNext(delay);
                return;
            }

            consecutiveErrors = 0;
            if (result == null) {
                complete(PollOutcome.failed(pollCount, "Poll returned no result"));
                return;
            }
            switch (result.state()) {
                case SUCCESS -> complete(PollOutcome.succeeded(pollCount, result.resultUrl()));
                case FAIL -> complete(PollOutcome.failed(pollCount, result.error()));
                default -> scheduleNext(intervalMs);
            }
        }

        private void scheduleNext(long delayMs) {
            long remaining = wallClockBudgetMs - elapsedMs();
            long delay = Math.max(0L, Math.min(delayMs, remaining));
            try {
                pending = scheduler.schedule(this, delay, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException ex) {
                complete(PollOutcome.failed(pollCount, "Poll scheduler rejected the session: " + ex.getMessage()));
            }
        }

        private void complete(PollOutcome outcome) {
            if (future.complete(outcome)) {
                log.debug("Poll session finished. externalId={}, status={}, polls={}",
                        handle.externalId(), outcome.status(), outcome.pollCount());
            }
        }

        private long elapsedMs() {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        }
    }

    public enum PollStatus {
        SUCCEEDED,
        FAILED,
        TIMEOUT,
        CANCELLED
    }

    public record PollOutcome(PollStatus status, String resultUrl, String error, int pollCount) {

        public static PollOutcome succeeded(int pollCount, String resultUrl) {
            return new PollOutcome(PollStatus.SUCCEEDED, resultUrl, null, pollCount);
        }

        public static PollOutcome failed(int pollCount, String error) {
            return new PollOutcome(PollStatus.FAILED, null, error, pollCount);
        }

        public static PollOutcome timeout(int pollCount, String error) {
            return new PollOutcome(PollStatus.TIMEOUT, null, error, pollCount);
        }

        public static PollOutcome cancelled(int pollCount) {
            return new PollOutcome(PollStatus.CANCELLED, null, "Cancelled", pollCount);
        }
    }
}
