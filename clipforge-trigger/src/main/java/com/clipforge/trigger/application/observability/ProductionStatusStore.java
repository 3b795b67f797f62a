package com.clipforge.trigger.application.observability;

import com.clipforge.domain.production.model.entity.ProductionJobEntity;
import com.clipforge.types.enums.ProductionOutcomeEnum;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 渠道最近一次生产运行的快照存储，并累计各终态的计数。
 */
@Component
public class ProductionStatusStore {

    private static final String OUTCOME_COUNTER = "clipforge.production.outcome.total";

    private final Map<Long, RunSnapshot> latestRuns = new ConcurrentHashMap<>();

    public void recordStarted(ProductionJobEntity job) {
        if (job == null || job.getChannelId() == null) {
            return;
        }
        latestRuns.compute(job.getChannelId(), (channelId, previous) -> new RunSnapshot(
                job.getStartedAt(),
                previous == null ? null : previous.lastCost(),
                previous == null ? null : previous.lastError(),
                previous == null ? null : previous.lastOutcome(),
                job.getJobId()));
    }

    public void recordFinished(ProductionJobEntity job) {
        if (job == null || job.getChannelId() == null) {
            return;
        }
        ProductionOutcomeEnum outcome = job.getOutcome();
        latestRuns.put(job.getChannelId(), new RunSnapshot(
                job.getStartedAt(),
                job.getCommittedCost() == null ? BigDecimal.ZERO : job.getCommittedCost(),
                job.getErrorMessage(),
                outcome,
                job.getJobId()));
        if (outcome != null) {
            Counter.builder(OUTCOME_COUNTER)
                    .tag("outcome", outcome.getCode())
                    .register(Metrics.globalRegistry)
                    .increment();
        }
    }

    public RunSnapshot find(Long channelId) {
        return channelId == null ? null : latestRuns.get(channelId);
    }

    public Set<Long> trackedChannelIds() {
        return Set.copyOf(latestRuns.keySet());
    }

    /**
     * @param lastRunAt   最近一次运行开始时间
     * @param lastCost    最近一次运行入账成本，失败为 0
     * @param lastError   最近一次运行错误
     * @param lastOutcome 最近一次运行终态，运行中为上一次的终态
     * @param lastJobId   最近一次运行的任务 ID
     */
    public record RunSnapshot(LocalDateTime lastRunAt,
                              BigDecimal lastCost,
                              String lastError,
                              ProductionOutcomeEnum lastOutcome,
                              String lastJobId) {
    }
}
