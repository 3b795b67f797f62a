package com.clipforge.trigger.application.command;

import com.clipforge.domain.budget.service.BudgetLedgerDomainService;
import com.clipforge.domain.channel.adapter.repository.ICampaignRepository;
import com.clipforge.domain.channel.adapter.repository.IChannelRepository;
import com.clipforge.domain.channel.model.entity.CampaignEntity;
import com.clipforge.domain.channel.model.entity.ChannelEntity;
import com.clipforge.domain.channel.service.UploadCadenceDomainService;
import com.clipforge.domain.production.model.entity.ProductionJobEntity;
import com.clipforge.trigger.application.common.ProductionJobRegistry;
import com.clipforge.types.common.Constants;
import com.clipforge.types.enums.CampaignStatusEnum;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 调度 tick 用例：扫描活动中的 campaign 与渠道，为到期且预算内的渠道派发生产任务。
 * <p>
 * 只做决策，不等待流水线完成。单个渠道评估失败只计数并跳过；
 * 加载 campaign 列表失败则整个 tick 放弃，由下一个周期重试。
 * </p>
 */
@Slf4j
@Service
public class ProductionDispatchApplicationService {

    private static final String DISPATCH_COUNTER = "clipforge.scheduler.dispatch.total";

    private final ICampaignRepository campaignRepository;
    private final IChannelRepository channelRepository;
    private final UploadCadenceDomainService uploadCadenceDomainService;
    private final BudgetLedgerDomainService budgetLedgerDomainService;
    private final BudgetHousekeepingApplicationService budgetHousekeepingApplicationService;
    private final ProductionJobRegistry productionJobRegistry;
    private final ProductionPipelineApplicationService productionPipelineApplicationService;
    private final Executor productionWorkerExecutor;
    private final BigDecimal costPerVideo;

    public ProductionDispatchApplicationService(ICampaignRepository campaignRepository,
                                                IChannelRepository channelRepository,
                                                UploadCadenceDomainService uploadCadenceDomainService,
                                                BudgetLedgerDomainService budgetLedgerDomainService,
                                                BudgetHousekeepingApplicationService budgetHousekeepingApplicationService,
                                                ProductionJobRegistry productionJobRegistry,
                                                ProductionPipelineApplicationService productionPipelineApplicationService,
                                                @Qualifier("productionWorkerExecutor") Executor productionWorkerExecutor,
                                                @Value("${clipforge.production.cost-per-video:0.32}") BigDecimal costPerVideo) {
        this.campaignRepository = campaignRepository;
        this.channelRepository = channelRepository;
        this.uploadCadenceDomainService = uploadCadenceDomainService;
        this.budgetLedgerDomainService = budgetLedgerDomainService;
        this.budgetHousekeepingApplicationService = budgetHousekeepingApplicationService;
        this.productionJobRegistry = productionJobRegistry;
        this.productionPipelineApplicationService = productionPipelineApplicationService;
        this.productionWorkerExecutor = productionWorkerExecutor;
        this.costPerVideo = costPerVideo == null || costPerVideo.signum() <= 0
                ? Constants.DEFAULT_COST_PER_VIDEO
                : costPerVideo;
    }

    public TickResult runTick(LocalDateTime now) {
        BudgetHousekeepingApplicationService.HousekeepingResult housekeeping =
                budgetHousekeepingApplicationService.runIfDue(now);
        int cancelledCount = reconcileInFlight();

        List<CampaignEntity> campaigns = campaignRepository.findByStatus(CampaignStatusEnum.ACTIVE);
        TickCounter counter = new TickCounter();
        if (campaigns != null) {
            for (CampaignEntity campaign : campaigns) {
                if (campaign == null || campaign.getId() == null) {
                    continue;
                }
                counter.campaignCount++;
                evaluateCampaign(campaign, now, counter);
            }
        }

        TickResult result = new TickResult(now,
                housekeeping.dailyResetApplied(),
                housekeeping.monthlyResetApplied(),
                counter.campaignCount,
                counter.campaignOverBudgetCount,
                counter.channelCount,
                counter.dispatchedCount,
                counter.notDueCount,
                counter.budgetSkippedCount,
                counter.inFlightSkippedCount,
                counter.misconfiguredCount,
                counter.rejectedCount,
                counter.errorCount,
                cancelledCount);
        log.info("Scheduler tick finished. campaigns={}, channels={}, dispatched={}, notDue={}, budgetSkipped={}, inFlight={}, misconfigured={}, rejected={}, errors={}, cancelled={}",
                result.campaignCount(), result.channelCount(), result.dispatchedCount(), result.notDueCount(),
                result.budgetSkippedCount(), result.inFlightSkippedCount(), result.misconfiguredCount(),
                result.rejectedCount(), result.errorCount(), result.cancelledCount());
        return result;
    }

    private void evaluateCampaign(CampaignEntity campaign, LocalDateTime now, TickCounter counter) {
        if (!budgetLedgerDomainService.checkCampaignBudget(campaign, costPerVideo)) {
            counter.campaignOverBudgetCount++;
            recordDispatch("campaign_over_budget");
            log.info("Campaign over monthly budget, skipping its channels. campaignId={}, spent={}, cap={}",
                    campaign.getId(), campaign.monthlySpentOrZero(), campaign.effectiveMonthlyBudget());
            return;
        }
        List<ChannelEntity> channels;
        try {
            channels = channelRepository.findByCampaignId(campaign.getId());
        } catch (Exception ex) {
            counter.errorCount++;
            log.warn("Failed to load channels. campaignId={}, error={}", campaign.getId(), ex.getMessage());
            return;
        }
        if (channels == null) {
            return;
        }
        for (ChannelEntity channel : channels) {
            if (channel == null) {
                continue;
            }
            counter.channelCount++;
            try {
                DispatchDecision decision = evaluateChannel(channel, now);
                counter.record(decision);
                recordDispatch(decision.name().toLowerCase(Locale.ROOT));
            } catch (Exception ex) {
                counter.errorCount++;
                recordDispatch("error");
                log.warn("Failed to evaluate channel. channelId={}, error={}", channel.getId(), ex.getMessage());
            }
        }
    }

    private DispatchDecision evaluateChannel(ChannelEntity channel, LocalDateTime now) {
        if (!channel.isActive()) {
            return DispatchDecision.NOT_DUE;
        }
        if (productionJobRegistry.isInFlight(channel.getId())) {
            return DispatchDecision.IN_FLIGHT;
        }
        if (!uploadCadenceDomainService.isDue(channel, now)) {
            return DispatchDecision.NOT_DUE;
        }
        if (channel.getProductId() == null || channel.getPlatform() == null) {
            log.warn("Channel is misconfigured, skipping. channelId={}, productId={}, platform={}",
                    channel.getId(), channel.getProductId(), channel.getPlatform());
            return DispatchDecision.MISCONFIGURED;
        }
        if (!budgetLedgerDomainService.checkDailyBudget(channel, costPerVideo)) {
            log.info("Channel over daily budget, skipping. channelId={}, spent={}, limit={}",
                    channel.getId(), channel.dailyCostOrZero(), channel.getDailySpendLimit());
            return DispatchDecision.BUDGET_SKIPPED;
        }

        ProductionJobEntity job = ProductionJobEntity.create(channel.getId(), channel.getCampaignId(),
                channel.getProductId(), channel.getPlatform(), now);
        if (!productionJobRegistry.tryClaim(job)) {
            return DispatchDecision.IN_FLIGHT;
        }
        try {
            productionWorkerExecutor.execute(() -> productionPipelineApplicationService.execute(job));
        } catch (RejectedExecutionException ex) {
            productionJobRegistry.release(job);
            log.warn("Worker pool full, dispatch deferred to next tick. channelId={}, error={}",
                    channel.getId(), ex.getMessage());
            return DispatchDecision.REJECTED;
        }
        log.info("Production job dispatched. channelId={}, jobId={}", channel.getId(), job.getJobId());
        return DispatchDecision.DISPATCHED;
    }

    /**
     * 渠道已不存在或不再 active 的在途任务请求取消。
     */
    private int reconcileInFlight() {
        Collection<ProductionJobEntity> inFlight = productionJobRegistry.snapshot();
        if (inFlight.isEmpty()) {
            return 0;
        }
        List<Long> channelIds = new ArrayList<>(inFlight.size());
        for (ProductionJobEntity job : inFlight) {
            channelIds.add(job.getChannelId());
        }
        Map<Long, ChannelEntity> channels = new HashMap<>();
        try {
            List<ChannelEntity> loaded = channelRepository.findByIds(channelIds);
            if (loaded != null) {
                for (ChannelEntity channel : loaded) {
                    channels.put(channel.getId(), channel);
                }
            }
        } catch (Exception ex) {
            log.warn("Failed to reconcile in-flight jobs. count={}, error={}", channelIds.size(), ex.getMessage());
            return 0;
        }
        int cancelled = 0;
        for (ProductionJobEntity job : inFlight) {
            ChannelEntity channel = channels.get(job.getChannelId());
            if ((channel == null || !channel.isActive()) && !job.isCancelRequested()) {
                job.requestCancel();
                cancelled++;
                log.info("In-flight job cancelled, channel no longer active. channelId={}, jobId={}",
                        job.getChannelId(), job.getJobId());
            }
        }
        return cancelled;
    }

    private void recordDispatch(String result) {
        Counter.builder(DISPATCH_COUNTER).tag("result", result).register(Metrics.globalRegistry).increment();
    }

    private enum DispatchDecision {
        DISPATCHED,
        NOT_DUE,
        BUDGET_SKIPPED,
        IN_FLIGHT,
        MISCONFIGURED,
        REJECTED
    }

    private static final class TickCounter {
        private int campaignCount;
        private int campaignOverBudgetCount;
        private int channelCount;
        private int dispatchedCount;
        private int notDueCount;
        private int budgetSkippedCount;
        private int inFlightSkippedCount;
        private int misconfiguredCount;
        private int rejectedCount;
        private int errorCount;

        private void record(DispatchDecision decision) {
            switch (decision) {
                case DISPATCHED -> dispatchedCount++;
                case NOT_DUE -> notDueCount++;
                case BUDGET_SKIPPED -> budgetSkippedCount++;
                case IN_FLIGHT -> inFlightSkippedCount++;
                case MISCONFIGURED -> misconfiguredCount++;
                case REJECTED -> rejectedCount++;
                default -> errorCount++;
            }
        }
    }

    public record TickResult(LocalDateTime tickTime,
                             boolean dailyResetApplied,
                             boolean monthlyResetApplied,
                             int campaignCount,
                             int campaignOverBudgetCount,
                             int channelCount,
                             int dispatchedCount,
                             int notDueCount,
                             int budgetSkippedCount,
                             int inFlightSkippedCount,
                             int misconfiguredCount,
                             int rejectedCount,
                             int errorCount,
                             int cancelledCount) {
    }
}
