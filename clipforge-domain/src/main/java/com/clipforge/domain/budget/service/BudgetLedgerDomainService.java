package com.clipforge.domain.budget.service;

import com.clipforge.domain.budget.adapter.repository.IBudgetLedgerRepository;
import com.clipforge.domain.budget.model.valobj.BudgetCommitCommand;
import com.clipforge.domain.budget.model.valobj.BudgetCommitResult;
import com.clipforge.domain.channel.model.entity.CampaignEntity;
import com.clipforge.domain.channel.model.entity.ChannelEntity;
import com.google.common.util.concurrent.Striped;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Lock;

/**
 * 预算账本领域服务。
 * <p>
 * check 系列方法只做快照判断，用于调度前过滤；真正的约束由 {@link #commit} 的条件入账保证。
 * </p>
 */
@Slf4j
@Service
public class BudgetLedgerDomainService {

    private static final int LOCK_STRIPES = 64;

    private final IBudgetLedgerRepository budgetLedgerRepository;
    private final Striped<Lock> commitLocks;

    public BudgetLedgerDomainService(IBudgetLedgerRepository budgetLedgerRepository) {
        this.budgetLedgerRepository = budgetLedgerRepository;
        this.commitLocks = Striped.lock(LOCK_STRIPES);
    }

    public boolean checkDailyBudget(ChannelEntity channel, BigDecimal amount) {
        if (channel == null) {
            return false;
        }
        if (!channel.hasDailySpendLimit()) {
            return true;
        }
        BigDecimal projected = channel.dailyCostOrZero().add(normalize(amount));
        return projected.compareTo(channel.getDailySpendLimit()) <= 0;
    }

    public boolean checkCampaignBudget(CampaignEntity campaign, BigDecimal amount) {
        if (campaign == null) {
            return false;
        }
        BigDecimal cap = campaign.effectiveMonthlyBudget();
        if (cap == null) {
            return true;
        }
        BigDecimal projected = campaign.monthlySpentOrZero().add(normalize(amount));
        return projected.compareTo(cap) <= 0;
    }

    public BudgetCommitResult commit(ChannelEntity channel,
                                     CampaignEntity campaign,
                                     BigDecimal amount,
                                     String artifactUrl,
                                     LocalDateTime committedAt) {
        if (channel == null || channel.getId() == null) {
            throw new IllegalArgumentException("Channel is required for budget commit");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Commit amount must be positive: " + amount);
        }
        BudgetCommitCommand command = BudgetCommitCommand.builder()
                .channelId(channel.getId())
                .campaignId(campaign == null ? channel.getCampaignId() : campaign.getId())
                .amount(amount)
                .campaignMonthlyCap(campaign == null ? null : campaign.effectiveMonthlyBudget())
                .artifactUrl(artifactUrl)
                .committedAt(committedAt)
                .build();

        List<Lock> locks = acquire(command);
        try {
            BudgetCommitResult result = budgetLedgerRepository.commit(command);
            if (result.accepted()) {
                log.info("Budget committed. channelId={}, campaignId={}, amount={}",
                        command.getChannelId(), command.getCampaignId(), amount);
            } else {
                log.warn("Budget commit rejected. channelId={}, campaignId={}, amount={}, reason={}",
                        command.getChannelId(), command.getCampaignId(), amount, result.rejectReason());
            }
            return result;
        } finally {
            release(locks);
        }
    }

    public int resetDaily(LocalDate today) {
        int affected = budgetLedgerRepository.resetDailyCounters(today);
        log.info("Daily production cost reset. date={}, channels={}", today, affected);
        return affected;
    }

    public int resetMonthly(YearMonth month) {
        int affected = budgetLedgerRepository.resetMonthlySpend(month);
        log.info("Monthly campaign spend reset. month={}, campaigns={}", month, affected);
        return affected;
    }

    private List<Lock> acquire(BudgetCommitCommand command) {
        List<Object> keys = new ArrayList<>(2);
        keys.add("channel:" + command.getChannelId());
        if (command.getCampaignId() != null) {
            keys.add("campaign:" + command.getCampaignId());
        }
        List<Lock> locks = new ArrayList<>();
        // bulkGet 返回按条带序排列的锁，固定加锁顺序
        for (Lock lock : commitLocks.bulkGet(keys)) {
            if (!locks.contains(lock)) {
                lock.lock();
                locks.add(lock);
            }
        }
        return locks;
    }

    private void release(List<Lock> locks) {
        for (int i = locks.size() - 1; i >= 0; i--) {
            locks.get(i).unlock();
        }
    }

    private BigDecimal normalize(BigDecimal amount) {
        return amount == null ? BigDecimal.ZERO : amount;
    }
}
