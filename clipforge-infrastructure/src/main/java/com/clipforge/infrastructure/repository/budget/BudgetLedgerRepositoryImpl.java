package com.clipforge.infrastructure.repository.budget;

import com.clipforge.domain.budget.adapter.repository.IBudgetLedgerRepository;
import com.clipforge.domain.budget.model.valobj.BudgetCommitCommand;
import com.clipforge.domain.budget.model.valobj.BudgetCommitResult;
import com.clipforge.infrastructure.dao.CampaignDao;
import com.clipforge.infrastructure.dao.ChannelDao;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.interceptor.TransactionAspectSupport;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * 预算账本仓储实现类。
 * <p>
 * 渠道与活动两条条件更新在同一事务内执行；活动月度预算不足时整体回滚，
 * 渠道计数与 last_upload_time 不会单独生效。
 * </p>
 *
 * @author clipforge
 * @since 2026-03-02
 */
@Slf4j
@Repository
public class BudgetLedgerRepositoryImpl implements IBudgetLedgerRepository {

    private final ChannelDao channelDao;
    private final CampaignDao campaignDao;

    public BudgetLedgerRepositoryImpl(ChannelDao channelDao, CampaignDao campaignDao) {
        this.channelDao = channelDao;
        this.campaignDao = campaignDao;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public BudgetCommitResult commit(BudgetCommitCommand command) {
        int channelRows = channelDao.commitProductionCost(command.getChannelId(),
                command.getAmount(),
                command.getArtifactUrl(),
                command.getCommittedAt());
        if (channelRows == 0) {
            if (channelDao.selectById(command.getChannelId()) == null) {
                return BudgetCommitResult.reject(BudgetCommitResult.RejectReason.CHANNEL_NOT_FOUND);
            }
            return BudgetCommitResult.reject(BudgetCommitResult.RejectReason.CHANNEL_DAILY_LIMIT);
        }
        if (command.getCampaignId() == null) {
            return BudgetCommitResult.accept();
        }
        int campaignRows = campaignDao.commitMonthlySpend(command.getCampaignId(),
                command.getAmount(),
                command.getCampaignMonthlyCap(),
                command.getCommittedAt());
        if (campaignRows == 0) {
            TransactionAspectSupport.currentTransactionStatus().setRollbackOnly();
            log.debug("Rollback channel commit because campaign cap is reached. channelId={}, campaignId={}",
                    command.getChannelId(), command.getCampaignId());
            return BudgetCommitResult.reject(BudgetCommitResult.RejectReason.CAMPAIGN_MONTHLY_LIMIT);
        }
        return BudgetCommitResult.accept();
    }

    @Override
    public int resetDailyCounters(LocalDate today) {
        return channelDao.resetDailyCosts(today);
    }

    @Override
    public int resetMonthlySpend(YearMonth month) {
        return campaignDao.resetMonthlySpend(month.toString());
    }
}
