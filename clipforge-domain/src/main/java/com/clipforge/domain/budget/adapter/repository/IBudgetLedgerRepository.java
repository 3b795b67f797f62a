package com.clipforge.domain.budget.adapter.repository;

import com.clipforge.domain.budget.model.valobj.BudgetCommitCommand;
import com.clipforge.domain.budget.model.valobj.BudgetCommitResult;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * 预算账本仓储接口
 *
 * @author clipforge
 * @since 2026-03-02
 */
public interface IBudgetLedgerRepository {

    /**
     * 原子入账：渠道日成本/累计成本、活动月成本、last_upload_time 与产出计数一并更新。
     * 任一预算条件不满足时整体不生效。
     */
    BudgetCommitResult commit(BudgetCommitCommand command);

    /**
     * 重置日成本与日产出计数，仅作用于重置日期早于 today 的渠道。
     *
     * @return 受影响渠道数
     */
    int resetDailyCounters(LocalDate today);

    /**
     * 重置活动月成本，仅作用于重置月份早于 month 的活动。
     *
     * @return 受影响活动数
     */
    int resetMonthlySpend(YearMonth month);
}
