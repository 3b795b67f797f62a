package com.clipforge.domain.budget.model.valobj;

/**
 * 入账结果。
 *
 * @param accepted     是否入账成功
 * @param rejectReason 拒绝原因，成功时为 null
 */
public record BudgetCommitResult(boolean accepted, RejectReason rejectReason) {

    public static BudgetCommitResult accept() {
        return new BudgetCommitResult(true, null);
    }

    public static BudgetCommitResult reject(RejectReason reason) {
        return new BudgetCommitResult(false, reason);
    }

    public enum RejectReason {
        CHANNEL_DAILY_LIMIT,
        CAMPAIGN_MONTHLY_LIMIT,
        CHANNEL_NOT_FOUND
    }
}
