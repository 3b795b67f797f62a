package com.clipforge.domain.channel.model.entity;

import com.clipforge.types.common.Constants;
import com.clipforge.types.enums.CampaignStatusEnum;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 活动实体：渠道的预算与策略分组。
 *
 * @author clipforge
 * @since 2026-03-02
 */
@Data
public class CampaignEntity {

    private Long id;

    private String name;

    private CampaignStatusEnum status;

    /**
     * 月度预算上限；未配置时取默认值，小于等于 0 表示不限
     */
    private BigDecimal monthlyBudget;

    /**
     * 当月已花费
     */
    private BigDecimal monthlySpent;

    /**
     * 最近一次月度重置对应的月份（yyyy-MM）
     */
    private String spendResetMonth;

    private LocalDateTime lastProductionTime;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public boolean isActive() {
        return status == CampaignStatusEnum.ACTIVE;
    }

    /**
     * 生效的月度上限，返回 null 表示不限。
     */
    public BigDecimal effectiveMonthlyBudget() {
        if (monthlyBudget == null) {
            return Constants.DEFAULT_MONTHLY_BUDGET;
        }
        return monthlyBudget.signum() > 0 ? monthlyBudget : null;
    }

    public BigDecimal monthlySpentOrZero() {
        return monthlySpent == null ? BigDecimal.ZERO : monthlySpent;
    }
}
