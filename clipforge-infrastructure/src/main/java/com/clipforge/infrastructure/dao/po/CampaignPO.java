package com.clipforge.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 活动 PO
 *
 * @author clipforge
 * @since 2026-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignPO {

    private Long id;

    private String name;

    /**
     * 状态 ('draft', 'active', 'paused', 'completed')
     */
    private String status;

    private BigDecimal monthlyBudget;

    private BigDecimal monthlySpent;

    /**
     * yyyy-MM
     */
    private String spendResetMonth;

    private LocalDateTime lastProductionTime;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
