package com.clipforge.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 渠道 PO
 *
 * @author clipforge
 * @since 2026-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChannelPO {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 活动 ID (关联 campaign.id)
     */
    private Long campaignId;

    /**
     * 产品 ID (关联 product.id)
     */
    private Long productId;

    private String name;

    /**
     * 平台 ('tiktok', 'instagram', 'youtube')
     */
    private String platform;

    /**
     * 状态 ('testing', 'active', 'paused', 'disabled')
     */
    private String status;

    private Integer videosPerDay;

    private String uploadFrequency;

    private LocalDateTime lastUploadTime;

    private BigDecimal dailyProductionCost;

    private BigDecimal totalProductionCost;

    private BigDecimal dailySpendLimit;

    private Integer videosProduced;

    private Integer totalVideosProduced;

    private String latestVideoUrl;

    private LocalDate costResetDate;

    /**
     * 人设 (JSONB)
     */
    private String persona;

    /**
     * 发布凭证 (JSONB)
     */
    private String credentials;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
