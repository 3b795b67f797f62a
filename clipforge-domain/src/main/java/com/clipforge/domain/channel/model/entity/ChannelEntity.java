package com.clipforge.domain.channel.model.entity;

import com.clipforge.domain.channel.model.valobj.PersonaProfile;
import com.clipforge.types.common.Constants;
import com.clipforge.types.enums.ChannelStatusEnum;
import com.clipforge.types.enums.PlatformEnum;
import com.clipforge.types.enums.UploadFrequencyEnum;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Map;

/**
 * 渠道实体。
 * <p>
 * 一个渠道对应一个社交平台账号及其内容节奏、日预算与发布凭证。
 * 所有时间字段均为 UTC。
 * </p>
 *
 * @author clipforge
 * @since 2026-03-02
 */
@Data
public class ChannelEntity {

    private Long id;

    /**
     * 所属活动 ID
     */
    private Long campaignId;

    /**
     * 绑定产品 ID
     */
    private Long productId;

    private String name;

    private PlatformEnum platform;

    private ChannelStatusEnum status;

    /**
     * 每日产出数量，设置后优先于上传频率
     */
    private Integer videosPerDay;

    private UploadFrequencyEnum uploadFrequency;

    private LocalDateTime lastUploadTime;

    private BigDecimal dailyProductionCost;

    private BigDecimal totalProductionCost;

    /**
     * 日预算上限，小于等于 0 表示不限
     */
    private BigDecimal dailySpendLimit;

    private Integer videosProduced;

    private Integer totalVideosProduced;

    private String latestVideoUrl;

    /**
     * 最近一次日成本重置对应的 UTC 日期
     */
    private LocalDate costResetDate;

    private PersonaProfile persona;

    /**
     * 发布凭证（不透明键值）
     */
    private Map<String, String> credentials;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public boolean isActive() {
        return status == ChannelStatusEnum.ACTIVE;
    }

    public boolean hasReusablePersona() {
        return persona != null && persona.isComplete();
    }

    public boolean hasPublishCredentials() {
        return StringUtils.isNotBlank(credential(Constants.CREDENTIAL_ACCESS_TOKEN));
    }

    public String credential(String key) {
        if (credentials == null || key == null) {
            return null;
        }
        return credentials.get(key);
    }

    public Map<String, String> credentialsView() {
        return credentials == null ? Collections.emptyMap() : Collections.unmodifiableMap(credentials);
    }

    public BigDecimal dailyCostOrZero() {
        return dailyProductionCost == null ? BigDecimal.ZERO : dailyProductionCost;
    }

    public boolean hasDailySpendLimit() {
        return dailySpendLimit != null && dailySpendLimit.signum() > 0;
    }

    /**
     * 停用渠道。已停用时重复调用无副作用。
     */
    public void disable() {
        this.status = ChannelStatusEnum.DISABLED;
    }

    public void validate() {
        if (id == null) {
            throw new IllegalStateException("Channel ID cannot be null");
        }
        if (platform == null) {
            throw new IllegalStateException("Channel platform cannot be null");
        }
        if (status == null) {
            throw new IllegalStateException("Channel status cannot be null");
        }
    }
}
