package com.clipforge.domain.channel.service;

import com.clipforge.domain.channel.model.entity.ChannelEntity;
import com.clipforge.types.enums.UploadFrequencyEnum;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 上传节奏领域服务：计算渠道产出间隔并判定是否到期。
 * <p>
 * videosPerDay 优先于 uploadFrequency；频率缺失或无法识别时按每日一次处理。
 * </p>
 */
@Service
public class UploadCadenceDomainService {

    private static final Duration ONE_DAY = Duration.ofDays(1);

    public Duration requiredInterval(ChannelEntity channel) {
        if (channel == null) {
            return Duration.ofHours(UploadFrequencyEnum.DAILY.getIntervalHours());
        }
        Integer videosPerDay = channel.getVideosPerDay();
        if (videosPerDay != null && videosPerDay > 0) {
            // 按纳秒精度均分，不能整除一天的数量不会被截断到整秒
            return ONE_DAY.dividedBy(videosPerDay);
        }
        UploadFrequencyEnum frequency = channel.getUploadFrequency() == null
                ? UploadFrequencyEnum.DAILY
                : channel.getUploadFrequency();
        return Duration.ofHours(frequency.getIntervalHours());
    }

    public boolean isDue(ChannelEntity channel, LocalDateTime now) {
        if (channel == null || !channel.isActive()) {
            return false;
        }
        LocalDateTime lastUploadTime = channel.getLastUploadTime();
        if (lastUploadTime == null) {
            return true;
        }
        Duration elapsed = Duration.between(lastUploadTime, now);
        return elapsed.compareTo(requiredInterval(channel)) >= 0;
    }

    /**
     * 下一次到期时间；从未产出过的渠道返回 null。
     */
    public LocalDateTime nextDueTime(ChannelEntity channel) {
        if (channel == null || channel.getLastUploadTime() == null) {
            return null;
        }
        return channel.getLastUploadTime().plus(requiredInterval(channel));
    }
}
