package com.clipforge.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 上传频率枚举，携带两次产出之间要求的最小间隔（小时）。
 *
 * @author clipforge
 * @since 2026-03-02
 */
public enum UploadFrequencyEnum {

    THREE_TIMES_DAILY("three_times_daily", 8),

    TWICE_DAILY("twice_daily", 12),

    DAILY("daily", 24),

    EVERY_2_DAYS("every_2_days", 48),

    EVERY_3_DAYS("every_3_days", 72),

    WEEKLY("weekly", 168),

    BIWEEKLY("biweekly", 336),

    MONTHLY("monthly", 720);

    private final String code;
    private final int intervalHours;

    UploadFrequencyEnum(String code, int intervalHours) {
        this.code = code;
        this.intervalHours = intervalHours;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getIntervalHours() {
        return intervalHours;
    }

    public static UploadFrequencyEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (UploadFrequencyEnum frequency : UploadFrequencyEnum.values()) {
            if (frequency.code.equalsIgnoreCase(code)) {
                return frequency;
            }
        }
        throw new IllegalArgumentException("Unknown upload frequency code: " + code);
    }

    /**
     * 宽松解析：未知或空值返回 null，由调用方决定回退策略。
     */
    public static UploadFrequencyEnum fromCodeOrNull(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        for (UploadFrequencyEnum frequency : UploadFrequencyEnum.values()) {
            if (frequency.code.equalsIgnoreCase(code.trim())) {
                return frequency;
            }
        }
        return null;
    }
}
