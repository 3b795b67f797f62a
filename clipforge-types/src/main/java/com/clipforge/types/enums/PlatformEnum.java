package com.clipforge.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * 发布平台枚举。
 * <p>
 * 每个平台携带文案长度上限与默认话题标签。
 * </p>
 *
 * @author clipforge
 * @since 2026-03-02
 */
public enum PlatformEnum {

    TIKTOK("tiktok", 2200, List.of("#fyp", "#tiktokmademebuyit")),

    INSTAGRAM("instagram", 2200, List.of("#reels", "#instagood")),

    YOUTUBE("youtube", 5000, List.of("#shorts"));

    private final String code;
    private final int captionLimit;
    private final List<String> defaultHashtags;

    PlatformEnum(String code, int captionLimit, List<String> defaultHashtags) {
        this.code = code;
        this.captionLimit = captionLimit;
        this.defaultHashtags = defaultHashtags;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getCaptionLimit() {
        return captionLimit;
    }

    public List<String> getDefaultHashtags() {
        return defaultHashtags;
    }

    public static PlatformEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (PlatformEnum platform : PlatformEnum.values()) {
            if (platform.code.equalsIgnoreCase(code)) {
                return platform;
            }
        }
        throw new IllegalArgumentException("Unknown platform code: " + code);
    }
}
