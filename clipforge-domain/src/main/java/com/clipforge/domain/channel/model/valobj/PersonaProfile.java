package com.clipforge.domain.channel.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDateTime;

/**
 * 渠道人设（缓存在渠道上，一经生成不再隐式重建）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersonaProfile {

    /**
     * 人设名称
     */
    private String name;

    /**
     * 年龄
     */
    private Integer age;

    /**
     * 职业
     */
    private String occupation;

    /**
     * 完整人设描述
     */
    private String fullProfile;

    /**
     * 生成时间（UTC）
     */
    private LocalDateTime generatedAt;

    /**
     * 人设版本
     */
    private Integer personaVersion;

    /**
     * 只有同时具备名称和完整描述的人设才可复用。
     */
    public boolean isComplete() {
        return StringUtils.isNotBlank(name) && StringUtils.isNotBlank(fullProfile);
    }
}
