package com.clipforge.domain.production.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 分镜场景。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoryboardScene {

    /**
     * 从 1 开始的场景序号
     */
    private Integer index;

    private String dialogue;

    private BigDecimal durationSeconds;
}
