package com.clipforge.domain.production.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * 脚本阶段结果：原文、三段台词及其字数，以及违反字数区间的风险标记。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScriptResult {

    private String text;

    /**
     * 三段台词，顺序即分镜顺序
     */
    private List<String> sceneDialogues;

    /**
     * 按分镜顺序的台词词数
     */
    private List<Integer> wordCounts;

    /**
     * 场景标记中解析出的时长，缺失为 null 元素
     */
    private List<BigDecimal> markedDurations;

    /**
     * 风险描述，为空表示完全满足约定
     */
    private List<String> risks;

    public int riskCount() {
        return risks == null ? 0 : risks.size();
    }

    public boolean hasRisks() {
        return riskCount() > 0;
    }
}
