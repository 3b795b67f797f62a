package com.clipforge.domain.production.service;

import com.clipforge.domain.production.model.valobj.ScriptResult;
import com.clipforge.types.enums.ScriptSelectionStrategyEnum;
import com.clipforge.types.exception.ContractValidationException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 候选脚本选择：结果只依赖候选顺序与内容，同样输入总是选中同一个候选。
 */
@Service
public class ScriptSelectionDomainService {

    public ScriptResult select(List<ScriptResult> candidates, ScriptSelectionStrategyEnum strategy) {
        if (candidates == null || candidates.isEmpty()) {
            throw new ContractValidationException("No valid script candidate to select from");
        }
        if (strategy != ScriptSelectionStrategyEnum.FEWEST_RISKS) {
            return candidates.get(0);
        }
        ScriptResult selected = candidates.get(0);
        for (ScriptResult candidate : candidates) {
            if (candidate.riskCount() < selected.riskCount()) {
                selected = candidate;
            }
        }
        return selected;
    }
}
