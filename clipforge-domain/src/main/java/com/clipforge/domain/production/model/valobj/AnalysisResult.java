package com.clipforge.domain.production.model.valobj;

import com.clipforge.types.exception.ContractValidationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * 产品分析结果，缓存于产品上。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResult {

    private List<String> benefits;

    private String targetAudience;

    private List<String> painPoints;

    private List<String> keyFeatures;

    /**
     * 推荐语气
     */
    private String tone;

    /**
     * 边界校验：至少一个卖点且目标人群非空。
     */
    public void validate() {
        if (benefits == null || benefits.stream().noneMatch(StringUtils::isNotBlank)) {
            throw new ContractValidationException("Analysis must contain at least one benefit");
        }
        if (StringUtils.isBlank(targetAudience)) {
            throw new ContractValidationException("Analysis must contain a target audience");
        }
    }

    public String primaryBenefit() {
        if (benefits == null) {
            return null;
        }
        return benefits.stream().filter(StringUtils::isNotBlank).findFirst().orElse(null);
    }
}
