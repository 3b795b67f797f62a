package com.clipforge.domain.production.adapter.gateway;

import com.clipforge.domain.channel.model.entity.ProductEntity;
import com.clipforge.domain.production.model.valobj.AnalysisResult;

/**
 * 产品分析提供方。
 */
public interface IProductAnalysisGateway {

    /**
     * 分析产品卖点与目标人群。返回值已通过边界校验。
     */
    AnalysisResult analyze(ProductEntity product);
}
