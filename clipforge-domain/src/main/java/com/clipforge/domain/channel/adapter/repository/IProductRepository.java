package com.clipforge.domain.channel.adapter.repository;

import com.clipforge.domain.channel.model.entity.ProductEntity;
import com.clipforge.domain.production.model.valobj.AnalysisResult;

import java.time.LocalDateTime;

/**
 * 产品仓储接口
 *
 * @author clipforge
 * @since 2026-03-02
 */
public interface IProductRepository {

    /**
     * 根据 ID 查询
     */
    ProductEntity findById(Long id);

    /**
     * 条件写入分析缓存：仅当产品尚无缓存分析时写入。
     */
    boolean saveAnalysisIfAbsent(Long productId, AnalysisResult analysis, LocalDateTime analyzedAt);

    /**
     * 清除分析缓存，下次生产时重新计算。
     */
    boolean clearAnalysis(Long productId);
}
