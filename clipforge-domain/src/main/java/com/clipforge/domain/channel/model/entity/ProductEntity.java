package com.clipforge.domain.channel.model.entity;

import com.clipforge.domain.production.model.valobj.AnalysisResult;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 产品实体。分析结果计算一次后缓存，除非显式失效。
 *
 * @author clipforge
 * @since 2026-03-02
 */
@Data
public class ProductEntity {

    private Long id;

    private String name;

    private String description;

    private String url;

    /**
     * 静态属性（价格、品类等）
     */
    private Map<String, Object> attributes;

    private AnalysisResult cachedAnalysis;

    private LocalDateTime analysisUpdatedAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public boolean hasCachedAnalysis() {
        return cachedAnalysis != null;
    }
}
