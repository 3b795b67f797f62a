package com.clipforge.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 产品 PO
 *
 * @author clipforge
 * @since 2026-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductPO {

    private Long id;

    private String name;

    private String description;

    private String url;

    /**
     * 静态属性 (JSONB)
     */
    private String attributes;

    /**
     * 分析缓存 (JSONB)
     */
    private String cachedAnalysis;

    private LocalDateTime analysisUpdatedAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
