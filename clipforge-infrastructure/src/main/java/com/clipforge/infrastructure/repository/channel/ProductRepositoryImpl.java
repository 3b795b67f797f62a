package com.clipforge.infrastructure.repository.channel;

import com.clipforge.domain.channel.adapter.repository.IProductRepository;
import com.clipforge.domain.channel.model.entity.ProductEntity;
import com.clipforge.domain.production.model.valobj.AnalysisResult;
import com.clipforge.infrastructure.dao.ProductDao;
import com.clipforge.infrastructure.dao.po.ProductPO;
import com.clipforge.infrastructure.util.JsonCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;

/**
 * 产品仓储实现类。分析缓存以 JSONB 存储，条件写入保证只写一次。
 *
 * @author clipforge
 * @since 2026-03-02
 */
@Slf4j
@Repository
public class ProductRepositoryImpl implements IProductRepository {

    private final ProductDao productDao;
    private final JsonCodec jsonCodec;

    public ProductRepositoryImpl(ProductDao productDao, JsonCodec jsonCodec) {
        this.productDao = productDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public ProductEntity findById(Long id) {
        ProductPO po = productDao.selectById(id);
        return po != null ? toEntity(po) : null;
    }

    @Override
    public boolean saveAnalysisIfAbsent(Long productId, AnalysisResult analysis, LocalDateTime analyzedAt) {
        if (productId == null || analysis == null) {
            return false;
        }
        return productDao.updateAnalysisIfAbsent(productId, jsonCodec.writeValue(analysis), analyzedAt) > 0;
    }

    @Override
    public boolean clearAnalysis(Long productId) {
        if (productId == null) {
            return false;
        }
        return productDao.clearAnalysis(productId) > 0;
    }

    private ProductEntity toEntity(ProductPO po) {
        ProductEntity entity = new ProductEntity();
        entity.setId(po.getId());
        entity.setName(po.getName());
        entity.setDescription(po.getDescription());
        entity.setUrl(po.getUrl());
        if (po.getAttributes() != null) {
            entity.setAttributes(jsonCodec.readMap(po.getAttributes()));
        }
        if (po.getCachedAnalysis() != null) {
            try {
                entity.setCachedAnalysis(jsonCodec.readValue(po.getCachedAnalysis(), AnalysisResult.class));
            } catch (Exception ex) {
                // 损坏的缓存等同于未分析
                log.warn("Ignore unreadable cached analysis. productId={}, error={}", po.getId(), ex.getMessage());
            }
        }
        entity.setAnalysisUpdatedAt(po.getAnalysisUpdatedAt());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }
}
