package com.clipforge.infrastructure.dao;

import com.clipforge.infrastructure.dao.po.ProductPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;

/**
 * 产品 DAO
 *
 * @author clipforge
 * @since 2026-03-02
 */
@Mapper
public interface ProductDao {

    ProductPO selectById(@Param("id") Long id);

    /**
     * 分析缓存为空时写入
     */
    int updateAnalysisIfAbsent(@Param("id") Long id,
                               @Param("analysis") String analysis,
                               @Param("analyzedAt") LocalDateTime analyzedAt);

    int clearAnalysis(@Param("id") Long id);
}
