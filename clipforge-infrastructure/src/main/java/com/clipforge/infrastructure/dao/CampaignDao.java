package com.clipforge.infrastructure.dao;

import com.clipforge.infrastructure.dao.po.CampaignPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 活动 DAO
 *
 * @author clipforge
 * @since 2026-03-02
 */
@Mapper
public interface CampaignDao {

    /**
     * 根据 ID 查询
     */
    CampaignPO selectById(@Param("id") Long id);

    /**
     * 根据状态查询
     */
    List<CampaignPO> selectByStatus(@Param("status") String status);

    /**
     * 条件累加月度花费；cap 为 null 表示不限
     */
    int commitMonthlySpend(@Param("id") Long id,
                           @Param("amount") BigDecimal amount,
                           @Param("cap") BigDecimal cap,
                           @Param("committedAt") LocalDateTime committedAt);

    /**
     * 重置月度花费 (仅重置月份早于 month 的活动)
     */
    int resetMonthlySpend(@Param("month") String month);
}
