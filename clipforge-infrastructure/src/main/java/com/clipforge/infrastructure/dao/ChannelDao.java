package com.clipforge.infrastructure.dao;

import com.clipforge.infrastructure.dao.po.ChannelPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 渠道 DAO
 *
 * @author clipforge
 * @since 2026-03-02
 */
@Mapper
public interface ChannelDao {

    /**
     * 根据 ID 查询
     */
    ChannelPO selectById(@Param("id") Long id);

    /**
     * 根据活动 ID 查询
     */
    List<ChannelPO> selectByCampaignId(@Param("campaignId") Long campaignId);

    /**
     * 根据 ID 列表查询
     */
    List<ChannelPO> selectByIds(@Param("ids") List<Long> ids);

    /**
     * 更新状态
     */
    int updateStatus(@Param("id") Long id, @Param("status") String status);

    /**
     * 人设为空时写入
     */
    int updatePersonaIfAbsent(@Param("id") Long id, @Param("persona") String persona);

    /**
     * 条件入账：日预算不足时不更新
     */
    int commitProductionCost(@Param("id") Long id,
                             @Param("amount") BigDecimal amount,
                             @Param("artifactUrl") String artifactUrl,
                             @Param("committedAt") LocalDateTime committedAt);

    /**
     * 重置日成本 (仅重置日期早于 today 的渠道)
     */
    int resetDailyCosts(@Param("today") LocalDate today);
}
