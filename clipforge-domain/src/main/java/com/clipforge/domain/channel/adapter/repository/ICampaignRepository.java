package com.clipforge.domain.channel.adapter.repository;

import com.clipforge.domain.channel.model.entity.CampaignEntity;
import com.clipforge.types.enums.CampaignStatusEnum;

import java.util.List;

/**
 * 活动仓储接口
 *
 * @author clipforge
 * @since 2026-03-02
 */
public interface ICampaignRepository {

    /**
     * 根据 ID 查询
     */
    CampaignEntity findById(Long id);

    /**
     * 根据状态查询
     */
    List<CampaignEntity> findByStatus(CampaignStatusEnum status);
}
