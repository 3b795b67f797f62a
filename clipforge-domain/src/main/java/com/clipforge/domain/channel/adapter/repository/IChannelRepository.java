package com.clipforge.domain.channel.adapter.repository;

import com.clipforge.domain.channel.model.entity.ChannelEntity;
import com.clipforge.domain.channel.model.valobj.PersonaProfile;
import com.clipforge.types.enums.ChannelStatusEnum;

import java.util.List;

/**
 * 渠道仓储接口
 *
 * @author clipforge
 * @since 2026-03-02
 */
public interface IChannelRepository {

    /**
     * 根据 ID 查询
     */
    ChannelEntity findById(Long id);

    /**
     * 根据活动 ID 查询
     */
    List<ChannelEntity> findByCampaignId(Long campaignId);

    /**
     * 根据 ID 列表批量查询
     */
    List<ChannelEntity> findByIds(List<Long> ids);

    /**
     * 更新渠道状态
     */
    boolean updateStatus(Long id, ChannelStatusEnum status);

    /**
     * 条件写入人设：仅当渠道尚无人设时写入。
     *
     * @return 本次写入是否生效
     */
    boolean savePersonaIfAbsent(Long channelId, PersonaProfile persona);
}
