package com.clipforge.infrastructure.repository.channel;

import com.clipforge.domain.channel.adapter.repository.IChannelRepository;
import com.clipforge.domain.channel.model.entity.ChannelEntity;
import com.clipforge.domain.channel.model.valobj.PersonaProfile;
import com.clipforge.infrastructure.dao.ChannelDao;
import com.clipforge.infrastructure.dao.po.ChannelPO;
import com.clipforge.infrastructure.util.JsonCodec;
import com.clipforge.types.enums.ChannelStatusEnum;
import com.clipforge.types.enums.PlatformEnum;
import com.clipforge.types.enums.UploadFrequencyEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 渠道仓储实现类。
 * <p>
 * 负责渠道读取、状态更新与人设的条件写入；JSONB 字段（persona、credentials）在此编解码。
 * 计数与成本字段的变更统一走预算账本仓储。
 * </p>
 *
 * @author clipforge
 * @since 2026-03-02
 */
@Slf4j
@Repository
public class ChannelRepositoryImpl implements IChannelRepository {

    private final ChannelDao channelDao;
    private final JsonCodec jsonCodec;

    public ChannelRepositoryImpl(ChannelDao channelDao, JsonCodec jsonCodec) {
        this.channelDao = channelDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public ChannelEntity findById(Long id) {
        ChannelPO po = channelDao.selectById(id);
        return po != null ? toEntity(po) : null;
    }

    @Override
    public List<ChannelEntity> findByCampaignId(Long campaignId) {
        return channelDao.selectByCampaignId(campaignId).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<ChannelEntity> findByIds(List<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return Collections.emptyList();
        }
        return channelDao.selectByIds(ids).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public boolean updateStatus(Long id, ChannelStatusEnum status) {
        if (id == null || status == null) {
            return false;
        }
        return channelDao.updateStatus(id, status.getCode()) > 0;
    }

    @Override
    public boolean savePersonaIfAbsent(Long channelId, PersonaProfile persona) {
        if (channelId == null || persona == null) {
            return false;
        }
        return channelDao.updatePersonaIfAbsent(channelId, jsonCodec.writeValue(persona)) > 0;
    }

    /**
     * PO 转换为 Entity
     */
    private ChannelEntity toEntity(ChannelPO po) {
        if (po == null) {
            return null;
        }
        ChannelEntity entity = new ChannelEntity();
        entity.setId(po.getId());
        entity.setCampaignId(po.getCampaignId());
        entity.setProductId(po.getProductId());
        entity.setName(po.getName());
        entity.setPlatform(PlatformEnum.fromCode(po.getPlatform()));
        entity.setStatus(ChannelStatusEnum.fromCode(po.getStatus()));
        entity.setVideosPerDay(po.getVideosPerDay());
        UploadFrequencyEnum frequency = UploadFrequencyEnum.fromCodeOrNull(po.getUploadFrequency());
        if (frequency == null && po.getUploadFrequency() != null) {
            log.warn("Unknown upload frequency, daily cadence applies. channelId={}, frequency={}",
                    po.getId(), po.getUploadFrequency());
        }
        entity.setUploadFrequency(frequency);
        entity.setLastUploadTime(po.getLastUploadTime());
        entity.setDailyProductionCost(defaultZero(po.getDailyProductionCost()));
        entity.setTotalProductionCost(defaultZero(po.getTotalProductionCost()));
        entity.setDailySpendLimit(po.getDailySpendLimit());
        entity.setVideosProduced(po.getVideosProduced());
        entity.setTotalVideosProduced(po.getTotalVideosProduced());
        entity.setLatestVideoUrl(po.getLatestVideoUrl());
        entity.setCostResetDate(po.getCostResetDate());

        // JSONB 字段转换
        if (po.getPersona() != null) {
            entity.setPersona(jsonCodec.readValue(po.getPersona(), PersonaProfile.class));
        }
        if (po.getCredentials() != null) {
            entity.setCredentials(jsonCodec.readStringMap(po.getCredentials()));
        }

        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private BigDecimal defaultZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
