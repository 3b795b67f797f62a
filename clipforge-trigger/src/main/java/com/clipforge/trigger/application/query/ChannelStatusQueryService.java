package com.clipforge.trigger.application.query;

import com.clipforge.api.dto.ChannelStatusDTO;
import com.clipforge.domain.channel.adapter.repository.ICampaignRepository;
import com.clipforge.domain.channel.adapter.repository.IChannelRepository;
import com.clipforge.domain.channel.model.entity.CampaignEntity;
import com.clipforge.domain.channel.model.entity.ChannelEntity;
import com.clipforge.domain.production.model.entity.ProductionJobEntity;
import com.clipforge.trigger.application.common.ProductionJobRegistry;
import com.clipforge.trigger.application.observability.ProductionStatusStore;
import com.clipforge.types.enums.CampaignStatusEnum;
import com.clipforge.types.enums.ResponseCode;
import com.clipforge.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 渠道状态读用例：合并存储中的渠道计数、最近运行快照与在途任务。
 */
@Service
public class ChannelStatusQueryService {

    private final IChannelRepository channelRepository;
    private final ICampaignRepository campaignRepository;
    private final ProductionJobRegistry productionJobRegistry;
    private final ProductionStatusStore productionStatusStore;

    public ChannelStatusQueryService(IChannelRepository channelRepository,
                                     ICampaignRepository campaignRepository,
                                     ProductionJobRegistry productionJobRegistry,
                                     ProductionStatusStore productionStatusStore) {
        this.channelRepository = channelRepository;
        this.campaignRepository = campaignRepository;
        this.productionJobRegistry = productionJobRegistry;
        this.productionStatusStore = productionStatusStore;
    }

    public ChannelStatusDTO getStatus(Long channelId) {
        ChannelEntity channel = channelRepository.findById(channelId);
        if (channel == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "渠道不存在: " + channelId);
        }
        return toDTO(channel);
    }

    /**
     * 活动 campaign 下的全部渠道，加上运行过但已不在活动 campaign 下的渠道。
     */
    public List<ChannelStatusDTO> listStatuses() {
        Map<Long, ChannelEntity> channels = new LinkedHashMap<>();
        List<CampaignEntity> campaigns = campaignRepository.findByStatus(CampaignStatusEnum.ACTIVE);
        if (campaigns != null) {
            for (CampaignEntity campaign : campaigns) {
                List<ChannelEntity> campaignChannels = channelRepository.findByCampaignId(campaign.getId());
                if (campaignChannels != null) {
                    campaignChannels.forEach(channel -> channels.putIfAbsent(channel.getId(), channel));
                }
            }
        }
        Set<Long> tracked = productionStatusStore.trackedChannelIds();
        List<Long> missing = new ArrayList<>();
        for (Long channelId : tracked) {
            if (!channels.containsKey(channelId)) {
                missing.add(channelId);
            }
        }
        if (!missing.isEmpty()) {
            List<ChannelEntity> loaded = channelRepository.findByIds(missing);
            if (loaded != null) {
                loaded.forEach(channel -> channels.putIfAbsent(channel.getId(), channel));
            }
        }
        List<ChannelStatusDTO> result = new ArrayList<>(channels.size());
        for (ChannelEntity channel : channels.values()) {
            result.add(toDTO(channel));
        }
        return result;
    }

    private ChannelStatusDTO toDTO(ChannelEntity channel) {
        ChannelStatusDTO dto = new ChannelStatusDTO();
        dto.setChannelId(channel.getId());
        dto.setChannelName(channel.getName());
        dto.setPlatform(channel.getPlatform() == null ? null : channel.getPlatform().getCode());
        dto.setChannelStatus(channel.getStatus() == null ? null : channel.getStatus().getCode());
        dto.setLastUploadTime(channel.getLastUploadTime());
        dto.setDailyProductionCost(channel.dailyCostOrZero());
        dto.setDailySpendLimit(channel.getDailySpendLimit());
        dto.setTotalProductionCost(channel.getTotalProductionCost());
        dto.setLatestVideoUrl(channel.getLatestVideoUrl());

        ProductionStatusStore.RunSnapshot snapshot = productionStatusStore.find(channel.getId());
        if (snapshot != null) {
            dto.setLastRunAt(snapshot.lastRunAt());
            dto.setLastCost(snapshot.lastCost());
            dto.setLastError(snapshot.lastError());
            dto.setLastOutcome(snapshot.lastOutcome() == null ? null : snapshot.lastOutcome().getCode());
        }
        ProductionJobEntity job = productionJobRegistry.find(channel.getId());
        dto.setInFlight(job != null);
        if (job != null) {
            dto.setCurrentStage(job.getStage() == null ? null : job.getStage().getCode());
            dto.setCurrentJobId(job.getJobId());
        }
        return dto;
    }
}
