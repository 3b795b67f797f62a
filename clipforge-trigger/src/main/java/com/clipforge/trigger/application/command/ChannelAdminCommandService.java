package com.clipforge.trigger.application.command;

import com.clipforge.domain.channel.adapter.repository.IChannelRepository;
import com.clipforge.domain.channel.adapter.repository.IProductRepository;
import com.clipforge.domain.channel.model.entity.ChannelEntity;
import com.clipforge.domain.channel.model.entity.ProductEntity;
import com.clipforge.trigger.application.common.ProductionJobRegistry;
import com.clipforge.types.enums.ChannelStatusEnum;
import com.clipforge.types.enums.ResponseCode;
import com.clipforge.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 运维写用例：停用渠道并取消其在途任务，清除商品分析缓存。
 */
@Slf4j
@Service
public class ChannelAdminCommandService {

    private final IChannelRepository channelRepository;
    private final IProductRepository productRepository;
    private final ProductionJobRegistry productionJobRegistry;

    public ChannelAdminCommandService(IChannelRepository channelRepository,
                                      IProductRepository productRepository,
                                      ProductionJobRegistry productionJobRegistry) {
        this.channelRepository = channelRepository;
        this.productRepository = productRepository;
        this.productionJobRegistry = productionJobRegistry;
    }

    public DisableResult disableChannel(Long channelId) {
        ChannelEntity channel = channelRepository.findById(channelId);
        if (channel == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "渠道不存在: " + channelId);
        }
        ChannelStatusEnum previousStatus = channel.getStatus();
        if (previousStatus != ChannelStatusEnum.DISABLED) {
            channel.disable();
            channelRepository.updateStatus(channelId, channel.getStatus());
        }
        boolean cancelled = productionJobRegistry.cancel(channelId);
        log.info("Channel disabled. channelId={}, previousStatus={}, inFlightCancelled={}",
                channelId, previousStatus, cancelled);
        return new DisableResult(channelId, previousStatus, cancelled);
    }

    public boolean invalidateAnalysis(Long productId) {
        ProductEntity product = productRepository.findById(productId);
        if (product == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "商品不存在: " + productId);
        }
        boolean cleared = productRepository.clearAnalysis(productId);
        log.info("Product analysis invalidated. productId={}, cleared={}", productId, cleared);
        return cleared;
    }

    public record DisableResult(Long channelId, ChannelStatusEnum previousStatus, boolean inFlightCancelled) {
    }
}
