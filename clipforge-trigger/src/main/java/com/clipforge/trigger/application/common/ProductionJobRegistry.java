package com.clipforge.trigger.application.common;

import com.clipforge.domain.production.model.entity.ProductionJobEntity;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内在途任务表：每个渠道同一时刻至多一个生产任务。
 */
@Component
public class ProductionJobRegistry {

    private final Map<Long, ProductionJobEntity> inFlight = new ConcurrentHashMap<>();

    /**
     * 认领渠道。渠道已有在途任务时返回 false。
     */
    public boolean tryClaim(ProductionJobEntity job) {
        if (job == null || job.getChannelId() == null) {
            throw new IllegalArgumentException("Job with channel id is required");
        }
        return inFlight.putIfAbsent(job.getChannelId(), job) == null;
    }

    /**
     * 只释放本任务自己的认领。
     */
    public boolean release(ProductionJobEntity job) {
        if (job == null || job.getChannelId() == null) {
            return false;
        }
        return inFlight.remove(job.getChannelId(), job);
    }

    public ProductionJobEntity find(Long channelId) {
        return channelId == null ? null : inFlight.get(channelId);
    }

    public boolean isInFlight(Long channelId) {
        return channelId != null && inFlight.containsKey(channelId);
    }

    /**
     * 请求取消渠道的在途任务，任务在下一个检查点退出。
     */
    public boolean cancel(Long channelId) {
        ProductionJobEntity job = find(channelId);
        if (job == null) {
            return false;
        }
        job.requestCancel();
        return true;
    }

    public Collection<ProductionJobEntity> snapshot() {
        return List.copyOf(inFlight.values());
    }

    public int size() {
        return inFlight.size();
    }
}
