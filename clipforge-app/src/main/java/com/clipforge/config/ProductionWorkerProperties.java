package com.clipforge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 生产工作线程池配置，前缀 clipforge.production.worker。
 * <p>
 * 线程数即流水线并行度上限，限制对视频生成后端的并发压力。
 * queue-capacity=0 时池满立即拒绝，渠道留到下一个 tick。
 * </p>
 *
 * @author clipforge
 * @since 2026-03-02
 */
@Data
@ConfigurationProperties(prefix = "clipforge.production.worker", ignoreInvalidFields = true)
public class ProductionWorkerProperties {

    /** 核心线程数，默认4 */
    private Integer corePoolSize = 4;

    /** 最大线程数，默认4 */
    private Integer maxPoolSize = 4;

    /** 等待队列容量，默认0 */
    private Integer queueCapacity = 0;

    /** 空闲线程存活时间（秒），默认60 */
    private Long keepAliveSeconds = 60L;

    /** 线程名前缀 */
    private String threadNamePrefix = "production-worker-";

}
