package com.clipforge.infrastructure.gateway.publisher;

import com.clipforge.infrastructure.util.JsonCodec;
import com.clipforge.types.enums.PlatformEnum;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

@Component
public class TikTokPublisherGateway extends AbstractHttpPlatformPublisher {

    public TikTokPublisherGateway(@Qualifier("publisherRestTemplate") RestTemplate restTemplate,
                                  JsonCodec jsonCodec,
                                  @Value("${clipforge.publisher.tiktok.endpoint:}") String endpoint) {
        super(restTemplate, jsonCodec, endpoint);
    }

    @Override
    public PlatformEnum platform() {
        return PlatformEnum.TIKTOK;
    }
}
