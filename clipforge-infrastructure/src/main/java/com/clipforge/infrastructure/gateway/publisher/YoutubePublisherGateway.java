package com.clipforge.infrastructure.gateway.publisher;

import com.clipforge.infrastructure.util.JsonCodec;
import com.clipforge.types.enums.PlatformEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

@Component
public class YoutubePublisherGateway extends AbstractHttpPlatformPublisher {

    private static final int TITLE_LIMIT = 100;

    public YoutubePublisherGateway(@Qualifier("publisherRestTemplate") RestTemplate restTemplate,
                                   JsonCodec jsonCodec,
                                   @Value("${clipforge.publisher.youtube.endpoint:}") String endpoint) {
        super(restTemplate, jsonCodec, endpoint);
    }

    @Override
    public PlatformEnum platform() {
        return PlatformEnum.YOUTUBE;
    }

    @Override
    protected void customizeBody(Map<String, Object> body, Map<String, String> credentials) {
        String caption = (String) body.get("caption");
        body.put("title", StringUtils.abbreviate(StringUtils.defaultString(caption), TITLE_LIMIT));
        body.put("privacy_status", "public");
    }
}
