package com.clipforge.test.integration;

import com.clipforge.Application;
import com.clipforge.domain.channel.adapter.repository.IChannelRepository;
import com.clipforge.domain.channel.adapter.repository.IProductRepository;
import com.clipforge.domain.channel.model.entity.ChannelEntity;
import com.clipforge.domain.channel.model.entity.ProductEntity;
import com.clipforge.domain.channel.model.valobj.PersonaProfile;
import com.clipforge.domain.production.model.valobj.AnalysisResult;
import com.clipforge.types.enums.ChannelStatusEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfSystemProperty;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@SpringBootTest(
        classes = Application.class,
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
                "spring.task.scheduling.enabled=false"
        }
)
@EnabledIfSystemProperty(named = "it.docker.enabled", matches = "true")
public class ChannelStoreRepositoryIntegrationTest extends PostgresIntegrationTestSupport {

    @Autowired
    private IChannelRepository channelRepository;

    @Autowired
    private IProductRepository productRepository;

    @Test
    public void shouldKeepFirstPersonaWhenWrittenTwice() {
        Long channelId = insertChannel(insertCampaign(null, BigDecimal.ZERO), BigDecimal.ZERO, BigDecimal.ZERO);

        Assertions.assertTrue(channelRepository.savePersonaIfAbsent(channelId, persona("Maya")));
        Assertions.assertFalse(channelRepository.savePersonaIfAbsent(channelId, persona("Jordan")));

        ChannelEntity channel = channelRepository.findById(channelId);
        Assertions.assertEquals("Maya", channel.getPersona().getName());
        Assertions.assertEquals(ChannelStatusEnum.ACTIVE, channel.getStatus());
    }

    @Test
    public void shouldCacheAnalysisUntilCleared() {
        Long productId = jdbcTemplate.queryForObject(
                "INSERT INTO product (name, description) VALUES ('GlowSerum', 'Vitamin C serum') RETURNING id", Long.class);
        AnalysisResult first = AnalysisResult.builder()
                .benefits(List.of("Brighter skin in two weeks"))
                .targetAudience("Women 25-40")
                .build();
        AnalysisResult second = AnalysisResult.builder().targetAudience("Everyone").build();
        LocalDateTime now = LocalDateTime.of(2026, 3, 2, 10, 0);

        Assertions.assertTrue(productRepository.saveAnalysisIfAbsent(productId, first, now));
        Assertions.assertFalse(productRepository.saveAnalysisIfAbsent(productId, second, now));
        ProductEntity cached = productRepository.findById(productId);
        Assertions.assertEquals("Women 25-40", cached.getCachedAnalysis().getTargetAudience());

        Assertions.assertTrue(productRepository.clearAnalysis(productId));
        Assertions.assertNull(productRepository.findById(productId).getCachedAnalysis());
        Assertions.assertTrue(productRepository.saveAnalysisIfAbsent(productId, second, now));
    }

    @Test
    public void shouldUpdateChannelStatus() {
        Long channelId = insertChannel(insertCampaign(null, BigDecimal.ZERO), BigDecimal.ZERO, BigDecimal.ZERO);

        Assertions.assertTrue(channelRepository.updateStatus(channelId, ChannelStatusEnum.DISABLED));

        Assertions.assertEquals(ChannelStatusEnum.DISABLED, channelRepository.findById(channelId).getStatus());
    }

    private PersonaProfile persona(String name) {
        return PersonaProfile.builder()
                .name(name)
                .age(29)
                .occupation("night-shift nurse")
                .fullProfile(name + " reviews skincare after long shifts")
                .personaVersion(1)
                .build();
    }
}
