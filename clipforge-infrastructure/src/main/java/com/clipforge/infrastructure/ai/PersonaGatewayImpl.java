package com.clipforge.infrastructure.ai;

import com.clipforge.domain.channel.model.entity.ChannelEntity;
import com.clipforge.domain.channel.model.entity.ProductEntity;
import com.clipforge.domain.channel.model.valobj.PersonaProfile;
import com.clipforge.domain.production.adapter.gateway.IPersonaGateway;
import com.clipforge.domain.production.model.valobj.AnalysisResult;
import com.clipforge.infrastructure.util.JsonCodec;
import com.clipforge.types.exception.ContractValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 基于 ChatClient 的渠道人设生成实现。
 */
@Component
public class PersonaGatewayImpl extends AbstractChatGateway implements IPersonaGateway {

    private static final int PERSONA_VERSION = 1;

    private final Clock clock;

    public PersonaGatewayImpl(ChatClient chatClient, JsonCodec jsonCodec, Clock clock) {
        super(chatClient, jsonCodec);
        this.clock = clock;
    }

    @Override
    public PersonaProfile generatePersona(ChannelEntity channel, ProductEntity product, AnalysisResult analysis) {
        JsonNode payload = callForJson("persona", buildPrompt(channel, product, analysis));
        PersonaProfile persona = PersonaProfile.builder()
                .name(text(payload, "name"))
                .age(payload.path("age").canConvertToInt() ? payload.path("age").asInt() : null)
                .occupation(text(payload, "occupation"))
                .fullProfile(text(payload, "fullProfile", "full_profile", "profile"))
                .generatedAt(LocalDateTime.now(clock))
                .personaVersion(PERSONA_VERSION)
                .build();
        if (!persona.isComplete()) {
            throw new ContractValidationException("Persona payload misses name or full profile");
        }
        return persona;
    }

    private String buildPrompt(ChannelEntity channel, ProductEntity product, AnalysisResult analysis) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Create a believable content creator persona for a ")
                .append(channel.getPlatform() == null ? "social" : channel.getPlatform().getCode())
                .append(" channel and return JSON only.");
        prompt.append(" Fields: name, age (integer), occupation, fullProfile.");
        prompt.append("\nProduct: ").append(StringUtils.defaultString(product.getName()));
        prompt.append("\nTarget audience: ").append(StringUtils.defaultString(analysis.getTargetAudience()));
        return prompt.toString();
    }
}
