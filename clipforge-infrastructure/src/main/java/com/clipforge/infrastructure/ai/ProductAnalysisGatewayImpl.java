package com.clipforge.infrastructure.ai;

import com.clipforge.domain.channel.model.entity.ProductEntity;
import com.clipforge.domain.production.adapter.gateway.IProductAnalysisGateway;
import com.clipforge.domain.production.model.valobj.AnalysisResult;
import com.clipforge.infrastructure.util.JsonCodec;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Component;

/**
 * 基于 ChatClient 的产品分析实现。
 */
@Component
public class ProductAnalysisGatewayImpl extends AbstractChatGateway implements IProductAnalysisGateway {

    public ProductAnalysisGatewayImpl(ChatClient chatClient, JsonCodec jsonCodec) {
        super(chatClient, jsonCodec);
    }

    @Override
    public AnalysisResult analyze(ProductEntity product) {
        JsonNode payload = callForJson("analysis", buildPrompt(product));
        AnalysisResult analysis = AnalysisResult.builder()
                .benefits(textList(payload, "benefits", "keyBenefits"))
                .targetAudience(text(payload, "targetAudience", "target_audience"))
                .painPoints(textList(payload, "painPoints", "pain_points"))
                .keyFeatures(textList(payload, "keyFeatures", "key_features", "features"))
                .tone(text(payload, "tone"))
                .build();
        analysis.validate();
        return analysis;
    }

    private String buildPrompt(ProductEntity product) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Analyze the product for short-form UGC marketing and return JSON only.");
        prompt.append(" Fields: benefits (array), targetAudience (string), painPoints (array),");
        prompt.append(" keyFeatures (array), tone (string).");
        prompt.append("\nProduct: ").append(StringUtils.defaultString(product.getName()));
        if (StringUtils.isNotBlank(product.getDescription())) {
            prompt.append("\nDescription: ").append(product.getDescription());
        }
        if (StringUtils.isNotBlank(product.getUrl())) {
            prompt.append("\nURL: ").append(product.getUrl());
        }
        if (product.getAttributes() != null && !product.getAttributes().isEmpty()) {
            prompt.append("\nAttributes: ").append(jsonCodec.writeValue(product.getAttributes()));
        }
        return prompt.toString();
    }
}
