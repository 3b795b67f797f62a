package com.clipforge.domain.production.adapter.gateway;

import com.clipforge.domain.channel.model.entity.ChannelEntity;
import com.clipforge.domain.channel.model.entity.ProductEntity;
import com.clipforge.domain.channel.model.valobj.PersonaProfile;
import com.clipforge.domain.production.model.valobj.AnalysisResult;

/**
 * 人设生成提供方。
 */
public interface IPersonaGateway {

    PersonaProfile generatePersona(ChannelEntity channel, ProductEntity product, AnalysisResult analysis);
}
