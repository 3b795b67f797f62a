package com.clipforge.domain.production.adapter.gateway;

import com.clipforge.domain.channel.model.entity.ProductEntity;
import com.clipforge.domain.channel.model.valobj.PersonaProfile;
import com.clipforge.domain.production.model.valobj.AnalysisResult;

import java.util.List;

/**
 * 脚本生成提供方。
 */
public interface IScriptGateway {

    /**
     * 生成 count 个候选脚本原文，顺序稳定。
     */
    List<String> generateScripts(ProductEntity product,
                                 AnalysisResult analysis,
                                 PersonaProfile persona,
                                 int count);
}
