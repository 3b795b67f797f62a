package com.clipforge.domain.production.model.valobj;

import com.clipforge.domain.channel.model.valobj.PersonaProfile;
import com.clipforge.types.exception.ContractValidationException;

/**
 * 人设阶段结果。
 *
 * @param profile 生效的人设
 * @param created 是否由本次任务创建（false 表示复用缓存或并发写入方的人设）
 */
public record PersonaResult(PersonaProfile profile, boolean created) {

    public PersonaResult {
        if (profile == null || !profile.isComplete()) {
            throw new ContractValidationException("Persona must have a name and a full profile");
        }
    }

    public static PersonaResult reused(PersonaProfile profile) {
        return new PersonaResult(profile, false);
    }

    public static PersonaResult created(PersonaProfile profile) {
        return new PersonaResult(profile, true);
    }
}
