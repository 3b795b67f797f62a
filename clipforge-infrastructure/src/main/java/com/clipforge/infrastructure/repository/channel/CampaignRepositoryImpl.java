package com.clipforge.infrastructure.repository.channel;

import com.clipforge.domain.channel.adapter.repository.ICampaignRepository;
import com.clipforge.domain.channel.model.entity.CampaignEntity;
import com.clipforge.infrastructure.dao.CampaignDao;
import com.clipforge.infrastructure.dao.po.CampaignPO;
import com.clipforge.types.enums.CampaignStatusEnum;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 活动仓储实现类。
 *
 * @author clipforge
 * @since 2026-03-02
 */
@Repository
public class CampaignRepositoryImpl implements ICampaignRepository {

    private final CampaignDao campaignDao;

    public CampaignRepositoryImpl(CampaignDao campaignDao) {
        this.campaignDao = campaignDao;
    }

    @Override
    public CampaignEntity findById(Long id) {
        CampaignPO po = campaignDao.selectById(id);
        return po != null ? toEntity(po) : null;
    }

    @Override
    public List<CampaignEntity> findByStatus(CampaignStatusEnum status) {
        if (status == null) {
            return Collections.emptyList();
        }
        return campaignDao.selectByStatus(status.getCode()).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private CampaignEntity toEntity(CampaignPO po) {
        CampaignEntity entity = new CampaignEntity();
        entity.setId(po.getId());
        entity.setName(po.getName());
        entity.setStatus(CampaignStatusEnum.fromCode(po.getStatus()));
        entity.setMonthlyBudget(po.getMonthlyBudget());
        entity.setMonthlySpent(po.getMonthlySpent());
        entity.setSpendResetMonth(po.getSpendResetMonth());
        entity.setLastProductionTime(po.getLastProductionTime());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }
}
