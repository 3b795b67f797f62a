package com.clipforge.test.support;

import com.clipforge.domain.budget.adapter.repository.IBudgetLedgerRepository;
import com.clipforge.domain.budget.model.valobj.BudgetCommitCommand;
import com.clipforge.domain.budget.model.valobj.BudgetCommitResult;
import com.clipforge.domain.channel.adapter.repository.ICampaignRepository;
import com.clipforge.domain.channel.adapter.repository.IChannelRepository;
import com.clipforge.domain.channel.adapter.repository.IProductRepository;
import com.clipforge.domain.channel.model.entity.CampaignEntity;
import com.clipforge.domain.channel.model.entity.ChannelEntity;
import com.clipforge.domain.channel.model.entity.ProductEntity;
import com.clipforge.domain.channel.model.valobj.PersonaProfile;
import com.clipforge.domain.production.model.valobj.AnalysisResult;
import com.clipforge.types.enums.CampaignStatusEnum;
import com.clipforge.types.enums.ChannelStatusEnum;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 内存渠道/活动/商品存储与预算账本。
 * <p>
 * commit 为非原子的读-判-写，可选地在读写之间停顿以放大竞争窗口；
 * 串行化由调用方负责。
 * </p>
 */
public class InMemoryChannelStore implements IBudgetLedgerRepository {

    private final Map<Long, ChannelEntity> channels = new ConcurrentHashMap<>();
    private final Map<Long, CampaignEntity> campaigns = new ConcurrentHashMap<>();
    private final Map<Long, ProductEntity> products = new ConcurrentHashMap<>();
    private final AtomicInteger commitCount = new AtomicInteger();
    private final AtomicInteger personaWrites = new AtomicInteger();
    private volatile long commitRaceWindowMs;
    private volatile boolean failCampaignQuery;
    private final ChannelRepository channelRepository = new ChannelRepository();
    private final CampaignRepository campaignRepository = new CampaignRepository();
    private final ProductRepository productRepository = new ProductRepository();

    public IChannelRepository channels() {
        return channelRepository;
    }

    public ICampaignRepository campaigns() {
        return campaignRepository;
    }

    public IProductRepository products() {
        return productRepository;
    }

    public ChannelEntity save(ChannelEntity channel) {
        channels.put(channel.getId(), channel);
        return channel;
    }

    public CampaignEntity save(CampaignEntity campaign) {
        campaigns.put(campaign.getId(), campaign);
        return campaign;
    }

    public ProductEntity save(ProductEntity product) {
        products.put(product.getId(), product);
        return product;
    }

    public void setCommitRaceWindowMs(long commitRaceWindowMs) {
        this.commitRaceWindowMs = commitRaceWindowMs;
    }

    public void setFailCampaignQuery(boolean failCampaignQuery) {
        this.failCampaignQuery = failCampaignQuery;
    }

    public int commitCount() {
        return commitCount.get();
    }

    public int personaWrites() {
        return personaWrites.get();
    }

    @Override
    public BudgetCommitResult commit(BudgetCommitCommand command) {
        ChannelEntity channel = channels.get(command.getChannelId());
        if (channel == null) {
            return BudgetCommitResult.reject(BudgetCommitResult.RejectReason.CHANNEL_NOT_FOUND);
        }
        BigDecimal amount = command.getAmount();
        BigDecimal daily = channel.dailyCostOrZero();
        CampaignEntity campaign = command.getCampaignId() == null ? null : campaigns.get(command.getCampaignId());
        BigDecimal monthly = campaign == null ? BigDecimal.ZERO : campaign.monthlySpentOrZero();
        pause();
        if (channel.hasDailySpendLimit() && daily.add(amount).compareTo(channel.getDailySpendLimit()) > 0) {
            return BudgetCommitResult.reject(BudgetCommitResult.RejectReason.CHANNEL_DAILY_LIMIT);
        }
        if (campaign != null && command.getCampaignMonthlyCap() != null
                && monthly.add(amount).compareTo(command.getCampaignMonthlyCap()) > 0) {
            return BudgetCommitResult.reject(BudgetCommitResult.RejectReason.CAMPAIGN_MONTHLY_LIMIT);
        }
        channel.setDailyProductionCost(daily.add(amount));
        channel.setTotalProductionCost(orZero(channel.getTotalProductionCost()).add(amount));
        channel.setVideosProduced(orZero(channel.getVideosProduced()) + 1);
        channel.setTotalVideosProduced(orZero(channel.getTotalVideosProduced()) + 1);
        channel.setLatestVideoUrl(command.getArtifactUrl());
        channel.setLastUploadTime(command.getCommittedAt());
        if (campaign != null) {
            campaign.setMonthlySpent(monthly.add(amount));
            campaign.setLastProductionTime(command.getCommittedAt());
        }
        commitCount.incrementAndGet();
        return BudgetCommitResult.accept();
    }

    @Override
    public int resetDailyCounters(LocalDate today) {
        int affected = 0;
        for (ChannelEntity channel : channels.values()) {
            if (channel.getCostResetDate() == null || channel.getCostResetDate().isBefore(today)) {
                channel.setDailyProductionCost(BigDecimal.ZERO);
                channel.setVideosProduced(0);
                channel.setCostResetDate(today);
                affected++;
            }
        }
        return affected;
    }

    @Override
    public int resetMonthlySpend(YearMonth month) {
        int affected = 0;
        String monthText = month.toString();
        for (CampaignEntity campaign : campaigns.values()) {
            if (campaign.getSpendResetMonth() == null || campaign.getSpendResetMonth().compareTo(monthText) < 0) {
                campaign.setMonthlySpent(BigDecimal.ZERO);
                campaign.setSpendResetMonth(monthText);
                affected++;
            }
        }
        return affected;
    }

    private void pause() {
        long window = commitRaceWindowMs;
        if (window <= 0) {
            return;
        }
        try {
            Thread.sleep(window);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }

    private final class ChannelRepository implements IChannelRepository {

        @Override
        public ChannelEntity findById(Long id) {
            return id == null ? null : channels.get(id);
        }

        @Override
        public List<ChannelEntity> findByCampaignId(Long campaignId) {
            return channels.values().stream()
                    .filter(channel -> Objects.equals(campaignId, channel.getCampaignId()))
                    .sorted((a, b) -> Long.compare(a.getId(), b.getId()))
                    .collect(Collectors.toList());
        }

        @Override
        public List<ChannelEntity> findByIds(List<Long> ids) {
            List<ChannelEntity> result = new ArrayList<>();
            if (ids == null) {
                return result;
            }
            for (Long id : ids) {
                ChannelEntity channel = channels.get(id);
                if (channel != null) {
                    result.add(channel);
                }
            }
            return result;
        }

        @Override
        public boolean updateStatus(Long id, ChannelStatusEnum status) {
            ChannelEntity channel = channels.get(id);
            if (channel == null) {
                return false;
            }
            channel.setStatus(status);
            return true;
        }

        @Override
        public synchronized boolean savePersonaIfAbsent(Long channelId, PersonaProfile persona) {
            ChannelEntity channel = channels.get(channelId);
            if (channel == null || channel.hasReusablePersona()) {
                return false;
            }
            channel.setPersona(persona);
            personaWrites.incrementAndGet();
            return true;
        }
    }

    private final class CampaignRepository implements ICampaignRepository {

        @Override
        public CampaignEntity findById(Long id) {
            return campaigns.get(id);
        }

        @Override
        public List<CampaignEntity> findByStatus(CampaignStatusEnum status) {
            if (failCampaignQuery) {
                throw new IllegalStateException("store unreachable");
            }
            return campaigns.values().stream()
                    .filter(campaign -> campaign.getStatus() == status)
                    .sorted((a, b) -> Long.compare(a.getId(), b.getId()))
                    .collect(Collectors.toList());
        }
    }

    private final class ProductRepository implements IProductRepository {

        @Override
        public ProductEntity findById(Long id) {
            return products.get(id);
        }

        @Override
        public synchronized boolean saveAnalysisIfAbsent(Long productId, AnalysisResult analysis, LocalDateTime analyzedAt) {
            ProductEntity product = products.get(productId);
            if (product == null || product.hasCachedAnalysis()) {
                return false;
            }
            product.setCachedAnalysis(analysis);
            product.setAnalysisUpdatedAt(analyzedAt);
            return true;
        }

        @Override
        public boolean clearAnalysis(Long productId) {
            ProductEntity product = products.get(productId);
            if (product == null) {
                return false;
            }
            product.setCachedAnalysis(null);
            product.setAnalysisUpdatedAt(null);
            return true;
        }
    }
}
