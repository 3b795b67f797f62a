package com.clipforge.domain.production.model.entity;

import com.clipforge.domain.production.model.valobj.ArtifactRef;
import com.clipforge.domain.production.model.valobj.JobHandle;
import com.clipforge.types.enums.PipelineStageEnum;
import com.clipforge.types.enums.PlatformEnum;
import com.clipforge.types.enums.ProductionOutcomeEnum;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * 生产任务实体（瞬态，不跨重启持久化）。
 * <p>
 * 由单个工作线程推进阶段；状态查询与取消来自其它线程，
 * 因此阶段、结果与取消标记使用 volatile。
 * </p>
 *
 * @author clipforge
 * @since 2026-03-02
 */
@Data
public class ProductionJobEntity {

    private String jobId;

    private Long channelId;

    private Long campaignId;

    private Long productId;

    private PlatformEnum platform;

    private volatile PipelineStageEnum stage;

    private JobHandle jobHandle;

    private int submitAttempts;

    private int pollAttempts;

    /**
     * 已产生但尚未入账的成本
     */
    private BigDecimal accruedCost = BigDecimal.ZERO;

    /**
     * 已入账成本，只在 ASSET_READY 时写入
     */
    private BigDecimal committedCost = BigDecimal.ZERO;

    /**
     * 后端返回的结果地址
     */
    private String resultUrl;

    private ArtifactRef artifact;

    private String publishedUrl;

    private List<String> risks = new ArrayList<>();

    private volatile ProductionOutcomeEnum outcome;

    private String errorMessage;

    private LocalDateTime startedAt;

    private volatile LocalDateTime finishedAt;

    private volatile boolean cancelRequested;

    public static ProductionJobEntity create(Long channelId,
                                             Long campaignId,
                                             Long productId,
                                             PlatformEnum platform,
                                             LocalDateTime now) {
        ProductionJobEntity job = new ProductionJobEntity();
        job.setJobId(UUID.randomUUID().toString());
        job.setChannelId(channelId);
        job.setCampaignId(campaignId);
        job.setProductId(productId);
        job.setPlatform(platform);
        job.setStage(PipelineStageEnum.PENDING_ANALYSIS);
        job.setStartedAt(now);
        return job;
    }

    public void markPersonaReady() {
        requireStage(PipelineStageEnum.PENDING_ANALYSIS, "mark persona ready");
        this.stage = PipelineStageEnum.PERSONA_READY;
    }

    public void markScriptReady(List<String> scriptRisks) {
        requireStage(PipelineStageEnum.PERSONA_READY, "mark script ready");
        if (scriptRisks != null) {
            this.risks.addAll(scriptRisks);
        }
        this.stage = PipelineStageEnum.SCRIPT_READY;
    }

    public void markStoryboardReady() {
        requireStage(PipelineStageEnum.SCRIPT_READY, "mark storyboard ready");
        this.stage = PipelineStageEnum.STORYBOARD_READY;
    }

    public void recordSubmitAttempt() {
        requireStage(PipelineStageEnum.STORYBOARD_READY, "submit");
        this.submitAttempts++;
    }

    public void markSubmitted(JobHandle handle) {
        requireStage(PipelineStageEnum.STORYBOARD_READY, "mark submitted");
        if (handle == null) {
            throw new IllegalStateException("Job handle cannot be null");
        }
        this.jobHandle = handle;
        this.stage = PipelineStageEnum.JOB_SUBMITTED;
    }

    public void startPolling() {
        requireStage(PipelineStageEnum.JOB_SUBMITTED, "start polling");
        this.stage = PipelineStageEnum.JOB_POLLING;
    }

    /**
     * 后端已产出结果：记录结果地址与待入账成本，仍处于 JOB_POLLING 直到入账完成。
     */
    public void accrue(String resultUrl, int pollCount, BigDecimal cost) {
        requireStage(PipelineStageEnum.JOB_POLLING, "accrue cost");
        this.resultUrl = resultUrl;
        this.pollAttempts = pollCount;
        this.accruedCost = cost == null ? BigDecimal.ZERO : cost;
    }

    public void markAssetReady(ArtifactRef artifactRef) {
        requireStage(PipelineStageEnum.JOB_POLLING, "mark asset ready");
        if (artifactRef == null) {
            throw new IllegalStateException("Artifact reference cannot be null");
        }
        this.artifact = artifactRef;
        this.committedCost = this.accruedCost;
        this.stage = PipelineStageEnum.ASSET_READY;
    }

    public void markPublished(String remoteUrl, LocalDateTime now) {
        requireStage(PipelineStageEnum.ASSET_READY, "mark published");
        this.publishedUrl = remoteUrl;
        this.stage = PipelineStageEnum.PUBLISHED;
        finish(ProductionOutcomeEnum.PUBLISHED, null, now);
    }

    public void markPublishFailed(String error, LocalDateTime now) {
        requireStage(PipelineStageEnum.ASSET_READY, "mark publish failed");
        this.stage = PipelineStageEnum.PUBLISH_FAILED;
        finish(ProductionOutcomeEnum.PUBLISH_FAILED, error, now);
    }

    /**
     * 渠道无发布凭证：停留在 ASSET_READY 并结束。
     */
    public void markPublishSkipped(LocalDateTime now) {
        requireStage(PipelineStageEnum.ASSET_READY, "skip publish");
        finish(ProductionOutcomeEnum.PUBLISH_SKIPPED, null, now);
    }

    /**
     * 流水线失败。素材产出之后的问题不再是流水线失败，调用会被拒绝。
     */
    public void fail(ProductionOutcomeEnum failureOutcome, String error, LocalDateTime now) {
        if (failureOutcome == null || failureOutcome.isAssetProduced()) {
            throw new IllegalArgumentException("Not a failure outcome: " + failureOutcome);
        }
        if (isTerminal()) {
            throw new IllegalStateException("Job already finished with outcome " + outcome);
        }
        if (stage == PipelineStageEnum.ASSET_READY) {
            throw new IllegalStateException("Job with produced asset cannot fail");
        }
        this.stage = PipelineStageEnum.FAILED;
        this.committedCost = BigDecimal.ZERO;
        finish(failureOutcome, error, now);
    }

    public void requestCancel() {
        this.cancelRequested = true;
    }

    public boolean isTerminal() {
        return outcome != null;
    }

    public List<String> risksView() {
        return Collections.unmodifiableList(risks);
    }

    private void finish(ProductionOutcomeEnum finalOutcome, String error, LocalDateTime now) {
        this.errorMessage = error;
        this.finishedAt = now;
        this.outcome = finalOutcome;
    }

    private void requireStage(PipelineStageEnum expected, String action) {
        if (isTerminal()) {
            throw new IllegalStateException("Cannot " + action + ": job already finished with outcome " + outcome);
        }
        if (stage != expected) {
            throw new IllegalStateException("Cannot " + action + " from stage " + stage + ", expected " + expected);
        }
    }
}
