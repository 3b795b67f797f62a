package com.clipforge.trigger.application.command;

import com.clipforge.domain.budget.model.valobj.BudgetCommitResult;
import com.clipforge.domain.budget.service.BudgetLedgerDomainService;
import com.clipforge.domain.channel.adapter.repository.ICampaignRepository;
import com.clipforge.domain.channel.adapter.repository.IChannelRepository;
import com.clipforge.domain.channel.adapter.repository.IProductRepository;
import com.clipforge.domain.channel.model.entity.CampaignEntity;
import com.clipforge.domain.channel.model.entity.ChannelEntity;
import com.clipforge.domain.channel.model.entity.ProductEntity;
import com.clipforge.domain.channel.model.valobj.PersonaProfile;
import com.clipforge.domain.production.adapter.gateway.IArtifactStorageGateway;
import com.clipforge.domain.production.adapter.gateway.IPersonaGateway;
import com.clipforge.domain.production.adapter.gateway.IPlatformPublisherGateway;
import com.clipforge.domain.production.adapter.gateway.IProductAnalysisGateway;
import com.clipforge.domain.production.adapter.gateway.IScriptGateway;
import com.clipforge.domain.production.adapter.gateway.IVideoGenerationGateway;
import com.clipforge.domain.production.model.entity.ProductionJobEntity;
import com.clipforge.domain.production.model.valobj.AnalysisResult;
import com.clipforge.domain.production.model.valobj.ArtifactRef;
import com.clipforge.domain.production.model.valobj.JobHandle;
import com.clipforge.domain.production.model.valobj.PersonaResult;
import com.clipforge.domain.production.model.valobj.PublishResult;
import com.clipforge.domain.production.model.valobj.ScriptResult;
import com.clipforge.domain.production.model.valobj.StoryboardSpec;
import com.clipforge.domain.production.model.valobj.VideoGenerationRequest;
import com.clipforge.domain.production.service.CaptionDomainService;
import com.clipforge.domain.production.service.ScriptContractDomainService;
import com.clipforge.domain.production.service.ScriptSelectionDomainService;
import com.clipforge.domain.production.service.StoryboardDomainService;
import com.clipforge.trigger.application.common.AsyncJobPoller;
import com.clipforge.trigger.application.common.ProductionJobRegistry;
import com.clipforge.trigger.application.observability.ProductionStatusStore;
import com.clipforge.types.common.Constants;
import com.clipforge.types.enums.PipelineStageEnum;
import com.clipforge.types.enums.PlatformEnum;
import com.clipforge.types.enums.ProductionOutcomeEnum;
import com.clipforge.types.enums.ResponseCode;
import com.clipforge.types.enums.ScriptSelectionStrategyEnum;
import com.clipforge.types.exception.AppException;
import com.clipforge.types.exception.BudgetExceededException;
import com.clipforge.types.exception.ConfigurationException;
import com.clipforge.types.exception.ContractValidationException;
import com.clipforge.types.exception.JobTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * 生产流水线用例：在调用线程上把单个生产任务从分析推进到发布。
 * <p>
 * 成本、last_upload_time 与产出计数只在到达 ASSET_READY 时经预算账本一次性入账；
 * 其它任何失败都不入账。发布失败不算流水线失败。
 * 无论结果如何，结束时都会释放渠道的在途认领。
 * </p>
 */
@Slf4j
@Service
public class ProductionPipelineApplicationService {

    private static final String ASPECT_RATIO = "portrait";

    private final IChannelRepository channelRepository;
    private final ICampaignRepository campaignRepository;
    private final IProductRepository productRepository;
    private final IProductAnalysisGateway productAnalysisGateway;
    private final IPersonaGateway personaGateway;
    private final IScriptGateway scriptGateway;
    private final IVideoGenerationGateway videoGenerationGateway;
    private final IArtifactStorageGateway artifactStorageGateway;
    private final Map<PlatformEnum, IPlatformPublisherGateway> publishers;
    private final ScriptContractDomainService scriptContractDomainService;
    private final ScriptSelectionDomainService scriptSelectionDomainService;
    private final StoryboardDomainService storyboardDomainService;
    private final CaptionDomainService captionDomainService;
    private final BudgetLedgerDomainService budgetLedgerDomainService;
    private final AsyncJobPoller asyncJobPoller;
    private final ProductionJobRegistry productionJobRegistry;
    private final ProductionStatusStore productionStatusStore;
    private final Clock clock;

    private final BigDecimal costPerVideo;
    private final int scriptCandidates;
    private final ScriptSelectionStrategyEnum scriptSelectionStrategy;
    private final int submitMaxAttempts;
    private final long submitBackoffMs;

    public ProductionPipelineApplicationService(IChannelRepository channelRepository,
                                                ICampaignRepository campaignRepository,
                                                IProductRepository productRepository,
                                                IProductAnalysisGateway productAnalysisGateway,
                                                IPersonaGateway personaGateway,
                                                IScriptGateway scriptGateway,
                                                IVideoGenerationGateway videoGenerationGateway,
                                                IArtifactStorageGateway artifactStorageGateway,
                                                List<IPlatformPublisherGateway> platformPublishers,
                                                ScriptContractDomainService scriptContractDomainService,
                                                ScriptSelectionDomainService scriptSelectionDomainService,
                                                StoryboardDomainService storyboardDomainService,
                                                CaptionDomainService captionDomainService,
                                                BudgetLedgerDomainService budgetLedgerDomainService,
                                                AsyncJobPoller asyncJobPoller,
                                                ProductionJobRegistry productionJobRegistry,
                                                ProductionStatusStore productionStatusStore,
                                                Clock clock,
                                                @Value("${clipforge.production.cost-per-video:0.32}") BigDecimal costPerVideo,
                                                @Value("${clipforge.pipeline.script-candidates:3}") int scriptCandidates,
                                                @Value("${clipforge.pipeline.script-selection:first}") String scriptSelection,
                                                @Value("${clipforge.poller.submit-max-attempts:3}") int submitMaxAttempts,
                                                @Value("${clipforge.poller.submit-backoff-ms:2000}") long submitBackoffMs) {
        this.channelRepository = channelRepository;
        this.campaignRepository = campaignRepository;
        this.productRepository = productRepository;
        this.productAnalysisGateway = productAnalysisGateway;
        this.personaGateway = personaGateway;
        this.scriptGateway = scriptGateway;
        this.videoGenerationGateway = videoGenerationGateway;
        this.artifactStorageGateway = artifactStorageGateway;
        this.publishers = new EnumMap<>(PlatformEnum.class);
        if (platformPublishers != null) {
            for (IPlatformPublisherGateway publisher : platformPublishers) {
                this.publishers.put(publisher.platform(), publisher);
            }
        }
        this.scriptContractDomainService = scriptContractDomainService;
        this.scriptSelectionDomainService = scriptSelectionDomainService;
        this.storyboardDomainService = storyboardDomainService;
        this.captionDomainService = captionDomainService;
        this.budgetLedgerDomainService = budgetLedgerDomainService;
        this.asyncJobPoller = asyncJobPoller;
        this.productionJobRegistry = productionJobRegistry;
        this.productionStatusStore = productionStatusStore;
        this.clock = clock;
        this.costPerVideo = costPerVideo == null || costPerVideo.signum() <= 0
                ? Constants.DEFAULT_COST_PER_VIDEO
                : costPerVideo;
        this.scriptCandidates = Math.max(scriptCandidates, 1);
        this.scriptSelectionStrategy = ScriptSelectionStrategyEnum.fromCode(scriptSelection);
        this.submitMaxAttempts = Math.max(submitMaxAttempts, 1);
        this.submitBackoffMs = Math.max(submitBackoffMs, 0L);
    }

    /**
     * 执行任务直到终态。调用方须已通过 {@link ProductionJobRegistry#tryClaim} 认领渠道。
     */
    public ProductionJobEntity execute(ProductionJobEntity job) {
        MDC.put(Constants.MDC_CHANNEL_ID, String.valueOf(job.getChannelId()));
        MDC.put(Constants.MDC_JOB_ID, job.getJobId());
        productionStatusStore.recordStarted(job);
        try {
            runStages(job);
        } catch (PipelineCancelledException ex) {
            terminate(job, ProductionOutcomeEnum.CANCELLED, ex.getMessage());
        } catch (JobTimeoutException ex) {
            terminate(job, ProductionOutcomeEnum.TIMEOUT, ex.getMessage());
        } catch (BudgetExceededException ex) {
            terminate(job, ProductionOutcomeEnum.BUDGET_REJECTED, ex.getMessage());
        } catch (AppException ex) {
            terminate(job, ProductionOutcomeEnum.FAILED, ex.getInfo());
        } catch (Exception ex) {
            log.error("Unexpected pipeline error. channelId={}, jobId={}, stage={}",
                    job.getChannelId(), job.getJobId(), job.getStage(), ex);
            terminate(job, ProductionOutcomeEnum.FAILED, ex.getClass().getSimpleName() + ": " + ex.getMessage());
        } finally {
            productionStatusStore.recordFinished(job);
            productionJobRegistry.release(job);
            log.info("Production job finished. channelId={}, jobId={}, outcome={}, stage={}, committedCost={}",
                    job.getChannelId(), job.getJobId(), job.getOutcome(), job.getStage(), job.getCommittedCost());
            MDC.remove(Constants.MDC_CHANNEL_ID);
            MDC.remove(Constants.MDC_JOB_ID);
        }
        return job;
    }

    private void runStages(ProductionJobEntity job) {
        ChannelEntity channel = channelRepository.findById(job.getChannelId());
        if (channel == null) {
            throw new ConfigurationException("Channel not found: " + job.getChannelId());
        }
        ProductEntity product = channel.getProductId() == null ? null : productRepository.findById(channel.getProductId());
        if (product == null) {
            throw new ConfigurationException("Channel has no product: " + channel.getId());
        }
        CampaignEntity campaign = channel.getCampaignId() == null ? null : campaignRepository.findById(channel.getCampaignId());

        checkpoint(job);
        AnalysisResult analysis = resolveAnalysis(product);
        PersonaResult persona = resolvePersona(channel, product, analysis);
        job.markPersonaReady();
        log.info("Persona ready. channelId={}, created={}", channel.getId(), persona.created());

        checkpoint(job);
        ScriptResult script = resolveScript(product, analysis, persona.profile());
        job.markScriptReady(script.getRisks());

        StoryboardSpec storyboard = storyboardDomainService.build(script);
        job.markStoryboardReady();
        log.info("Storyboard ready. channelId={}, totalSeconds={}, risks={}",
                channel.getId(), storyboard.getTotalSeconds(), script.riskCount());

        checkpoint(job);
        VideoGenerationRequest request = VideoGenerationRequest.builder()
                .jobId(job.getJobId())
                .channelId(channel.getId())
                .productName(product.getName())
                .personaDescription(persona.profile().getFullProfile())
                .storyboard(storyboard)
                .aspectRatio(ASPECT_RATIO)
                .build();
        JobHandle handle = callWithRetry(job, "submit", () -> {
            job.recordSubmitAttempt();
            return videoGenerationGateway.submit(request);
        });
        job.markSubmitted(handle);
        job.startPolling();

        AsyncJobPoller.PollOutcome pollOutcome = awaitPoll(job, handle);
        switch (pollOutcome.status()) {
            case SUCCEEDED -> job.accrue(pollOutcome.resultUrl(), pollOutcome.pollCount(), costPerVideo);
            case TIMEOUT -> throw new JobTimeoutException(pollOutcome.error());
            case CANCELLED -> throw new PipelineCancelledException("Cancelled while polling");
            default -> throw new AppException(ResponseCode.JOB_FAILED,
                    "Video job failed: " + pollOutcome.error());
        }

        ArtifactRef artifact = callWithRetry(job, "store artifact",
                () -> artifactStorageGateway.store(job.getResultUrl(), job.getJobId()));
        checkpoint(job);

        BudgetCommitResult commitResult = budgetLedgerDomainService.commit(channel, campaign,
                job.getAccruedCost(), artifact.publicUrl(), LocalDateTime.now(clock));
        if (!commitResult.accepted()) {
            throw new BudgetExceededException("Budget commit rejected: " + commitResult.rejectReason());
        }
        job.markAssetReady(artifact);

        publish(job, channel, product, analysis, artifact);
    }

    private AnalysisResult resolveAnalysis(ProductEntity product) {
        if (product.hasCachedAnalysis()) {
            return product.getCachedAnalysis();
        }
        AnalysisResult analysis = productAnalysisGateway.analyze(product);
        if (analysis == null) {
            throw new ContractValidationException("Analysis provider returned nothing for product " + product.getId());
        }
        analysis.validate();
        if (!productRepository.saveAnalysisIfAbsent(product.getId(), analysis, LocalDateTime.now(clock))) {
            ProductEntity reloaded = productRepository.findById(product.getId());
            if (reloaded != null && reloaded.hasCachedAnalysis()) {
                return reloaded.getCachedAnalysis();
            }
        }
        return analysis;
    }

    private PersonaResult resolvePersona(ChannelEntity channel, ProductEntity product, AnalysisResult analysis) {
        if (channel.hasReusablePersona()) {
            return PersonaResult.reused(channel.getPersona());
        }
        PersonaProfile generated = personaGateway.generatePersona(channel, product, analysis);
        PersonaResult candidate = PersonaResult.created(generated);
        if (channelRepository.savePersonaIfAbsent(channel.getId(), generated)) {
            channel.setPersona(generated);
            return candidate;
        }
        // 并发写入方已落库，采用其人设
        ChannelEntity reloaded = channelRepository.findById(channel.getId());
        if (reloaded != null && reloaded.hasReusablePersona()) {
            channel.setPersona(reloaded.getPersona());
            return PersonaResult.reused(reloaded.getPersona());
        }
        throw new ContractValidationException("Persona could not be stored for channel " + channel.getId());
    }

    private ScriptResult resolveScript(ProductEntity product, AnalysisResult analysis, PersonaProfile persona) {
        List<String> drafts = scriptGateway.generateScripts(product, analysis, persona, scriptCandidates);
        List<ScriptResult> candidates = new ArrayList<>();
        if (drafts != null) {
            for (String draft : drafts) {
                try {
                    candidates.add(scriptContractDomainService.evaluate(draft));
                } catch (ContractValidationException ex) {
                    log.warn("Script candidate rejected. productId={}, error={}", product.getId(), ex.getInfo());
                }
            }
        }
        return scriptSelectionDomainService.select(candidates, scriptSelectionStrategy);
    }

    private AsyncJobPoller.PollOutcome awaitPoll(ProductionJobEntity job, JobHandle handle) {
        CompletableFuture<AsyncJobPoller.PollOutcome> future =
                asyncJobPoller.poll(handle, videoGenerationGateway::poll, job::isCancelRequested);
        try {
            return future.get();
        } catch (InterruptedException ex) {
            future.cancel(true);
            job.requestCancel();
            Thread.currentThread().interrupt();
            throw new PipelineCancelledException("Interrupted while polling");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            throw new AppException(ResponseCode.JOB_FAILED, "Polling failed: " + cause.getMessage(), cause);
        }
    }

    private void publish(ProductionJobEntity job,
                         ChannelEntity channel,
                         ProductEntity product,
                         AnalysisResult analysis,
                         ArtifactRef artifact) {
        LocalDateTime now = LocalDateTime.now(clock);
        if (!channel.hasPublishCredentials()) {
            log.info("Publish skipped, channel has no credentials. channelId={}", channel.getId());
            job.markPublishSkipped(now);
            return;
        }
        IPlatformPublisherGateway publisher = publishers.get(channel.getPlatform());
        if (publisher == null) {
            job.markPublishFailed("No publisher for platform " + channel.getPlatform(), now);
            return;
        }
        PublishResult result;
        try {
            String caption = captionDomainService.buildCaption(product, analysis, channel.getPlatform());
            result = publisher.publish(artifact, channel.credentialsView(), caption);
        } catch (RuntimeException ex) {
            result = PublishResult.failure(ex.getMessage());
        }
        now = LocalDateTime.now(clock);
        if (result != null && result.success()) {
            job.markPublished(result.remoteUrl(), now);
            log.info("Artifact published. channelId={}, remoteUrl={}", channel.getId(), result.remoteUrl());
        } else {
            String error = result == null ? "Publisher returned nothing" : result.error();
            job.markPublishFailed(error, now);
            log.warn("Failed to publish artifact. channelId={}, error={}", channel.getId(), error);
        }
    }

    private <T> T callWithRetry(ProductionJobEntity job, String operation, Supplier<T> call) {
        int attempt = 0;
        while (true) {
            checkpoint(job);
            attempt++;
            try {
                return call.get();
            } catch (AppException ex) {
                if (!ex.isRetryable()) {
                    throw ex;
                }
                if (attempt >= submitMaxAttempts) {
                    throw new AppException(ResponseCode.JOB_FAILED,
                            "Failed to " + operation + " after " + attempt + " attempts: " + ex.getInfo(), ex);
                }
                long delay = submitBackoffMs * (1L << Math.min(attempt - 1, 10));
                log.warn("Transient error, retrying. operation={}, attempt={}, delayMs={}, error={}",
                        operation, attempt, delay, ex.getInfo());
                sleep(job, delay);
            }
        }
    }

    private void sleep(ProductionJobEntity job, long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ex) {
            job.requestCancel();
            Thread.currentThread().interrupt();
            throw new PipelineCancelledException("Interrupted during retry backoff");
        }
    }

    private void checkpoint(ProductionJobEntity job) {
        if (job.isCancelRequested()) {
            throw new PipelineCancelledException("Cancelled at stage " + job.getStage());
        }
    }

    private void terminate(ProductionJobEntity job, ProductionOutcomeEnum outcome, String error) {
        if (job.isTerminal()) {
            return;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        if (job.getStage() == PipelineStageEnum.ASSET_READY) {
            job.markPublishFailed(error, now);
            return;
        }
        job.fail(outcome, error, now);
        log.warn("Production job failed. channelId={}, jobId={}, outcome={}, error={}",
                job.getChannelId(), job.getJobId(), outcome, error);
    }

    private static final class PipelineCancelledException extends RuntimeException {

        private PipelineCancelledException(String message) {
            super(message);
        }
    }
}
