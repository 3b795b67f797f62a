/**
 * Production 领域 - 内容生产流水线
 *
 * <p>职责：单条内容的生产状态机与各阶段的结构化结果。</p>
 *
 * <h3>阶段</h3>
 * <ul>
 *   <li>PENDING_ANALYSIS → PERSONA_READY → SCRIPT_READY → STORYBOARD_READY</li>
 *   <li>JOB_SUBMITTED → JOB_POLLING → ASSET_READY → PUBLISHED / PUBLISH_FAILED</li>
 *   <li>任一非终态阶段均可转入 FAILED；ASSET_READY 之后不再视为流水线失败</li>
 * </ul>
 *
 * <h3>外部协作方（网关）</h3>
 * <ul>
 *   <li>IProductAnalysisGateway / IPersonaGateway / IScriptGateway - LLM 提供方</li>
 *   <li>IVideoGenerationGateway - 异步视频生成后端（submit / poll）</li>
 *   <li>IArtifactStorageGateway - 素材持久化存储</li>
 *   <li>IPlatformPublisherGateway - 平台发布</li>
 * </ul>
 *
 * @author clipforge
 * @since 2026-03-02
 */
package com.clipforge.domain.production;
