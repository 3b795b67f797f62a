/**
 * Channel 领域 - 渠道、活动与产品配置域
 *
 * <p>职责：渠道配置读取、上传节奏判定、人设与产品分析缓存</p>
 *
 * <h3>核心实体</h3>
 * <ul>
 *   <li>Channel - 渠道（节奏、日预算、人设缓存、发布凭证）</li>
 *   <li>Campaign - 活动（月度预算，拥有多个渠道）</li>
 *   <li>Product - 产品（静态描述与分析缓存）</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>UploadCadenceDomainService - 判定渠道是否到期生产</li>
 * </ul>
 *
 * @author clipforge
 * @since 2026-03-02
 */
package com.clipforge.domain.channel;
