/**
 * Budget 领域 - 预算账本
 *
 * <p>职责：渠道日预算与活动月预算的检查、原子入账与周期重置。</p>
 *
 * <p>入账在进程内按渠道/活动分段加锁串行化，仓储层再以条件更新（compare-and-increment）兜底，
 * 同一渠道并发完成的多个任务不会同时通过只够一个任务的预算。</p>
 *
 * @author clipforge
 * @since 2026-03-02
 */
package com.clipforge.domain.budget;
