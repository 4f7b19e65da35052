/**
 * Task 领域 - 任务共识域
 *
 * <p>职责：任务生命周期、Operator 响应准入约束、参与度与内容一致性判定</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>参与度门槛：已提交响应数占有资格 Operator 数的比例（基点）</li>
 *   <li>内容门槛：最大相同响应组占全部响应的比例（基点）</li>
 *   <li>终态：COMPLETED / CONSENSUS_NOT_REACHED，一经写入不可变更</li>
 * </ul>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.taskaggregator.domain.task.model.entity.TaskEntity}</li>
 * </ul>
 *
 * <h3>核心实体</h3>
 * <ul>
 *   <li>Task - 任务（主表）</li>
 *   <li>TaskResponse - Operator 响应，(task, operator) 唯一</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>QuorumPolicyDomainService - 参与度/内容一致性判定</li>
 * </ul>
 */
package com.taskaggregator.domain.task;
