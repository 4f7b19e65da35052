package com.taskaggregator.domain.task.adapter.repository;

import com.taskaggregator.domain.task.model.entity.TaskEntity;
import com.taskaggregator.types.enums.TaskStatusEnum;

import java.util.List;

/**
 * 任务仓储接口
 *
 * @author getoffer
 * @since 2026-10-19
 */
public interface ITaskRepository {

    /**
     * 保存任务，回填 ID
     */
    TaskEntity save(TaskEntity entity);

    /**
     * 根据 ID 查询
     */
    TaskEntity findById(Long id);

    /**
     * 查询指定 Operator 尚未响应的最早 READY 任务（created_at 升序，id 升序兜底）。
     */
    TaskEntity findNextReadyTaskForOperator(Long operatorId);

    /**
     * 查询至少有一条响应的 READY 任务（用于定期判定巡检），按 ID 升序分页。
     *
     * @param afterId 游标，仅返回 ID 大于该值的任务；0 表示从头开始
     */
    List<TaskEntity> findReadyTasksWithResponses(long afterId, int limit);

    /**
     * 原子地将 READY 任务推进到终态：仅当当前状态仍为 READY 时写入。
     *
     * @return true 表示本次调用是唯一的写入者；false 表示任务已被其它判定推进或不存在
     */
    boolean transitionFromReady(Long taskId, TaskStatusEnum targetStatus, String response, long finalizedAt);

    /**
     * 按状态统计任务数
     */
    long countByStatus(TaskStatusEnum status);
}
