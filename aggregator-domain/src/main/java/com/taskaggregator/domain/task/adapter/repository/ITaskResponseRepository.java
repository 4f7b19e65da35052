package com.taskaggregator.domain.task.adapter.repository;

import com.taskaggregator.domain.task.model.entity.TaskResponseEntity;

import java.util.List;

/**
 * Operator 响应仓储接口
 *
 * @author getoffer
 * @since 2026-10-19
 */
public interface ITaskResponseRepository {

    /**
     * 按 (taskId, operatorId) 唯一键原子插入，且仅当任务在写入时仍为 READY。
     *
     * @return true 表示新插入并回填 ID；false 表示该 Operator 已提交过（原记录保持不变）或任务已进入终态
     */
    boolean insertIfAbsent(TaskResponseEntity entity);

    /**
     * 查询任务的全部响应，按入库顺序（id 升序）
     */
    List<TaskResponseEntity> findByTaskId(Long taskId);

    /**
     * 统计任务响应数
     */
    long countByTaskId(Long taskId);

    /**
     * 查询指定 Operator 对任务的响应
     */
    TaskResponseEntity findByTaskIdAndOperatorId(Long taskId, Long operatorId);
}
