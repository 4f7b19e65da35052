package com.taskaggregator.infrastructure.repository.task;

import com.taskaggregator.domain.task.adapter.repository.ITaskRepository;
import com.taskaggregator.domain.task.model.entity.TaskEntity;
import com.taskaggregator.infrastructure.dao.TaskDao;
import com.taskaggregator.infrastructure.dao.po.TaskPO;
import com.taskaggregator.types.enums.TaskStatusEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 任务仓储实现类。
 * <p>
 * 负责任务的持久化操作，包括：
 * <ul>
 *   <li>任务创建与按 ID 查询</li>
 *   <li>按 Operator 反连接查询下一个可下发任务</li>
 *   <li>以 READY 为前置条件的终态条件更新（单写者保证）</li>
 *   <li>Entity与PO之间的相互转换</li>
 * </ul>
 * </p>
 *
 * @author getoffer
 * @since 2026-10-19
 */
@Slf4j
@Repository
public class TaskRepositoryImpl implements ITaskRepository {

    private final TaskDao taskDao;

    public TaskRepositoryImpl(TaskDao taskDao) {
        this.taskDao = taskDao;
    }

    @Override
    public TaskEntity save(TaskEntity entity) {
        entity.validate();
        TaskPO po = toPO(entity);
        taskDao.insert(po);
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public TaskEntity findById(Long id) {
        if (id == null) {
            return null;
        }
        TaskPO po = taskDao.selectById(id);
        return po != null ? toEntity(po) : null;
    }

    @Override
    public TaskEntity findNextReadyTaskForOperator(Long operatorId) {
        TaskPO po = taskDao.selectNextReadyForOperator(operatorId, TaskStatusEnum.READY);
        return po != null ? toEntity(po) : null;
    }

    @Override
    public List<TaskEntity> findReadyTasksWithResponses(long afterId, int limit) {
        List<TaskPO> rows = taskDao.selectReadyWithResponses(TaskStatusEnum.READY, Math.max(afterId, 0L), Math.max(limit, 1));
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        return rows.stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public boolean transitionFromReady(Long taskId, TaskStatusEnum targetStatus, String response, long finalizedAt) {
        if (targetStatus == null || !targetStatus.isTerminal()) {
            throw new IllegalArgumentException("Target status must be terminal: " + targetStatus);
        }
        String storedResponse = targetStatus == TaskStatusEnum.COMPLETED ? response : null;
        int affected = taskDao.updateStatusGuarded(taskId, TaskStatusEnum.READY, targetStatus, storedResponse, finalizedAt);
        if (affected == 0) {
            log.debug("Guarded task transition rejected. taskId={}, targetStatus={}", taskId, targetStatus);
        }
        return affected > 0;
    }

    @Override
    public long countByStatus(TaskStatusEnum status) {
        Long count = taskDao.countByStatus(status);
        return count == null ? 0L : count;
    }

    /**
     * PO 转换为 Entity
     */
    private TaskEntity toEntity(TaskPO po) {
        if (po == null) {
            return null;
        }
        TaskEntity entity = new TaskEntity();
        entity.setId(po.getId());
        entity.setStatus(po.getStatus());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setInput(po.getInput());
        entity.setResponse(po.getResponse());
        entity.setFinalizedAt(po.getFinalizedAt());
        return entity;
    }

    /**
     * Entity 转换为 PO
     */
    private TaskPO toPO(TaskEntity entity) {
        if (entity == null) {
            return null;
        }
        return TaskPO.builder()
                .id(entity.getId())
                .status(entity.getStatus())
                .createdAt(entity.getCreatedAt())
                .input(entity.getInput())
                .response(entity.getResponse())
                .finalizedAt(entity.getFinalizedAt())
                .build();
    }
}
