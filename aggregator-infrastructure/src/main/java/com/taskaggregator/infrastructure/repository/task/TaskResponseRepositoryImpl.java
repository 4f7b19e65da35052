package com.taskaggregator.infrastructure.repository.task;

import com.taskaggregator.domain.task.adapter.repository.ITaskResponseRepository;
import com.taskaggregator.domain.task.model.entity.TaskResponseEntity;
import com.taskaggregator.infrastructure.dao.TaskResponseDao;
import com.taskaggregator.infrastructure.dao.po.TaskResponsePO;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Operator 响应仓储实现。
 */
@Repository
public class TaskResponseRepositoryImpl implements ITaskResponseRepository {

    private final TaskResponseDao taskResponseDao;

    public TaskResponseRepositoryImpl(TaskResponseDao taskResponseDao) {
        this.taskResponseDao = taskResponseDao;
    }

    @Override
    public boolean insertIfAbsent(TaskResponseEntity entity) {
        TaskResponsePO po = toPO(entity);
        int affected = taskResponseDao.insertIfTaskReady(po);
        if (affected <= 0) {
            return false;
        }
        entity.setId(po.getId());
        return true;
    }

    @Override
    public List<TaskResponseEntity> findByTaskId(Long taskId) {
        List<TaskResponsePO> rows = taskResponseDao.selectByTaskId(taskId);
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        return rows.stream().map(this::toEntity).collect(Collectors.toList());
    }

    @Override
    public long countByTaskId(Long taskId) {
        Long count = taskResponseDao.countByTaskId(taskId);
        return count == null ? 0L : count;
    }

    @Override
    public TaskResponseEntity findByTaskIdAndOperatorId(Long taskId, Long operatorId) {
        TaskResponsePO po = taskResponseDao.selectByTaskIdAndOperatorId(taskId, operatorId);
        return po == null ? null : toEntity(po);
    }

    private TaskResponseEntity toEntity(TaskResponsePO po) {
        if (po == null) {
            return null;
        }
        TaskResponseEntity entity = new TaskResponseEntity();
        entity.setId(po.getId());
        entity.setTaskId(po.getTaskId());
        entity.setOperatorId(po.getOperatorId());
        entity.setResponse(po.getResponse());
        entity.setSignature(po.getSignature());
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }

    private TaskResponsePO toPO(TaskResponseEntity entity) {
        if (entity == null) {
            return null;
        }
        return TaskResponsePO.builder()
                .id(entity.getId())
                .taskId(entity.getTaskId())
                .operatorId(entity.getOperatorId())
                .response(entity.getResponse())
                .signature(entity.getSignature())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
