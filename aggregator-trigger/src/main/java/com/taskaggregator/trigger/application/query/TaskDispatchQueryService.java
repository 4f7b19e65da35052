package com.taskaggregator.trigger.application.query;

import com.taskaggregator.domain.task.adapter.repository.ITaskRepository;
import com.taskaggregator.domain.task.adapter.repository.ITaskResponseRepository;
import com.taskaggregator.domain.task.model.entity.TaskEntity;
import com.taskaggregator.domain.task.model.entity.TaskResponseEntity;
import com.taskaggregator.types.enums.ResponseCode;
import com.taskaggregator.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 任务读用例：任务下发与详情查询。
 */
@Service
public class TaskDispatchQueryService {

    private final ITaskRepository taskRepository;
    private final ITaskResponseRepository taskResponseRepository;

    public TaskDispatchQueryService(ITaskRepository taskRepository,
                                    ITaskResponseRepository taskResponseRepository) {
        this.taskRepository = taskRepository;
        this.taskResponseRepository = taskResponseRepository;
    }

    /**
     * Operator 尚未响应的最早 READY 任务，没有时返回 null。
     */
    public TaskEntity getNextReadyTask(Long operatorId) {
        if (operatorId == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "operatorId is required");
        }
        return taskRepository.findNextReadyTaskForOperator(operatorId);
    }

    public TaskEntity getTask(Long taskId) {
        TaskEntity task = taskRepository.findById(taskId);
        if (task == null) {
            throw new AppException(ResponseCode.TASK_NOT_FOUND, "Task not found: " + taskId);
        }
        return task;
    }

    public long countResponses(Long taskId) {
        return taskResponseRepository.countByTaskId(taskId);
    }

    public List<TaskResponseEntity> listResponses(Long taskId) {
        getTask(taskId);
        return taskResponseRepository.findByTaskId(taskId);
    }
}
