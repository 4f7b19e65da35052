package com.taskaggregator.trigger.application.command;

import com.taskaggregator.domain.task.adapter.repository.ITaskRepository;
import com.taskaggregator.domain.task.model.entity.TaskEntity;
import com.taskaggregator.types.enums.ResponseCode;
import com.taskaggregator.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

/**
 * 任务录入写用例。
 */
@Slf4j
@Service
public class TaskIntakeCommandService {

    private final ITaskRepository taskRepository;

    public TaskIntakeCommandService(ITaskRepository taskRepository) {
        this.taskRepository = taskRepository;
    }

    public TaskEntity createTask(String input) {
        if (StringUtils.isBlank(input)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "input is required");
        }
        TaskEntity task = taskRepository.save(TaskEntity.create(input, System.currentTimeMillis()));
        log.info("TASK_CREATED taskId={}, createdAt={}", task.getId(), task.getCreatedAt());
        return task;
    }
}
