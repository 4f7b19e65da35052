package com.taskaggregator.trigger.application.common;

import com.taskaggregator.api.dto.TaskDTO;
import com.taskaggregator.api.dto.TaskDetailDTO;
import com.taskaggregator.api.dto.TaskEvaluationDTO;
import com.taskaggregator.api.dto.TaskResponseDTO;
import com.taskaggregator.domain.task.model.entity.TaskEntity;
import com.taskaggregator.domain.task.model.entity.TaskResponseEntity;
import com.taskaggregator.domain.task.model.valobj.TaskEvaluationResult;

/**
 * 任务视图组装：领域对象 → HTTP DTO。
 */
public final class TaskViewAssembler {

    private TaskViewAssembler() {
    }

    public static TaskDTO toTaskDTO(TaskEntity task) {
        if (task == null) {
            return null;
        }
        TaskDTO dto = new TaskDTO();
        dto.setId(task.getId());
        dto.setCreatedAt(task.getCreatedAt());
        dto.setInput(task.getInput());
        return dto;
    }

    public static TaskDetailDTO toTaskDetailDTO(TaskEntity task, long responsesCount) {
        if (task == null) {
            return null;
        }
        TaskDetailDTO dto = new TaskDetailDTO();
        dto.setId(task.getId());
        dto.setStatus(task.getStatus() == null ? null : task.getStatus().getCode());
        dto.setCreatedAt(task.getCreatedAt());
        dto.setInput(task.getInput());
        dto.setResponse(task.getResponse());
        dto.setFinalizedAt(task.getFinalizedAt());
        dto.setResponsesCount(responsesCount);
        return dto;
    }

    public static TaskResponseDTO toTaskResponseDTO(TaskResponseEntity response) {
        if (response == null) {
            return null;
        }
        TaskResponseDTO dto = new TaskResponseDTO();
        dto.setId(response.getId());
        dto.setTaskId(response.getTaskId());
        dto.setOperatorId(response.getOperatorId());
        dto.setResponse(response.getResponse());
        dto.setSignature(response.getSignature());
        dto.setCreatedAt(response.getCreatedAt());
        return dto;
    }

    public static TaskEvaluationDTO toEvaluationDTO(TaskEvaluationResult result) {
        if (result == null) {
            return null;
        }
        TaskEvaluationDTO dto = new TaskEvaluationDTO();
        dto.setOutcome(result.outcome().getCode());
        dto.setTaskId(result.taskId());
        dto.setResponsesCount(result.responsesCount());
        dto.setOperatorsCount(result.operatorsCount());
        dto.setQuorum(result.quorum());
        dto.setResponse(result.response());
        dto.setMessage(describe(result));
        return dto;
    }

    private static String describe(TaskEvaluationResult result) {
        switch (result.outcome()) {
            case FINALIZED:
                return "consensus reached";
            case DEFERRED:
                return "waiting for " + Math.max(result.quorum() - result.responsesCount(), 0L)
                        + " more response(s), quorum " + result.quorum() + " of " + result.operatorsCount()
                        + " (threshold rounded up)";
            case UNDECIDABLE:
                return "consensus not reached";
            case ALREADY_FINALIZED:
                return "task already finalized";
            default:
                return null;
        }
    }
}
