package com.taskaggregator.trigger.http;

import com.taskaggregator.api.dto.TaskCreateRequestDTO;
import com.taskaggregator.api.dto.TaskDTO;
import com.taskaggregator.api.dto.TaskDetailDTO;
import com.taskaggregator.api.dto.TaskEvaluationDTO;
import com.taskaggregator.api.dto.TaskResponseDTO;
import com.taskaggregator.api.dto.TaskResponseSubmitRequestDTO;
import com.taskaggregator.api.dto.TaskResponseSubmitResponseDTO;
import com.taskaggregator.api.response.Response;
import com.taskaggregator.domain.task.model.entity.TaskEntity;
import com.taskaggregator.trigger.application.command.TaskEvaluationApplicationService;
import com.taskaggregator.trigger.application.command.TaskIntakeCommandService;
import com.taskaggregator.trigger.application.command.TaskResponseAdmissionService;
import com.taskaggregator.trigger.application.common.TaskViewAssembler;
import com.taskaggregator.trigger.application.query.TaskDispatchQueryService;
import com.taskaggregator.types.enums.ResponseCode;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 任务 API：录入、响应提交、判定与查询。
 */
@RestController
@RequestMapping("/api/tasks")
public class TaskController {

    private final TaskIntakeCommandService taskIntakeCommandService;
    private final TaskResponseAdmissionService taskResponseAdmissionService;
    private final TaskEvaluationApplicationService taskEvaluationApplicationService;
    private final TaskDispatchQueryService taskDispatchQueryService;

    public TaskController(TaskIntakeCommandService taskIntakeCommandService,
                          TaskResponseAdmissionService taskResponseAdmissionService,
                          TaskEvaluationApplicationService taskEvaluationApplicationService,
                          TaskDispatchQueryService taskDispatchQueryService) {
        this.taskIntakeCommandService = taskIntakeCommandService;
        this.taskResponseAdmissionService = taskResponseAdmissionService;
        this.taskEvaluationApplicationService = taskEvaluationApplicationService;
        this.taskDispatchQueryService = taskDispatchQueryService;
    }

    @PostMapping
    public Response<TaskDTO> createTask(@Valid @RequestBody TaskCreateRequestDTO request) {
        TaskEntity task = taskIntakeCommandService.createTask(request.getInput());
        return success(TaskViewAssembler.toTaskDTO(task));
    }

    @GetMapping("/{taskId}")
    public Response<TaskDetailDTO> getTask(@PathVariable("taskId") Long taskId) {
        TaskEntity task = taskDispatchQueryService.getTask(taskId);
        return success(TaskViewAssembler.toTaskDetailDTO(task, taskDispatchQueryService.countResponses(taskId)));
    }

    @GetMapping("/{taskId}/responses")
    public Response<List<TaskResponseDTO>> listResponses(@PathVariable("taskId") Long taskId) {
        List<TaskResponseDTO> data = taskDispatchQueryService.listResponses(taskId).stream()
                .map(TaskViewAssembler::toTaskResponseDTO)
                .collect(Collectors.toList());
        return success(data);
    }

    @PostMapping("/{taskId}/responses")
    public Response<TaskResponseSubmitResponseDTO> submitResponse(@PathVariable("taskId") Long taskId,
                                                                  @Valid @RequestBody TaskResponseSubmitRequestDTO request) {
        TaskResponseAdmissionService.AdmissionResult result = taskResponseAdmissionService.admit(
                taskId, request.getOperatorId(), request.getResponse(), request.getSignature());
        TaskResponseSubmitResponseDTO data = new TaskResponseSubmitResponseDTO();
        data.setTaskId(taskId);
        data.setResponseId(result.response().getId());
        data.setOperatorId(result.response().getOperatorId());
        data.setEvaluation(TaskViewAssembler.toEvaluationDTO(result.evaluation()));
        return success(data);
    }

    @PostMapping("/{taskId}/evaluate")
    public Response<TaskEvaluationDTO> evaluate(@PathVariable("taskId") Long taskId) {
        return success(TaskViewAssembler.toEvaluationDTO(taskEvaluationApplicationService.evaluate(taskId)));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
