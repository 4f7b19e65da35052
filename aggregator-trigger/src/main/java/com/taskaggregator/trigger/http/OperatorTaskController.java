package com.taskaggregator.trigger.http;

import com.taskaggregator.api.dto.TaskDTO;
import com.taskaggregator.api.response.Response;
import com.taskaggregator.trigger.application.common.TaskViewAssembler;
import com.taskaggregator.trigger.application.query.TaskDispatchQueryService;
import com.taskaggregator.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator 拉取任务 API。没有可下发任务时 data 为 null。
 */
@RestController
@RequestMapping("/api/operators")
public class OperatorTaskController {

    private final TaskDispatchQueryService taskDispatchQueryService;

    public OperatorTaskController(TaskDispatchQueryService taskDispatchQueryService) {
        this.taskDispatchQueryService = taskDispatchQueryService;
    }

    @GetMapping("/{operatorId}/tasks/next")
    public Response<TaskDTO> nextTask(@PathVariable("operatorId") Long operatorId) {
        return Response.<TaskDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(TaskViewAssembler.toTaskDTO(taskDispatchQueryService.getNextReadyTask(operatorId)))
                .build();
    }
}
