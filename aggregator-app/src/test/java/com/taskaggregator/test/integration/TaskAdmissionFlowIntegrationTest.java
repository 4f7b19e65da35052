package com.taskaggregator.test.integration;

import com.taskaggregator.Application;
import com.taskaggregator.domain.task.adapter.repository.ITaskRepository;
import com.taskaggregator.domain.task.model.entity.TaskEntity;
import com.taskaggregator.test.support.OperatorKeys;
import com.taskaggregator.trigger.application.command.TaskIntakeCommandService;
import com.taskaggregator.trigger.application.command.TaskResponseAdmissionService;
import com.taskaggregator.types.enums.ResponseCode;
import com.taskaggregator.types.enums.TaskEvaluationOutcomeEnum;
import com.taskaggregator.types.enums.TaskStatusEnum;
import com.taskaggregator.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfSystemProperty;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

@SpringBootTest(
        classes = Application.class,
        webEnvironment = SpringBootTest.WebEnvironment.NONE
)
@EnabledIfSystemProperty(named = "it.docker.enabled", matches = "true")
public class TaskAdmissionFlowIntegrationTest extends PostgresIntegrationTestSupport {

    private static final OperatorKeys KEYS = OperatorKeys.generate(1L, 2L, 3L);

    @Autowired
    private TaskIntakeCommandService taskIntakeCommandService;

    @Autowired
    private TaskResponseAdmissionService taskResponseAdmissionService;

    @Autowired
    private ITaskRepository taskRepository;

    @DynamicPropertySource
    static void registerOperators(DynamicPropertyRegistry registry) {
        for (long operatorId = 1; operatorId <= 3; operatorId++) {
            int index = (int) operatorId - 1;
            long id = operatorId;
            registry.add("operator.registry.operators[" + index + "].id", () -> id);
            registry.add("operator.registry.operators[" + index + "].public-key",
                    () -> OperatorKeys.encodePublicKey(KEYS.keyPair(id)));
        }
    }

    @Test
    public void shouldFinalizeTaskWhenAllOperatorsAgree() {
        Long taskId = taskIntakeCommandService.createTask("[[1,2],[3,4]]").getId();

        Assertions.assertEquals(TaskEvaluationOutcomeEnum.DEFERRED,
                admit(taskId, 1L, "route-a").evaluation().outcome());
        Assertions.assertEquals(TaskEvaluationOutcomeEnum.DEFERRED,
                admit(taskId, 2L, "route-a").evaluation().outcome());
        Assertions.assertEquals(TaskEvaluationOutcomeEnum.FINALIZED,
                admit(taskId, 3L, "route-a").evaluation().outcome());

        TaskEntity stored = taskRepository.findById(taskId);
        Assertions.assertEquals(TaskStatusEnum.COMPLETED, stored.getStatus());
        Assertions.assertEquals("route-a", stored.getResponse());
    }

    @Test
    public void shouldMarkConsensusNotReachedWhenOperatorsDisagree() {
        Long taskId = taskIntakeCommandService.createTask("[[5,6]]").getId();

        admit(taskId, 1L, "route-a");
        admit(taskId, 2L, "route-b");
        Assertions.assertEquals(TaskEvaluationOutcomeEnum.UNDECIDABLE,
                admit(taskId, 3L, "route-a").evaluation().outcome());

        TaskEntity stored = taskRepository.findById(taskId);
        Assertions.assertEquals(TaskStatusEnum.CONSENSUS_NOT_REACHED, stored.getStatus());
        Assertions.assertNull(stored.getResponse());
    }

    @Test
    public void shouldRejectTamperedResponse() {
        Long taskId = taskIntakeCommandService.createTask("[[5,6]]").getId();

        AppException ex = Assertions.assertThrows(AppException.class, () -> taskResponseAdmissionService.admit(
                taskId, 1L, "route-b", KEYS.sign(1L, taskId, "route-a")));

        Assertions.assertTrue(ex.is(ResponseCode.INVALID_SIGNATURE));
        Integer rows = jdbcTemplate.queryForObject("SELECT COUNT(1) FROM task_response", Integer.class);
        Assertions.assertEquals(0, rows);
    }

    private TaskResponseAdmissionService.AdmissionResult admit(Long taskId, Long operatorId, String response) {
        return taskResponseAdmissionService.admit(taskId, operatorId, response, KEYS.sign(operatorId, taskId, response));
    }
}
