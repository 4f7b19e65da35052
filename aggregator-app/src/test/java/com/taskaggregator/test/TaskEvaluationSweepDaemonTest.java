package com.taskaggregator.test;

import com.taskaggregator.domain.task.model.entity.TaskEntity;
import com.taskaggregator.domain.task.model.entity.TaskResponseEntity;
import com.taskaggregator.domain.task.model.valobj.QuorumThreshold;
import com.taskaggregator.domain.task.service.QuorumPolicyDomainService;
import com.taskaggregator.test.support.InMemoryTaskRepository;
import com.taskaggregator.test.support.InMemoryTaskResponseRepository;
import com.taskaggregator.test.support.StaticOperatorDirectory;
import com.taskaggregator.trigger.application.command.TaskEvaluationApplicationService;
import com.taskaggregator.trigger.application.common.OperatorGatewayInvoker;
import com.taskaggregator.trigger.job.TaskEvaluationSweepDaemon;
import com.taskaggregator.types.enums.TaskEvaluationOutcomeEnum;
import com.taskaggregator.types.enums.TaskStatusEnum;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class TaskEvaluationSweepDaemonTest {

    private ExecutorService gatewayExecutor;
    private InMemoryTaskResponseRepository responseRepository;
    private InMemoryTaskRepository taskRepository;
    private StaticOperatorDirectory directory;
    private TaskEvaluationApplicationService evaluationService;

    @BeforeEach
    public void setUp() {
        this.gatewayExecutor = Executors.newCachedThreadPool();
        this.responseRepository = new InMemoryTaskResponseRepository();
        this.taskRepository = new InMemoryTaskRepository(responseRepository);
        this.directory = StaticOperatorDirectory.ofRange(1L, 3);
        OperatorGatewayInvoker invoker = new OperatorGatewayInvoker(
                directory, (task, response, operator, signature) -> true, gatewayExecutor, 1_000L);
        this.evaluationService = new TaskEvaluationApplicationService(
                taskRepository, responseRepository, new QuorumPolicyDomainService(QuorumThreshold.defaults()), invoker);
    }

    @AfterEach
    public void tearDown() {
        gatewayExecutor.shutdownNow();
    }

    @Test
    public void shouldFinalizeTaskAfterOperatorSetShrinks() {
        Long taskId = taskRepository.save(TaskEntity.create("input", 1_000L)).getId();
        Long untouched = taskRepository.save(TaskEntity.create("input", 2_000L)).getId();
        answer(taskId, 1L, "42");
        answer(taskId, 2L, "42");
        TaskEvaluationSweepDaemon daemon = new TaskEvaluationSweepDaemon(taskRepository, evaluationService, true, 10);

        TaskEvaluationSweepDaemon.SweepResult before = daemon.sweepOnce();
        Assertions.assertEquals(1, before.scanned());
        Assertions.assertEquals(1, before.count(TaskEvaluationOutcomeEnum.DEFERRED));

        directory.remove(3L);
        TaskEvaluationSweepDaemon.SweepResult after = daemon.sweepOnce();

        Assertions.assertEquals(1, after.count(TaskEvaluationOutcomeEnum.FINALIZED));
        Assertions.assertEquals(TaskStatusEnum.COMPLETED, taskRepository.findById(taskId).getStatus());
        Assertions.assertEquals(TaskStatusEnum.READY, taskRepository.findById(untouched).getStatus());
        Assertions.assertEquals(0, daemon.sweepOnce().scanned());
    }

    @Test
    public void shouldContinueSweepWhenOneTaskFails() {
        Long first = taskRepository.save(TaskEntity.create("input", 1_000L)).getId();
        Long second = taskRepository.save(TaskEntity.create("input", 2_000L)).getId();
        answer(first, 1L, "42");
        answer(second, 1L, "42");
        TaskEvaluationApplicationService flaky = mock(TaskEvaluationApplicationService.class);
        when(flaky.evaluate(any())).thenThrow(new IllegalStateException("boom"))
                .thenAnswer(invocation -> evaluationService.evaluate(invocation.getArgument(0)));
        TaskEvaluationSweepDaemon daemon = new TaskEvaluationSweepDaemon(taskRepository, flaky, true, 10);

        TaskEvaluationSweepDaemon.SweepResult result = daemon.sweepOnce();

        Assertions.assertEquals(2, result.scanned());
        Assertions.assertEquals(1, result.errorCount());
        Assertions.assertEquals(1, result.count(TaskEvaluationOutcomeEnum.DEFERRED));
    }

    @Test
    public void shouldRespectBatchSize() {
        for (int i = 0; i < 5; i++) {
            Long taskId = taskRepository.save(TaskEntity.create("input", 1_000L + i)).getId();
            answer(taskId, 1L, "42");
        }
        TaskEvaluationSweepDaemon daemon = new TaskEvaluationSweepDaemon(taskRepository, evaluationService, true, 2);

        Assertions.assertEquals(2, daemon.sweepOnce().scanned());
    }

    @Test
    public void shouldReachNewerTasksBehindLongDeferredOnes() {
        StaticOperatorDirectory tenOperators = StaticOperatorDirectory.ofRange(1L, 10);
        OperatorGatewayInvoker invoker = new OperatorGatewayInvoker(
                tenOperators, (task, response, operator, signature) -> true, gatewayExecutor, 1_000L);
        TaskEvaluationApplicationService service = new TaskEvaluationApplicationService(
                taskRepository, responseRepository, new QuorumPolicyDomainService(QuorumThreshold.defaults()), invoker);
        Long slowFirst = taskRepository.save(TaskEntity.create("input", 1_000L)).getId();
        Long slowSecond = taskRepository.save(TaskEntity.create("input", 2_000L)).getId();
        Long complete = taskRepository.save(TaskEntity.create("input", 3_000L)).getId();
        answer(slowFirst, 1L, "42");
        answer(slowSecond, 1L, "42");
        for (long operatorId = 1; operatorId <= 9; operatorId++) {
            answer(complete, operatorId, "42");
        }
        TaskEvaluationSweepDaemon daemon = new TaskEvaluationSweepDaemon(taskRepository, service, true, 2);

        TaskEvaluationSweepDaemon.SweepResult firstPage = daemon.sweepOnce();
        Assertions.assertEquals(2, firstPage.count(TaskEvaluationOutcomeEnum.DEFERRED));
        Assertions.assertEquals(TaskStatusEnum.READY, taskRepository.findById(complete).getStatus());

        TaskEvaluationSweepDaemon.SweepResult secondPage = daemon.sweepOnce();
        Assertions.assertEquals(1, secondPage.count(TaskEvaluationOutcomeEnum.FINALIZED));
        Assertions.assertEquals(TaskStatusEnum.COMPLETED, taskRepository.findById(complete).getStatus());

        // 末页不足一页，下一轮回到最早的任务
        TaskEvaluationSweepDaemon.SweepResult wrapped = daemon.sweepOnce();
        Assertions.assertEquals(2, wrapped.scanned());
        Assertions.assertEquals(2, wrapped.count(TaskEvaluationOutcomeEnum.DEFERRED));
    }

    private void answer(Long taskId, Long operatorId, String response) {
        responseRepository.insertIfAbsent(TaskResponseEntity.of(taskId, operatorId, response, "sig", System.currentTimeMillis()));
    }
}
