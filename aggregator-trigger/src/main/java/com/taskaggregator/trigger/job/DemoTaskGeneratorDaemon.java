package com.taskaggregator.trigger.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskaggregator.trigger.application.command.TaskIntakeCommandService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;

/**
 * 演示用任务生成器：定期录入一个随机旅行商坐标点任务，默认关闭。
 */
@Slf4j
@Component
public class DemoTaskGeneratorDaemon {

    static final int COORDINATE_BOUND = 100;

    private final TaskIntakeCommandService taskIntakeCommandService;
    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final int points;

    public DemoTaskGeneratorDaemon(TaskIntakeCommandService taskIntakeCommandService,
                                   ObjectMapper objectMapper,
                                   @Value("${task.generator.enabled:false}") boolean enabled,
                                   @Value("${task.generator.points:10}") int points) {
        this.taskIntakeCommandService = taskIntakeCommandService;
        this.objectMapper = objectMapper;
        this.enabled = enabled;
        this.points = points > 0 ? points : 10;
    }

    @Scheduled(fixedDelayString = "${task.generator.interval-ms:2000}", scheduler = "daemonScheduler")
    public void generate() {
        if (!enabled) {
            return;
        }
        try {
            taskIntakeCommandService.createTask(generateInput());
        } catch (Exception ex) {
            log.warn("DEMO_TASK_GENERATE_FAILED error={}", ex.getMessage());
        }
    }

    /**
     * [[x, y], ...]，坐标取值 [0, 100)
     */
    public String generateInput() throws JsonProcessingException {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        int[][] coordinates = new int[points][];
        for (int i = 0; i < points; i++) {
            coordinates[i] = new int[]{random.nextInt(COORDINATE_BOUND), random.nextInt(COORDINATE_BOUND)};
        }
        return objectMapper.writeValueAsString(coordinates);
    }
}
