package com.taskaggregator.config;

import com.taskaggregator.domain.task.model.valobj.QuorumThreshold;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 将共识门槛配置转换为不可变的 {@link QuorumThreshold}，在构造时注入判定服务。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(QuorumProperties.class)
public class QuorumConfig {

    @Bean
    public QuorumThreshold quorumThreshold(QuorumProperties properties) {
        QuorumThreshold threshold = new QuorumThreshold(
                properties.getParticipationThresholdBps(),
                properties.getContentThresholdBps());
        log.info("QUORUM_THRESHOLD_LOADED participationBps={}, contentBps={}",
                threshold.participationBps(), threshold.contentBps());
        return threshold;
    }
}
