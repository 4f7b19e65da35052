package com.taskaggregator.config;

import com.taskaggregator.types.common.Constants;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 共识门槛配置，单位为基点 (10000 = 100%)。
 */
@Data
@Validated
@ConfigurationProperties(prefix = "quorum")
public class QuorumProperties {

    /** 参与度门槛，默认 9000。 */
    @Min(1)
    @Max(10_000)
    private int participationThresholdBps = Constants.DEFAULT_PARTICIPATION_THRESHOLD_BPS;

    /** 内容一致性门槛，默认 9000。 */
    @Min(1)
    @Max(10_000)
    private int contentThresholdBps = Constants.DEFAULT_CONTENT_THRESHOLD_BPS;
}
