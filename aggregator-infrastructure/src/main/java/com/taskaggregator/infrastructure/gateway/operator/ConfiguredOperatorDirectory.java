package com.taskaggregator.infrastructure.gateway.operator;

import com.taskaggregator.domain.operator.adapter.gateway.IOperatorDirectory;
import org.springframework.stereotype.Component;

/**
 * 基于本地配置的 Operator 目录。
 */
@Component
public class ConfiguredOperatorDirectory implements IOperatorDirectory {

    private final OperatorKeyRegistry keyRegistry;

    public ConfiguredOperatorDirectory(OperatorKeyRegistry keyRegistry) {
        this.keyRegistry = keyRegistry;
    }

    @Override
    public int currentOperatorCount() {
        return keyRegistry.countEligible();
    }

    @Override
    public boolean isEligible(Long operatorId) {
        return keyRegistry.isEligible(operatorId);
    }
}
