package com.taskaggregator.infrastructure.gateway.operator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Operator 注册表配置。
 */
@Data
@Component
@ConfigurationProperties(prefix = "operator.registry", ignoreInvalidFields = true)
public class OperatorRegistryProperties {

    /** 已注册的 Operator 列表。 */
    private List<OperatorDefinition> operators = new ArrayList<>();

    @Data
    public static class OperatorDefinition {

        /** Operator ID */
        private Long id;

        /** Base64 编码的 X.509 EC 公钥。 */
        private String publicKey;

        /** 是否具备响应资格，false 时仍保留在注册表中但不计入 N。 */
        private boolean enabled = true;
    }
}
