package com.taskaggregator.infrastructure.gateway.operator;

import com.taskaggregator.infrastructure.gateway.operator.config.OperatorRegistryProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 启动时解析 Operator 公钥，配置错误直接启动失败。
 *
 * @author getoffer
 * @since 2026-10-19
 */
@Slf4j
@Component
public class OperatorKeyRegistry {

    static final String KEY_ALGORITHM = "EC";

    private final Map<Long, PublicKey> publicKeys;
    private final Map<Long, Boolean> eligibility;

    public OperatorKeyRegistry(OperatorRegistryProperties properties) {
        Map<Long, PublicKey> keys = new LinkedHashMap<>();
        Map<Long, Boolean> enabled = new LinkedHashMap<>();
        List<OperatorRegistryProperties.OperatorDefinition> definitions =
                properties == null || properties.getOperators() == null
                        ? Collections.emptyList() : properties.getOperators();
        for (OperatorRegistryProperties.OperatorDefinition definition : definitions) {
            if (definition == null || definition.getId() == null) {
                throw new IllegalStateException("operator.registry.operators[].id is required");
            }
            if (keys.containsKey(definition.getId())) {
                throw new IllegalStateException("Duplicate operator id in registry: " + definition.getId());
            }
            keys.put(definition.getId(), parsePublicKey(definition.getId(), definition.getPublicKey()));
            enabled.put(definition.getId(), definition.isEnabled());
        }
        this.publicKeys = Collections.unmodifiableMap(keys);
        this.eligibility = Collections.unmodifiableMap(enabled);
        log.info("OPERATOR_REGISTRY_LOADED registered={}, eligible={}", publicKeys.size(), countEligible());
    }

    public PublicKey findPublicKey(Long operatorId) {
        return operatorId == null ? null : publicKeys.get(operatorId);
    }

    public boolean isEligible(Long operatorId) {
        return operatorId != null && Boolean.TRUE.equals(eligibility.get(operatorId));
    }

    public int countEligible() {
        int count = 0;
        for (Boolean value : eligibility.values()) {
            if (Boolean.TRUE.equals(value)) {
                count++;
            }
        }
        return count;
    }

    private PublicKey parsePublicKey(Long operatorId, String encoded) {
        if (StringUtils.isBlank(encoded)) {
            throw new IllegalStateException("Operator " + operatorId + " has no publicKey");
        }
        try {
            byte[] der = Base64.getDecoder().decode(encoded.trim());
            return KeyFactory.getInstance(KEY_ALGORITHM).generatePublic(new X509EncodedKeySpec(der));
        } catch (IllegalArgumentException | GeneralSecurityException ex) {
            throw new IllegalStateException("Operator " + operatorId + " has an invalid publicKey", ex);
        }
    }
}
