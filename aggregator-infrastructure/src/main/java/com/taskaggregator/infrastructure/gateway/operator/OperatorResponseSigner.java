package com.taskaggregator.infrastructure.gateway.operator;

import com.taskaggregator.infrastructure.util.JsonCodec;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.Signature;
import java.util.Base64;

/**
 * Operator 侧签名工具，与 {@link EcdsaResponseAuthenticator} 使用同一规范消息。
 */
@Component
public class OperatorResponseSigner {

    private final JsonCodec jsonCodec;

    public OperatorResponseSigner(JsonCodec jsonCodec) {
        this.jsonCodec = jsonCodec;
    }

    public String sign(Long taskId, String response, PrivateKey privateKey) {
        byte[] message = jsonCodec.writeCanonicalResponseMessage(taskId, response).getBytes(StandardCharsets.UTF_8);
        try {
            Signature signer = Signature.getInstance(EcdsaResponseAuthenticator.SIGNATURE_ALGORITHM);
            signer.initSign(privateKey);
            signer.update(message);
            return Base64.getEncoder().encodeToString(signer.sign());
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("Failed to sign response for task " + taskId, ex);
        }
    }
}
