package com.taskaggregator.infrastructure.gateway.operator;

import com.taskaggregator.domain.operator.adapter.gateway.IResponseAuthenticator;
import com.taskaggregator.infrastructure.util.JsonCodec;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;
import java.util.Base64;

/**
 * SHA256withECDSA 签名校验。
 * <p>
 * 签名对象为 {@link JsonCodec#writeCanonicalResponseMessage(Long, String)} 生成的 UTF-8 字节，
 * 签名本身为 Base64 编码的 DER。
 * </p>
 *
 * @author getoffer
 * @since 2026-10-19
 */
@Slf4j
@Component
public class EcdsaResponseAuthenticator implements IResponseAuthenticator {

    static final String SIGNATURE_ALGORITHM = "SHA256withECDSA";

    private final OperatorKeyRegistry keyRegistry;
    private final JsonCodec jsonCodec;

    public EcdsaResponseAuthenticator(OperatorKeyRegistry keyRegistry, JsonCodec jsonCodec) {
        this.keyRegistry = keyRegistry;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public boolean verify(Long taskId, String response, Long operatorId, String signature) {
        if (taskId == null || response == null || StringUtils.isBlank(signature)) {
            return false;
        }
        PublicKey publicKey = keyRegistry.findPublicKey(operatorId);
        if (publicKey == null) {
            log.debug("SIGNATURE_VERIFY_NO_KEY operatorId={}", operatorId);
            return false;
        }

        byte[] signatureBytes;
        try {
            signatureBytes = Base64.getDecoder().decode(signature.trim());
        } catch (IllegalArgumentException ex) {
            log.debug("SIGNATURE_VERIFY_MALFORMED operatorId={}, taskId={}", operatorId, taskId);
            return false;
        }

        byte[] message = jsonCodec.writeCanonicalResponseMessage(taskId, response).getBytes(StandardCharsets.UTF_8);
        try {
            Signature verifier = Signature.getInstance(SIGNATURE_ALGORITHM);
            verifier.initVerify(publicKey);
            verifier.update(message);
            return verifier.verify(signatureBytes);
        } catch (SignatureException ex) {
            // DER 结构损坏
            log.debug("SIGNATURE_VERIFY_MALFORMED operatorId={}, taskId={}, error={}", operatorId, taskId, ex.getMessage());
            return false;
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("Signature verifier unavailable: " + SIGNATURE_ALGORITHM, ex);
        }
    }
}
