package com.taskaggregator.trigger.application.common;

import com.taskaggregator.domain.operator.adapter.gateway.IOperatorDirectory;
import com.taskaggregator.domain.operator.adapter.gateway.IResponseAuthenticator;
import com.taskaggregator.types.exception.CollaboratorUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Operator 目录与签名校验的调用入口：每次调用都在独立线程池中执行并受超时约束。
 * <p>
 * 超时、中断、远端异常统一转换为 {@link CollaboratorUnavailableException}，
 * 不会被解释为"无资格"或"签名错误"。
 * </p>
 *
 * @author getoffer
 * @since 2026-10-19
 */
@Slf4j
@Component
public class OperatorGatewayInvoker {

    public static final String OPERATOR_DIRECTORY = "operator-directory";
    public static final String RESPONSE_AUTHENTICATOR = "response-authenticator";

    private final IOperatorDirectory operatorDirectory;
    private final IResponseAuthenticator responseAuthenticator;
    private final ExecutorService executor;
    private final long timeoutMs;

    public OperatorGatewayInvoker(IOperatorDirectory operatorDirectory,
                                  IResponseAuthenticator responseAuthenticator,
                                  @Qualifier("operatorGatewayExecutor") ExecutorService executor,
                                  @Value("${operator.gateway.timeout-ms:3000}") long timeoutMs) {
        this.operatorDirectory = operatorDirectory;
        this.responseAuthenticator = responseAuthenticator;
        this.executor = executor;
        this.timeoutMs = timeoutMs > 0 ? timeoutMs : 3000L;
    }

    public int currentOperatorCount() {
        Integer count = invoke(OPERATOR_DIRECTORY, operatorDirectory::currentOperatorCount);
        return count == null ? 0 : Math.max(count, 0);
    }

    public boolean isEligible(Long operatorId) {
        return Boolean.TRUE.equals(invoke(OPERATOR_DIRECTORY, () -> operatorDirectory.isEligible(operatorId)));
    }

    public boolean verify(Long taskId, String response, Long operatorId, String signature) {
        return Boolean.TRUE.equals(invoke(RESPONSE_AUTHENTICATOR,
                () -> responseAuthenticator.verify(taskId, response, operatorId, signature)));
    }

    private <T> T invoke(String collaborator, Callable<T> call) {
        Future<T> future;
        try {
            future = executor.submit(call);
        } catch (RejectedExecutionException ex) {
            log.warn("COLLABORATOR_UNAVAILABLE collaborator={}, reason=rejected", collaborator);
            throw new CollaboratorUnavailableException(collaborator, collaborator + " call rejected", ex);
        }
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("COLLABORATOR_UNAVAILABLE collaborator={}, reason=timeout, timeoutMs={}", collaborator, timeoutMs);
            throw new CollaboratorUnavailableException(collaborator,
                    collaborator + " timed out after " + timeoutMs + "ms", ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CollaboratorUnavailableException(collaborator, collaborator + " call interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.warn("COLLABORATOR_UNAVAILABLE collaborator={}, reason=error, error={}", collaborator, cause.getMessage());
            throw new CollaboratorUnavailableException(collaborator,
                    collaborator + " call failed: " + cause.getMessage(), cause);
        }
    }
}
