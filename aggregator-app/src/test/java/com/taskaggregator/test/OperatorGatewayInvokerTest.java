package com.taskaggregator.test;

import com.taskaggregator.domain.operator.adapter.gateway.IResponseAuthenticator;
import com.taskaggregator.test.support.StaticOperatorDirectory;
import com.taskaggregator.trigger.application.common.OperatorGatewayInvoker;
import com.taskaggregator.types.exception.CollaboratorUnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class OperatorGatewayInvokerTest {

    private ExecutorService executor;

    @BeforeEach
    public void setUp() {
        this.executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    @Test
    public void shouldDelegateToCollaborators() {
        IResponseAuthenticator authenticator = (taskId, response, operatorId, signature) -> "ok".equals(signature);
        OperatorGatewayInvoker invoker = new OperatorGatewayInvoker(
                new StaticOperatorDirectory(1L, 2L), authenticator, executor, 500L);

        Assertions.assertEquals(2, invoker.currentOperatorCount());
        Assertions.assertTrue(invoker.isEligible(1L));
        Assertions.assertFalse(invoker.isEligible(3L));
        Assertions.assertTrue(invoker.verify(1L, "42", 1L, "ok"));
        Assertions.assertFalse(invoker.verify(1L, "42", 1L, "bad"));
    }

    @Test
    public void shouldConvertAuthenticatorTimeout() {
        IResponseAuthenticator slow = (taskId, response, operatorId, signature) -> {
            try {
                Thread.sleep(2_000L);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return true;
        };
        OperatorGatewayInvoker invoker = new OperatorGatewayInvoker(
                new StaticOperatorDirectory(1L), slow, executor, 50L);

        CollaboratorUnavailableException ex = Assertions.assertThrows(CollaboratorUnavailableException.class,
                () -> invoker.verify(1L, "42", 1L, "sig"));

        Assertions.assertEquals(OperatorGatewayInvoker.RESPONSE_AUTHENTICATOR, ex.getCollaborator());
        Assertions.assertTrue(ex.isRetriable());
    }

    @Test
    public void shouldConvertAuthenticatorFailure() {
        IResponseAuthenticator authenticator = mock(IResponseAuthenticator.class);
        when(authenticator.verify(any(), any(), any(), any())).thenThrow(new IllegalStateException("hsm offline"));
        OperatorGatewayInvoker invoker = new OperatorGatewayInvoker(
                new StaticOperatorDirectory(1L), authenticator, executor, 500L);

        CollaboratorUnavailableException ex = Assertions.assertThrows(CollaboratorUnavailableException.class,
                () -> invoker.verify(1L, "42", 1L, "sig"));

        Assertions.assertTrue(ex.getCause() instanceof IllegalStateException);
    }

    @Test
    public void shouldConvertRejectedSubmission() {
        ExecutorService rejecting = mock(ExecutorService.class);
        when(rejecting.submit(any(Callable.class))).thenThrow(new RejectedExecutionException("full"));
        OperatorGatewayInvoker invoker = new OperatorGatewayInvoker(
                new StaticOperatorDirectory(1L), (t, r, o, s) -> true, rejecting, 500L);

        Assertions.assertThrows(CollaboratorUnavailableException.class, invoker::currentOperatorCount);
    }
}
