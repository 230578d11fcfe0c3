package com.ryuqq.connector.core.retry;

import com.ryuqq.connector.core.exception.BackendCallException;
import com.ryuqq.connector.core.exception.ConnectorNotFoundException;
import com.ryuqq.connector.core.model.ConnectorKey;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RetryableErrors 테스트.
 *
 * @author Connector Team
 * @since 1.0.0
 */
class RetryableErrorsTest {

    private final Predicate<Throwable> transientErrors = RetryableErrors.transientErrors();

    @Test
    void transientErrors_IOExceptionAndTimeout_AreRetryable() {
        assertTrue(transientErrors.test(new ConnectException("refused")));
        assertTrue(transientErrors.test(new IOException("whatever")));
        assertTrue(transientErrors.test(new TimeoutException()));
    }

    @Test
    void transientErrors_MessagePatterns_AreRetryable() {
        assertTrue(transientErrors.test(new IllegalStateException("Connection reset by peer")));
        assertTrue(transientErrors.test(new IllegalStateException("service temporarily UNAVAILABLE")));
        assertTrue(transientErrors.test(new IllegalStateException("write: broken pipe")));
        assertTrue(transientErrors.test(new IllegalStateException("unexpected EOF")));
    }

    @Test
    void transientErrors_UnrelatedMessage_IsNotRetryable() {
        assertFalse(transientErrors.test(new IllegalArgumentException("invalid sku")));
        assertFalse(transientErrors.test(new IllegalStateException()));
    }

    @Test
    void transientErrors_ConnectorException_FollowsRetryableFlag() {
        assertTrue(transientErrors.test(BackendCallException.ofStatus("getProducts", 503, "")));
        assertFalse(transientErrors.test(BackendCallException.ofStatus("getProducts", 400, "bad request timeout")));
        assertFalse(transientErrors.test(new ConnectorNotFoundException(ConnectorKey.of("t", "s", "d"))));
    }

    @Test
    void transientErrors_WalksCauseChain() {
        RuntimeException wrapped = new RuntimeException("wrapper", new IOException("reset"));

        assertTrue(transientErrors.test(wrapped));
    }

    @Test
    void allAndNone_AreConstant() {
        assertTrue(RetryableErrors.all().test(new IllegalArgumentException()));
        assertFalse(RetryableErrors.none().test(new IOException()));
    }
}
