package com.ryuqq.connector.core.retry;

import com.ryuqq.connector.core.exception.ConnectorException;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * 자주 쓰는 재시도 가능 예외 판단 규칙.
 *
 * @author Connector Team
 * @since 1.0.0
 */
public final class RetryableErrors {

    private static final List<String> TRANSIENT_PATTERNS = List.of(
        "connection",
        "timeout",
        "network",
        "temporary",
        "unavailable",
        "broken pipe"
    );

    private RetryableErrors() {
    }

    /**
     * 모든 예외를 재시도합니다.
     */
    public static Predicate<Throwable> all() {
        return error -> true;
    }

    /**
     * 어떤 예외도 재시도하지 않습니다.
     */
    public static Predicate<Throwable> none() {
        return error -> false;
    }

    /**
     * 일시적 장애로 보이는 예외만 재시도합니다.
     *
     * <p>원인 체인을 따라가며 다음 중 하나면 재시도 대상입니다:</p>
     * <ul>
     *   <li>{@link ConnectorException}: {@code isRetryable()} 값을 따름 (가장 먼저 만난 것)</li>
     *   <li>{@link IOException}, {@link TimeoutException}</li>
     *   <li>메시지에 connection, timeout, network, temporary, unavailable, broken pipe
     *       (대소문자 무시) 또는 EOF가 포함된 경우</li>
     * </ul>
     */
    public static Predicate<Throwable> transientErrors() {
        return RetryableErrors::isTransient;
    }

    private static boolean isTransient(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (current instanceof ConnectorException) {
                return ((ConnectorException) current).isRetryable();
            }
            if (current instanceof IOException || current instanceof TimeoutException) {
                return true;
            }
            if (matchesTransientMessage(current.getMessage())) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    private static boolean matchesTransientMessage(String message) {
        if (message == null || message.isEmpty()) {
            return false;
        }
        if (message.contains("EOF")) {
            return true;
        }
        String lower = message.toLowerCase();
        for (String pattern : TRANSIENT_PATTERNS) {
            if (lower.contains(pattern)) {
                return true;
            }
        }
        return false;
    }
}
