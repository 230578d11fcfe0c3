package com.ryuqq.connector.core.exception;

/**
 * 최대 재시도 횟수를 모두 소진했을 때 발생.
 *
 * <p>마지막 시도의 예외를 cause로 가집니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class RetryExhaustedException extends ConnectorException {

    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastFailure) {
        super(
            "RETRY_EXHAUSTED",
            ErrorCategory.UNAVAILABLE,
            false,
            String.format("max retry attempts (%d) exceeded: %s", attempts, describe(lastFailure)),
            lastFailure
        );
        this.attempts = attempts;
    }

    static String describe(Throwable failure) {
        if (failure == null) {
            return "no failure recorded";
        }
        return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
    }

    public int getAttempts() {
        return attempts;
    }
}
