package com.ryuqq.connector.core.exception;

/**
 * 재시도 대기 중 호출자의 취소 신호 또는 인터럽트로 중단되었을 때 발생.
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class RetryCancelledException extends ConnectorException {

    private final int attempts;

    public RetryCancelledException(int attempts, Throwable lastFailure) {
        super(
            "RETRY_CANCELLED",
            ErrorCategory.CANCELLED,
            false,
            String.format("retry cancelled after %d attempt(s): %s", attempts, RetryExhaustedException.describe(lastFailure)),
            lastFailure
        );
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
