package com.ryuqq.connector.core.executor;

/**
 * 보호 대상이 되는 단일 백엔드 호출.
 *
 * <p>Circuit Breaker와 Retry Executor가 감싸는 작업 단위입니다.
 * checked 예외를 던질 수 있으며, 예외가 발생하면 실패로 집계됩니다.</p>
 *
 * @param <T> 호출 결과 타입
 * @author Connector Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface BackendCall<T> {

    /**
     * 백엔드 호출 실행.
     *
     * @return 호출 결과
     * @throws Exception 호출 실패 시
     */
    T call() throws Exception;

    /**
     * 반환값이 없는 호출을 BackendCall로 변환.
     *
     * @param runnable 실행할 작업
     * @return 항상 null을 반환하는 BackendCall
     */
    static BackendCall<Void> of(CheckedRunnable runnable) {
        return () -> {
            runnable.run();
            return null;
        };
    }

    /**
     * 반환값이 없는 checked 작업.
     */
    @FunctionalInterface
    interface CheckedRunnable {
        void run() throws Exception;
    }
}
