package com.ryuqq.connector.adapter.resilience;

import com.ryuqq.connector.core.exception.BackendCallException;
import com.ryuqq.connector.core.exception.RetryCancelledException;
import com.ryuqq.connector.core.exception.RetryExhaustedException;
import com.ryuqq.connector.core.executor.BackendCall;
import com.ryuqq.connector.core.retry.CancellationToken;
import com.ryuqq.connector.core.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * RetryPolicy에 따라 백엔드 호출을 재시도하는 실행기.
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>매 시도 전 CancellationToken 확인</li>
 *   <li>성공 시 즉시 결과 반환</li>
 *   <li>재시도 불가 예외는 추가 시도 없이 그대로 전파</li>
 *   <li>재시도 가능 예외는 Exponential Backoff 대기 후 재시도</li>
 *   <li>maxAttempts 소진 시 {@link RetryExhaustedException} (마지막 예외를 cause로 포함)</li>
 *   <li>대기 중 취소/인터럽트 시 {@link RetryCancelledException}</li>
 * </ul>
 *
 * <p><strong>진행 중인 호출의 취소:</strong> 취소 가능한 토큰이 주어지면 각 시도는 별도 daemon 스레드에서 실행되고,
 * 호출 스레드는 결과 또는 토큰의 취소/타임아웃 중 먼저 오는 것을 기다립니다. 취소되면 시도 스레드를
 * 인터럽트하고 즉시 {@link RetryCancelledException}을 던집니다. {@link CancellationToken#none()}은
 * 호출 스레드에서 그대로 실행합니다.</p>
 *
 * <p>시도 횟수는 호출마다 지역 변수로 관리되므로 여러 스레드가 하나의 인스턴스를 공유해도 안전합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private static final AtomicInteger ATTEMPT_THREAD_SEQUENCE = new AtomicInteger();
    private static final ExecutorService ATTEMPT_EXECUTOR = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "connector-call-" + ATTEMPT_THREAD_SEQUENCE.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    private final RetryPolicy policy;
    private final BackoffCalculator backoffCalculator;

    public RetryExecutor(RetryPolicy policy) {
        this(policy, new BackoffCalculator(requirePolicy(policy)));
    }

    /**
     * 백오프 계산기를 지정하여 생성.
     *
     * @param policy 재시도 정책
     * @param backoffCalculator 대기 시간 계산기
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public RetryExecutor(RetryPolicy policy, BackoffCalculator backoffCalculator) {
        requirePolicy(policy);
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        this.policy = policy;
        this.backoffCalculator = backoffCalculator;
    }

    private static RetryPolicy requirePolicy(RetryPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        return policy;
    }

    /**
     * 취소 신호 없이 실행.
     *
     * @param call 실행할 호출
     * @param <T> 결과 타입
     * @return 호출 결과
     */
    public <T> T execute(BackendCall<T> call) {
        return execute(call, CancellationToken.none());
    }

    /**
     * 취소 신호를 확인하며 실행.
     *
     * @param call 실행할 호출
     * @param token 취소 신호
     * @param <T> 결과 타입
     * @return 호출 결과
     * @throws RetryExhaustedException 모든 시도가 재시도 가능 예외로 실패한 경우
     * @throws RetryCancelledException 취소 또는 인터럽트된 경우
     */
    public <T> T execute(BackendCall<T> call, CancellationToken token) {
        if (call == null) {
            throw new IllegalArgumentException("call cannot be null");
        }
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }

        Exception lastFailure = null;

        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            if (token.isCancelled()) {
                throw new RetryCancelledException(attempt - 1, lastFailure);
            }

            try {
                T result = invokeAttempt(call, token, attempt, lastFailure);
                if (attempt > 1) {
                    log.info("Operation succeeded after {} attempts", attempt);
                }
                return result;
            } catch (RetryCancelledException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RetryCancelledException(attempt, e);
            } catch (Exception e) {
                lastFailure = e;

                if (!policy.retryableErrors().test(e)) {
                    log.debug("Non-retryable error on attempt {}: {}", attempt, e.getMessage());
                    throw BackendCallException.wrap("retry attempt " + attempt, e);
                }

                if (attempt == policy.maxAttempts()) {
                    break;
                }

                Duration delay = backoffCalculator.calculate(attempt);
                log.warn("Retry attempt {}/{} failed, retrying in {}ms: {}",
                    attempt, policy.maxAttempts(), delay.toMillis(), e.getMessage());

                waitBeforeRetry(delay, token, attempt, e);
            }
        }

        log.error("All {} retry attempts exhausted", policy.maxAttempts(), lastFailure);
        throw new RetryExhaustedException(policy.maxAttempts(), lastFailure);
    }

    /**
     * 시도 1회 실행. 취소 가능한 토큰이면 시도가 끝나기 전에도 취소에 반응합니다.
     */
    private <T> T invokeAttempt(BackendCall<T> call, CancellationToken token, int attempt, Exception lastFailure)
        throws Exception {
        if (!token.isCancellable()) {
            return call.call();
        }

        Callable<T> task = call::call;
        Future<T> future = ATTEMPT_EXECUTOR.submit(task);
        Runnable deregister = token.onCancel(() -> future.cancel(true));
        try {
            Optional<Duration> remaining = token.remaining();
            if (remaining.isPresent()) {
                return future.get(remaining.get().toNanos(), TimeUnit.NANOSECONDS);
            }
            return future.get();
        } catch (TimeoutException | CancellationException e) {
            future.cancel(true);
            log.info("Attempt {} cancelled while in flight", attempt);
            throw new RetryCancelledException(attempt, lastFailure != null ? lastFailure : e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RetryCancelledException(attempt, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InterruptedException) {
                throw new RetryCancelledException(attempt, cause);
            }
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw (Error) cause;
        } finally {
            deregister.run();
        }
    }

    private void waitBeforeRetry(Duration delay, CancellationToken token, int attempt, Exception lastFailure) {
        try {
            if (token.awaitCancellation(delay)) {
                log.info("Retry cancelled after {} attempts", attempt);
                throw new RetryCancelledException(attempt, lastFailure);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetryCancelledException(attempt, lastFailure);
        }
    }
}
