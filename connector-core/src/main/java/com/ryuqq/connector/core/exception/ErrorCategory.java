package com.ryuqq.connector.core.exception;

/**
 * 호출자에게 노출되는 오류 분류.
 *
 * <p>호출자가 영구적인 설정 문제(NOT_FOUND, DISABLED, MISCONFIGURED)와
 * 일시적인 백엔드 장애(UNAVAILABLE)를 구분할 수 있도록 합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public enum ErrorCategory {

    /** 일치하는 커넥터 설정 또는 백엔드 리소스 없음. */
    NOT_FOUND,

    /** 설정은 존재하지만 비활성화됨. */
    DISABLED,

    /** 등록되지 않은 어댑터 종류 등 설정 오류. */
    MISCONFIGURED,

    /** 서비스 사용 불가 (백엔드 장애, Circuit OPEN, 토큰 획득 실패 등). */
    UNAVAILABLE,

    /** 호출자의 취소 또는 타임아웃. */
    CANCELLED
}
