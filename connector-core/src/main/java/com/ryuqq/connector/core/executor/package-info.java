/**
 * 백엔드 호출 추상화 패키지.
 *
 * @author Connector Team
 * @since 1.0.0
 */
package com.ryuqq.connector.core.executor;
