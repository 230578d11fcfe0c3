/**
 * Connector Registry.
 *
 * <p>테넌트/스토어/도메인 단위 커넥터의 해석, 캐시, 만료 정리, 종료를 담당합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
package com.ryuqq.connector.application.registry;
