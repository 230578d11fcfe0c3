/**
 * D365 Commerce OData 응답/요청 DTO 패키지.
 *
 * <p>필드 이름은 D365 Commerce Scale Unit의 OData 스키마(PascalCase)를 그대로 따릅니다.
 * 알 수 없는 필드는 무시합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
package com.ryuqq.connector.adapter.d365.odata;
