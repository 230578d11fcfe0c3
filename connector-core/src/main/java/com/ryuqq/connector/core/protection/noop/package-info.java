/**
 * Protection SPI의 NoOp 구현 패키지.
 *
 * @author Connector Team
 * @since 1.0.0
 */
package com.ryuqq.connector.core.protection.noop;
