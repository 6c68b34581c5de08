/**
 * SPI 구현이 상속해서 사용하는 계약 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.isolation.testkit.contract;
