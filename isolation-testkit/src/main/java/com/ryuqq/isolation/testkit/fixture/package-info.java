/**
 * 테스트 fixture.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.isolation.testkit.fixture;
