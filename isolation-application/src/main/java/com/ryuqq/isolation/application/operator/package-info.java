/**
 * 운영자/모니터링 진입점.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.isolation.application.operator;
