/**
 * 요청 허용 결정 진입점.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.isolation.application.decision;
