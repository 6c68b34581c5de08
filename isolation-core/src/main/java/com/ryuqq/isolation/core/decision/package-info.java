/**
 * 요청 허용/거부 결정 값 타입.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.isolation.core.decision;
