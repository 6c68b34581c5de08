/**
 * 모니터링/CLI용 상태 조회 타입.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.isolation.core.status;
