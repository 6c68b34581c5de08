/**
 * 조정 격리 진입점.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.isolation.application.coordination;
