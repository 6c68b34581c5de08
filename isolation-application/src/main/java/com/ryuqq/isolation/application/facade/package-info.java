/**
 * 장애 격리 서비스 통합 진입점.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.isolation.application.facade;
