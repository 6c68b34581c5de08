/**
 * 적응형 임계값 계산.
 *
 * <p>계산은 순수 함수이며, 주기적 재보정 작업은 runner 모듈의 AdaptiveThresholdRecalibrator가 수행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.isolation.core.adaptive;
