/**
 * Breaker 식별자와 분류 값 타입.
 *
 * <p>이 패키지는 breaker를 식별하고 분류하는 불변 값 타입을 포함합니다:</p>
 * <ul>
 *   <li>{@link com.ryuqq.isolation.core.model.BreakerId}: 전역 고유 식별자</li>
 *   <li>{@link com.ryuqq.isolation.core.model.BreakerState}: 다섯 가지 상태</li>
 *   <li>{@link com.ryuqq.isolation.core.model.SystemLayer}: 보호 계층</li>
 *   <li>{@link com.ryuqq.isolation.core.model.BusinessImpactTier}: 영향 등급</li>
 *   <li>{@link com.ryuqq.isolation.core.model.RequestContext},
 *       {@link com.ryuqq.isolation.core.model.ErrorContext}: 호출자가 전달하는 비즈니스 컨텍스트</li>
 * </ul>
 *
 * <p>이 모듈은 외부 라이브러리에 의존하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.isolation.core.model;
