/**
 * Breaker 설정 record.
 *
 * <p>{@link com.ryuqq.isolation.core.config.BreakerConfig}는 정책 record들의 조합입니다:</p>
 * <ul>
 *   <li>{@link com.ryuqq.isolation.core.config.DetectionPolicy}: 감지 알고리즘과 임계값</li>
 *   <li>{@link com.ryuqq.isolation.core.config.TimingPolicy}: OPEN 유지 시간, probe 수</li>
 *   <li>{@link com.ryuqq.isolation.core.config.RecoveryPolicy}: CLOSED 복귀 조건, 헬스 체크</li>
 *   <li>{@link com.ryuqq.isolation.core.config.AdaptivePolicy}: 적응형 임계값 범위와 평활 계수</li>
 *   <li>{@link com.ryuqq.isolation.core.config.BreakerFeatures}: 기능 플래그</li>
 * </ul>
 *
 * <p>모든 record는 compact constructor에서 검증하며, 위반 시
 * {@link com.ryuqq.isolation.core.config.InvalidBreakerConfigException}을 던집니다.
 * 변경은 {@code withXxx()} 메서드로 새 인스턴스를 만들어 수행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.isolation.core.config;
