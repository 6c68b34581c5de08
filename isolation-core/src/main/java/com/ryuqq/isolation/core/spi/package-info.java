/**
 * Service Provider Interface.
 *
 * <p>이 모듈이 외부에 요구하는 계약입니다:</p>
 * <ul>
 *   <li>{@link com.ryuqq.isolation.core.spi.BreakerStore}: breaker별 원자적 상태 저장소</li>
 *   <li>{@link com.ryuqq.isolation.core.spi.BreakerEventChannel}: 이벤트 출력 채널</li>
 *   <li>{@link com.ryuqq.isolation.core.spi.HealthProbe}: 헬스 체크 (선택)</li>
 *   <li>{@link com.ryuqq.isolation.core.spi.BreakerPersistence}: 설정/상태 보존 (선택)</li>
 *   <li>{@link com.ryuqq.isolation.core.spi.TaskScheduler}: 취소 가능한 백그라운드 작업 예약</li>
 * </ul>
 *
 * <p>참조 구현은 isolation-adapter-inmemory 모듈에 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.isolation.core.spi;
