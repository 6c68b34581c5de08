/**
 * 실행 컴포넌트: 요청 허용 판정 서비스, 계층 간 격리 조정, 임계값 재보정, 헬스 체크.
 *
 * <p>모든 컴포넌트는 core SPI({@code BreakerStore}, {@code BreakerEventChannel},
 * {@code BreakerPersistence}, {@code TaskScheduler})에만 의존하므로 저장소 구현과 무관합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.isolation.adapter.runner;
