package com.ryuqq.isolation.core.detector;

import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.metrics.MetricsSnapshot;

/**
 * 장애 감지 알고리즘 SPI.
 *
 * <p>누적된 실패가 breaker를 열 만한지 판정합니다.
 * 구현은 (config, snapshot)의 순수 함수여야 하며 상태를 변경하지 않습니다.
 * 전이 실행은 호출자의 몫입니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>Thread-safe: 여러 breaker 락 안에서 동시에 호출될 수 있음</li>
 *   <li>표본이 minimumSamples 미만이면 open=false</li>
 *   <li>판정 근거는 전략별 {@link DetectionEvidence} variant로 반환</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface FailureDetector {

    /**
     * Breaker를 열어야 하는지 판정.
     *
     * @param config breaker 설정
     * @param snapshot 지표 스냅샷
     * @return 판정 결과
     */
    DetectionResult shouldOpen(BreakerConfig config, MetricsSnapshot snapshot);
}
