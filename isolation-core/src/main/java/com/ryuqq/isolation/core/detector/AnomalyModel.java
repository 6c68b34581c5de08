package com.ryuqq.isolation.core.detector;

import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.metrics.MetricsSnapshot;

/**
 * 통계/ML 이상 탐지 모델 SPI.
 *
 * <p>ANOMALY_BASED 전략이 위임하는 확장 지점입니다. 모델의 학습과 추론은 이 모듈의 범위 밖이며,
 * 기본 구현 {@link NoOpAnomalyModel}은 이상을 보고하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface AnomalyModel {

    /**
     * 현재 지표의 이상 여부 평가.
     *
     * @param config breaker 설정
     * @param snapshot 지표 스냅샷
     * @return 평가 결과
     */
    AnomalyVerdict evaluate(BreakerConfig config, MetricsSnapshot snapshot);

    /**
     * 모델 이름 (근거 기록용).
     *
     * @return 모델 이름
     */
    String name();
}
