/**
 * 장애 감지 알고리즘.
 *
 * <p><strong>전략:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.isolation.core.detector.SimpleThresholdDetector}: 누적 실패율</li>
 *   <li>{@link com.ryuqq.isolation.core.detector.SlidingWindowDetector}: 롤링 창 실패율</li>
 *   <li>{@link com.ryuqq.isolation.core.detector.ExponentialSmoothingDetector}: 버킷 실패율의 지수 평활</li>
 *   <li>{@link com.ryuqq.isolation.core.detector.AdaptiveThresholdDetector}: 재보정 임계값</li>
 *   <li>{@link com.ryuqq.isolation.core.detector.AnomalyBasedDetector}: 외부 모델 위임</li>
 * </ul>
 *
 * <p>모든 감지기는 순수 함수입니다. 감지기 예외를 열기 판정으로 바꾸는 보호 래퍼는
 * runner 모듈의 GuardedFailureDetector입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.isolation.core.detector;
