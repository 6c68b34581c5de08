/**
 * Breaker 지표.
 *
 * <p>{@link com.ryuqq.isolation.core.metrics.BreakerMetrics}는 breaker당 하나씩 존재하는 가변 객체로,
 * BreakerStore의 breaker별 락 안에서만 변경됩니다. 락 밖으로는
 * {@link com.ryuqq.isolation.core.metrics.MetricsSnapshot}만 전달합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.isolation.core.metrics;
