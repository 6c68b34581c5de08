package com.ryuqq.isolation.adapter.runner;

import com.ryuqq.isolation.core.config.BreakerConfig;
import com.ryuqq.isolation.core.model.BreakerId;
import com.ryuqq.isolation.core.model.BreakerState;
import com.ryuqq.isolation.core.spi.BreakerStore;
import com.ryuqq.isolation.core.spi.BreakerView;
import com.ryuqq.isolation.core.spi.HealthProbe;
import com.ryuqq.isolation.core.statemachine.StateTransition;
import com.ryuqq.isolation.core.statemachine.TransitionSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * OPEN breaker 헬스 체크 컴포넌트.
 *
 * <p>재평가 시각이 지난 OPEN breaker 중 healthCheckEndpoint가 있는 것만 점검합니다.
 * 점검을 통과하면 요청을 기다리지 않고 HALF_OPEN으로 전이합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. findAll() → OPEN + endpoint 보유 + 재평가 시각 경과
 * 2. For each breaker:
 *    a. probe.probe(endpoint) (예외는 실패로 간주)
 *    b. 통과 시 락 안에서 상태 재확인 후 HEALTH_PROBE_PASSED
 * 3. 전이 수 로깅
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class HealthProbeMonitor {

    private static final Logger log = LoggerFactory.getLogger(HealthProbeMonitor.class);
    private final BreakerStore store;
    private final HealthProbe probe;
    private final ChangeDispatcher dispatcher;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param store breaker 저장소
     * @param probe 헬스 체크
     * @param dispatcher 이벤트/영속화 전파
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public HealthProbeMonitor(BreakerStore store, HealthProbe probe, ChangeDispatcher dispatcher, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (probe == null) {
            throw new IllegalArgumentException("probe cannot be null");
        }
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.probe = probe;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    /**
     * 점검 대상 breaker 스캔 및 헬스 체크.
     */
    public void scan() {
        Instant now = clock.instant();
        List<BreakerView> targets = store.findAll().stream()
            .filter(view -> view.metrics().state() == BreakerState.OPEN)
            .filter(view -> view.config().recovery().healthCheck().isPresent())
            .filter(view -> view.metrics().earliestReevaluationAt().map(at -> !now.isBefore(at)).orElse(false))
            .collect(Collectors.toList());
        if (targets.isEmpty()) {
            return;
        }

        log.info("Health probe scan started: {} candidates", targets.size());
        int recovered = 0;
        for (BreakerView target : targets) {
            if (tryProbe(target.config())) {
                recovered++;
            }
        }
        log.info("Health probe scan completed: {} moved to HALF_OPEN out of {}", recovered, targets.size());
    }

    private boolean tryProbe(BreakerConfig target) {
        BreakerId breakerId = target.breakerId();
        String endpoint = target.recovery().healthCheck().orElseThrow();
        if (!isHealthy(breakerId, endpoint)) {
            return false;
        }

        try {
            boolean moved = store.update(breakerId, (config, metrics) -> {
                Instant now = clock.instant();
                Instant reopensAt = metrics.stateEnteredAt().plus(config.timing().openDuration());
                if (metrics.state() != BreakerState.OPEN || now.isBefore(reopensAt)) {
                    return false;
                }
                StateTransition transition = metrics.transition(TransitionSignal.HEALTH_PROBE_PASSED, now,
                    "Health probe passed at " + endpoint);
                dispatcher.enqueue(config, transition);
                return true;
            });
            if (moved) {
                dispatcher.flush(breakerId);
            }
            return moved;

        } catch (Exception e) {
            log.error("Failed to apply health probe result for {}", breakerId, e);
            return false;
        }
    }

    private boolean isHealthy(BreakerId breakerId, String endpoint) {
        try {
            boolean healthy = probe.probe(endpoint);
            if (!healthy) {
                log.warn("Health probe for {} at {} reported unhealthy", breakerId, endpoint);
            }
            return healthy;
        } catch (Exception e) {
            log.warn("Health probe for {} at {} failed, counting as unhealthy", breakerId, endpoint, e);
            return false;
        }
    }
}
