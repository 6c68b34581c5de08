package com.ryuqq.isolation.adapter.runner;

import com.ryuqq.isolation.core.adaptive.AdaptiveThreshold;
import com.ryuqq.isolation.core.adaptive.AdaptiveThresholdCalculator;
import com.ryuqq.isolation.core.model.BreakerId;
import com.ryuqq.isolation.core.spi.BreakerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 적응형 임계값 재보정 컴포넌트.
 *
 * <p>적응형 임계값을 쓰는 breaker의 롤링 창을 평활해 유효 임계값을 다시 계산하고,
 * 지표에는 유효 임계값과 평활 실패율만 기록합니다. 설정의 기준 임계값은 바뀌지 않습니다.</p>
 *
 * <p>주기적으로 호출되어야 합니다 ({@link IsolationRuntime}).
 * 새 결과가 없으면 같은 값을 다시 계산하므로 반복 호출해도 결과가 같습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AdaptiveThresholdRecalibrator {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveThresholdRecalibrator.class);
    private final BreakerStore store;
    private final AdaptiveThresholdCalculator calculator;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param store breaker 저장소
     * @param calculator 임계값 계산기
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public AdaptiveThresholdRecalibrator(BreakerStore store, AdaptiveThresholdCalculator calculator, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (calculator == null) {
            throw new IllegalArgumentException("calculator cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.calculator = calculator;
        this.clock = clock;
    }

    /**
     * 적응형 breaker 전체 재보정.
     */
    public void scan() {
        log.debug("Adaptive threshold recalibration started");

        List<BreakerId> targets = store.findAll().stream()
            .filter(view -> view.config().usesAdaptiveThreshold())
            .map(view -> view.config().breakerId())
            .collect(Collectors.toList());

        int recalibrated = 0;
        for (BreakerId breakerId : targets) {
            if (tryRecalibrate(breakerId)) {
                recalibrated++;
            }
        }

        log.debug("Adaptive threshold recalibration completed: {} recalibrated out of {}",
            recalibrated, targets.size());
    }

    private boolean tryRecalibrate(BreakerId breakerId) {
        try {
            AdaptiveThreshold threshold = store.update(breakerId, (config, metrics) -> {
                if (!config.usesAdaptiveThreshold()) {
                    return null;
                }
                AdaptiveThreshold calculated = calculator.calculate(config, metrics.snapshot(clock.instant(), config.timing()));
                metrics.applyAdaptiveThreshold(calculated.effective(), calculated.smoothedFailureRate());
                return calculated;
            });
            if (threshold == null) {
                return false;
            }
            log.debug("Breaker {} threshold recalibrated: effective={} smoothed={} baseline={} samples={}",
                breakerId, threshold.effective(), threshold.smoothedFailureRate(),
                threshold.baseline(), threshold.samples());
            return true;

        } catch (Exception e) {
            log.error("Failed to recalibrate threshold of {}", breakerId, e);
            return false;
        }
    }
}
