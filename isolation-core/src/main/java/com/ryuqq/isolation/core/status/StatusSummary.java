package com.ryuqq.isolation.core.status;

import com.ryuqq.isolation.core.model.BreakerState;

import java.util.List;

/**
 * 전체 breaker 요약 (불변 record).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param total 전체 breaker 수
 * @param healthy HEALTHY 수
 * @param recovering RECOVERING 수
 * @param isolated ISOLATED 수
 * @param critical CRITICAL 수
 * @param emergency EMERGENCY 상태 수
 * @param forcedOpen FORCE_OPEN 상태 수
 * @param totalValueAtRisk 누적 위험 금액 합계
 */
public record StatusSummary(
    int total,
    int healthy,
    int recovering,
    int isolated,
    int critical,
    int emergency,
    int forcedOpen,
    double totalValueAtRisk
) {

    /**
     * 상태 목록 집계.
     *
     * @param statuses breaker 상태 목록
     * @return StatusSummary
     */
    public static StatusSummary of(List<BreakerStatus> statuses) {
        int healthy = 0;
        int recovering = 0;
        int isolated = 0;
        int critical = 0;
        int emergency = 0;
        int forcedOpen = 0;
        double valueAtRisk = 0.0;
        for (BreakerStatus status : statuses) {
            switch (status.health().level()) {
                case HEALTHY -> healthy++;
                case RECOVERING -> recovering++;
                case ISOLATED -> isolated++;
                case CRITICAL -> critical++;
            }
            if (status.metrics().state() == BreakerState.EMERGENCY) {
                emergency++;
            } else if (status.metrics().state() == BreakerState.FORCE_OPEN) {
                forcedOpen++;
            }
            valueAtRisk += status.metrics().impact().valueAtRisk();
        }
        return new StatusSummary(statuses.size(), healthy, recovering, isolated, critical,
            emergency, forcedOpen, valueAtRisk);
    }
}
