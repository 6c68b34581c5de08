package com.ryuqq.isolation.adapter.runner;

import com.ryuqq.isolation.core.spi.ScheduledTask;
import com.ryuqq.isolation.core.spi.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 백그라운드 작업 수명 주기 관리.
 *
 * <p>{@link #start()}는 적응형 임계값 재보정과 헬스 체크를 고정 주기로 예약하고,
 * {@link #stop()}은 예약을 취소합니다. 스케줄러 자체의 종료는 소유자의 책임입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class IsolationRuntime {

    private static final Logger log = LoggerFactory.getLogger(IsolationRuntime.class);
    private final TaskScheduler scheduler;
    private final AdaptiveThresholdRecalibrator recalibrator;
    private final RecalibrationConfig recalibrationConfig;
    private final HealthProbeMonitor probeMonitor;
    private final HealthProbeConfig probeConfig;
    private final List<ScheduledTask> jobs = new ArrayList<>();

    /**
     * 생성자.
     *
     * @param scheduler 스케줄러
     * @param recalibrator 임계값 재보정
     * @param recalibrationConfig 재보정 설정
     * @param probeMonitor 헬스 체크
     * @param probeConfig 헬스 체크 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public IsolationRuntime(
        TaskScheduler scheduler,
        AdaptiveThresholdRecalibrator recalibrator,
        RecalibrationConfig recalibrationConfig,
        HealthProbeMonitor probeMonitor,
        HealthProbeConfig probeConfig
    ) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        if (recalibrator == null) {
            throw new IllegalArgumentException("recalibrator cannot be null");
        }
        if (recalibrationConfig == null) {
            throw new IllegalArgumentException("recalibrationConfig cannot be null");
        }
        if (probeMonitor == null) {
            throw new IllegalArgumentException("probeMonitor cannot be null");
        }
        if (probeConfig == null) {
            throw new IllegalArgumentException("probeConfig cannot be null");
        }
        this.scheduler = scheduler;
        this.recalibrator = recalibrator;
        this.recalibrationConfig = recalibrationConfig;
        this.probeMonitor = probeMonitor;
        this.probeConfig = probeConfig;
    }

    /**
     * 백그라운드 작업 시작.
     *
     * @throws IllegalStateException 이미 시작된 경우
     */
    public synchronized void start() {
        if (!jobs.isEmpty()) {
            throw new IllegalStateException("Runtime already started");
        }
        jobs.add(scheduler.scheduleAtFixedRate(recalibrator::scan,
            recalibrationConfig.interval(), recalibrationConfig.interval()));
        jobs.add(scheduler.scheduleAtFixedRate(probeMonitor::scan,
            probeConfig.initialDelay(), probeConfig.interval()));
        log.info("Isolation runtime started (recalibration every {}, health probe every {})",
            recalibrationConfig.interval(), probeConfig.interval());
    }

    /**
     * 백그라운드 작업 중지. 시작되지 않았으면 아무것도 하지 않습니다.
     */
    public synchronized void stop() {
        if (jobs.isEmpty()) {
            return;
        }
        jobs.forEach(ScheduledTask::cancel);
        jobs.clear();
        log.info("Isolation runtime stopped");
    }

    /**
     * 실행 여부.
     *
     * @return 시작되어 중지되지 않았으면 true
     */
    public synchronized boolean isRunning() {
        return !jobs.isEmpty();
    }
}
