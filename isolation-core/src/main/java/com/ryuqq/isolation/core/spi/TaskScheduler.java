package com.ryuqq.isolation.core.spi;

import java.time.Duration;

/**
 * 백그라운드 작업 예약 SPI.
 *
 * <p>재보정, 헬스 probe, 조정 복구 점검, 강제 차단 자동 해제가 이 SPI로 예약됩니다.
 * 테스트에서는 가상 시간 구현으로 교체해 벽시계 없이 시간을 진행합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface TaskScheduler {

    /**
     * 한 번 실행 예약.
     *
     * @param task 작업
     * @param delay 지연
     * @return 취소 핸들
     */
    ScheduledTask schedule(Runnable task, Duration delay);

    /**
     * 고정 주기 실행 예약.
     *
     * @param task 작업
     * @param initialDelay 첫 실행 지연
     * @param period 주기
     * @return 취소 핸들
     */
    ScheduledTask scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period);
}
