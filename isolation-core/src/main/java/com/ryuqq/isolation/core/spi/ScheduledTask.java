package com.ryuqq.isolation.core.spi;

/**
 * 취소 가능한 예약 작업 핸들.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ScheduledTask {

    /**
     * 예약 취소. 이미 실행 중인 작업은 중단하지 않습니다.
     *
     * @return 이번 호출로 취소되었으면 true
     */
    boolean cancel();

    /**
     * 취소 여부 확인.
     *
     * @return 취소되었으면 true
     */
    boolean isCancelled();
}
