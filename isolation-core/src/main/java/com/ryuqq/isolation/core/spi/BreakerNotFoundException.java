package com.ryuqq.isolation.core.spi;

import com.ryuqq.isolation.core.model.BreakerId;

/**
 * 등록되지 않은 breaker를 참조했을 때 발생하는 예외.
 *
 * <p>기본값으로 대체하지 않고 항상 호출자에게 전달됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BreakerNotFoundException extends IllegalStateException {

    private final BreakerId breakerId;

    /**
     * 생성자.
     *
     * @param breakerId 찾지 못한 breaker
     */
    public BreakerNotFoundException(BreakerId breakerId) {
        super("Breaker not found: " + breakerId);
        this.breakerId = breakerId;
    }

    /**
     * 찾지 못한 breaker 조회.
     *
     * @return BreakerId
     */
    public BreakerId getBreakerId() {
        return breakerId;
    }
}
