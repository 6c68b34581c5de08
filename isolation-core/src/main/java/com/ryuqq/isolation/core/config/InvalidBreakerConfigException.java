package com.ryuqq.isolation.core.config;

/**
 * Breaker 설정이 불변식을 위반했을 때 발생하는 예외.
 *
 * <p>등록(register)과 설정 변경(updateConfig) 경계에서 발생하며,
 * 설정은 부분적으로 적용되지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InvalidBreakerConfigException extends IllegalArgumentException {

    /**
     * 생성자.
     *
     * @param message 위반 내용
     */
    public InvalidBreakerConfigException(String message) {
        super(message);
    }
}
