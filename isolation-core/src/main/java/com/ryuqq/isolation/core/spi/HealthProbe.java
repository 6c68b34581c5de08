package com.ryuqq.isolation.core.spi;

/**
 * 외부 헬스 체크 SPI.
 *
 * <p>healthCheckEndpoint가 설정된 OPEN breaker에 대해 주기적으로 호출되며,
 * 결과는 HALF_OPEN 전이 판단에 참고로만 쓰입니다.
 * 예외는 실패한 probe로 간주합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface HealthProbe {

    /**
     * 엔드포인트 상태 확인.
     *
     * @param endpoint 헬스 체크 엔드포인트
     * @return 정상이면 true
     */
    boolean probe(String endpoint);
}
