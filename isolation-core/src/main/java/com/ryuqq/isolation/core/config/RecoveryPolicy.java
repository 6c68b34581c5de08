package com.ryuqq.isolation.core.config;

import java.util.Optional;

/**
 * 복구 정책 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>successThreshold: HALF_OPEN → CLOSED에 필요한 연속 성공 수 (기본 3)</li>
 *   <li>maxRetryAttempts: 호출자 재시도 권장 상한 (기본 3)</li>
 *   <li>backoffMultiplier: 호출자 재시도 간격 배수, 1 이상 (기본 2.0)</li>
 *   <li>healthCheckEndpoint: 헬스 probe 대상 (nullable, 없으면 probe 안 함)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param successThreshold 연속 성공 수
 * @param maxRetryAttempts 최대 재시도 횟수
 * @param backoffMultiplier 백오프 배수
 * @param healthCheckEndpoint 헬스 체크 엔드포인트 (nullable)
 */
public record RecoveryPolicy(
    int successThreshold,
    int maxRetryAttempts,
    double backoffMultiplier,
    String healthCheckEndpoint
) {

    /**
     * 기본 설정 생성자.
     */
    public RecoveryPolicy() {
        this(3, 3, 2.0, null);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws InvalidBreakerConfigException 파라미터 검증 실패 시
     */
    public RecoveryPolicy {
        ConfigChecks.requireAtLeast(successThreshold, 1, "successThreshold");
        ConfigChecks.requireAtLeast(maxRetryAttempts, 0, "maxRetryAttempts");
        if (Double.isNaN(backoffMultiplier) || backoffMultiplier < 1.0) {
            throw new InvalidBreakerConfigException(
                "backoffMultiplier must be at least 1.0 (current: " + backoffMultiplier + ")"
            );
        }
        if (healthCheckEndpoint != null && healthCheckEndpoint.isBlank()) {
            throw new InvalidBreakerConfigException("healthCheckEndpoint cannot be blank");
        }
    }

    /**
     * 헬스 체크 엔드포인트 조회.
     *
     * @return 설정된 경우 엔드포인트
     */
    public Optional<String> healthCheck() {
        return Optional.ofNullable(healthCheckEndpoint);
    }

    public RecoveryPolicy withSuccessThreshold(int successThreshold) {
        return new RecoveryPolicy(successThreshold, maxRetryAttempts, backoffMultiplier, healthCheckEndpoint);
    }

    public RecoveryPolicy withHealthCheckEndpoint(String healthCheckEndpoint) {
        return new RecoveryPolicy(successThreshold, maxRetryAttempts, backoffMultiplier, healthCheckEndpoint);
    }
}
