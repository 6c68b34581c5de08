package com.ryuqq.isolation.core.model;

/**
 * Circuit breaker의 전역 고유 식별자.
 *
 * <p>BreakerId는 BreakerStore 내에서 하나의 breaker(config + metrics 쌍)를
 * 가리키며, 이벤트와 조정(coordination) 응답에서도 같은 값으로 참조됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~128자</li>
 *   <li>패턴: 영숫자, 점(.), 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class BreakerId {

    private static final int MAX_LENGTH = 128;

    private final String value;

    private BreakerId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("BreakerId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("BreakerId length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!value.matches("^[a-zA-Z0-9.\\-_]+$")) {
            throw new IllegalArgumentException(
                "BreakerId contains invalid characters. Only alphanumeric, dot, hyphen, and underscore are allowed"
            );
        }
        this.value = value;
    }

    /**
     * BreakerId 생성.
     *
     * @param value BreakerId 값
     * @return BreakerId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static BreakerId of(String value) {
        return new BreakerId(value);
    }

    /**
     * BreakerId 값 조회.
     *
     * @return BreakerId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BreakerId breakerId = (BreakerId) o;
        return value.equals(breakerId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "BreakerId{" + value + '}';
    }
}
