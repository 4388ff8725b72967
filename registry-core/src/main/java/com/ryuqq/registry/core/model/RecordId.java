package com.ryuqq.registry.core.model;

/**
 * 종(species) 레코드 식별자.
 *
 * <p>RecordId는 1부터 순차적으로 할당되며, 재사용되지 않습니다.
 * 값 0은 "존재하지 않음"을 나타내는 sentinel입니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>음수 불가</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class RecordId implements Comparable<RecordId> {

    /**
     * "존재하지 않음" sentinel.
     */
    public static final RecordId ZERO = new RecordId(0L);

    private final long value;

    private RecordId(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("RecordId must be non-negative (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * RecordId 생성.
     *
     * @param value RecordId 값
     * @return RecordId 인스턴스
     * @throws IllegalArgumentException 음수인 경우
     */
    public static RecordId of(long value) {
        if (value == 0L) {
            return ZERO;
        }
        return new RecordId(value);
    }

    /**
     * 다음 순번의 RecordId.
     *
     * @return value + 1
     */
    public RecordId next() {
        return new RecordId(Math.addExact(value, 1L));
    }

    /**
     * sentinel(0) 여부 확인.
     *
     * @return 값이 0인 경우 true
     */
    public boolean isZero() {
        return value == 0L;
    }

    /**
     * RecordId 값 조회.
     *
     * @return RecordId 값
     */
    public long getValue() {
        return value;
    }

    @Override
    public int compareTo(RecordId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RecordId recordId = (RecordId) o;
        return value == recordId.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "RecordId{" + value + '}';
    }
}
