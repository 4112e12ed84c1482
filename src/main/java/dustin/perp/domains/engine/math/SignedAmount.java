package dustin.perp.domains.engine.math;

import java.math.BigInteger;

import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 부호-크기 표현 금액
 * Sign-magnitude amount
 *
 * 펀딩 인덱스, 실현 손익, 옵션 담보 미정산 비용 등에 사용
 * - 0은 항상 양수 부호로 정규화 (증가 후 같은 크기 감소 시 이전 값 그대로 복원)
 * - 0을 가로지르는 덧셈은 부호가 뒤집힘
 * - 크기가 long 범위를 넘으면 NUMERIC_OVERFLOW
 */
@Getter
@EqualsAndHashCode
public final class SignedAmount implements Comparable<SignedAmount> {

    public static final SignedAmount ZERO = new SignedAmount(0L, false);

    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private final long magnitude;
    private final boolean negative;

    private SignedAmount(long magnitude, boolean negative) {
        this.magnitude = magnitude;
        this.negative = negative;
    }

    public static SignedAmount of(long magnitude, boolean negative) {
        if (magnitude < 0) {
            throw new IllegalArgumentException("Magnitude must not be negative: " + magnitude);
        }
        if (magnitude == 0) {
            return ZERO;
        }
        return new SignedAmount(magnitude, negative);
    }

    public static SignedAmount positive(long magnitude) {
        return of(magnitude, false);
    }

    public static SignedAmount negative(long magnitude) {
        return of(magnitude, true);
    }

    public static SignedAmount fromBigInteger(BigInteger value) {
        BigInteger abs = value.abs();
        if (abs.compareTo(LONG_MAX) > 0) {
            throw new EngineException(ErrorCode.NUMERIC_OVERFLOW, "Signed amount out of range: " + value);
        }
        return of(abs.longValue(), value.signum() < 0);
    }

    public BigInteger toBigInteger() {
        BigInteger value = BigInteger.valueOf(magnitude);
        return negative ? value.negate() : value;
    }

    public SignedAmount add(SignedAmount other) {
        return fromBigInteger(toBigInteger().add(other.toBigInteger()));
    }

    public SignedAmount subtract(SignedAmount other) {
        return fromBigInteger(toBigInteger().subtract(other.toBigInteger()));
    }

    public SignedAmount negate() {
        return of(magnitude, !negative);
    }

    /**
     * 크기에만 floor(magnitude * numerator / denominator) 적용, 부호 유지
     */
    public SignedAmount mulDiv(long numerator, long denominator) {
        return of(EngineMath.mulDiv(magnitude, numerator, denominator), negative);
    }

    public boolean isPositive() {
        return magnitude > 0 && !negative;
    }

    public boolean isZero() {
        return magnitude == 0;
    }

    public int signum() {
        if (magnitude == 0) {
            return 0;
        }
        return negative ? -1 : 1;
    }

    @Override
    public int compareTo(SignedAmount other) {
        return toBigInteger().compareTo(other.toBigInteger());
    }

    @Override
    public String toString() {
        return negative ? "-" + magnitude : Long.toString(magnitude);
    }
}
