// =====================================================
// EngineMath - 고정소수점 연산 유틸리티
// =====================================================
// 역할: 수량/가격/USD 값 간 변환과 스케일 연산
//
// 스케일:
// - bp  : 10,000 = 100%
// - mbp : 10,000,000 = 100% (레버리지 1x = 10,000,000 mbp)
// - USD : 소수점 9자리
// - 펀딩/차입 누적 인덱스 : 1e9
//
// 핵심 설계:
// 1. 모든 금액은 음수가 아닌 long
// 2. 중간 곱셈은 BigInteger (decimal 합이 18을 넘어도 안전)
// 3. 결과가 long 범위를 넘으면 NUMERIC_OVERFLOW
// 4. 수수료 계산용 포화(saturating) 버전 별도 제공
// =====================================================

package dustin.perp.domains.engine.math;

import java.math.BigInteger;

import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;

/**
 * 고정소수점 연산
 * Fixed-point arithmetic helpers
 */
public final class EngineMath {

    public static final long BP_SCALE = 10_000L;
    public static final long MBP_SCALE = 10_000_000L;
    public static final int USD_DECIMAL = 9;
    public static final long INDEX_SCALE = 1_000_000_000L;

    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private EngineMath() {
    }

    public static BigInteger pow10(int exponent) {
        return BigInteger.TEN.pow(exponent);
    }

    /**
     * floor(a * b / c)
     *
     * @throws EngineException c가 0이거나 결과가 long 범위를 넘는 경우
     */
    public static long mulDiv(long a, long b, long c) {
        if (c == 0) {
            throw new EngineException(ErrorCode.NUMERIC_OVERFLOW, "Division by zero");
        }
        BigInteger result = BigInteger.valueOf(a)
                .multiply(BigInteger.valueOf(b))
                .divide(BigInteger.valueOf(c));
        return toLongExact(result);
    }

    /**
     * floor(a * b / c), long 최대값으로 포화
     * c가 0이면 Long.MAX_VALUE
     */
    public static long mulDivSaturating(long a, long b, long c) {
        if (c == 0) {
            return Long.MAX_VALUE;
        }
        BigInteger result = BigInteger.valueOf(a)
                .multiply(BigInteger.valueOf(b))
                .divide(BigInteger.valueOf(c));
        return saturate(result);
    }

    public static long toLongExact(BigInteger value) {
        if (value.signum() < 0 || value.compareTo(LONG_MAX) > 0) {
            throw new EngineException(ErrorCode.NUMERIC_OVERFLOW, "Amount out of range: " + value);
        }
        return value.longValue();
    }

    public static long saturate(BigInteger value) {
        if (value.signum() <= 0) {
            return 0L;
        }
        return value.compareTo(LONG_MAX) > 0 ? Long.MAX_VALUE : value.longValue();
    }

    public static long addExact(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new EngineException(ErrorCode.NUMERIC_OVERFLOW, "Amount overflow: " + a + " + " + b, e);
        }
    }

    /**
     * a - b (음수 결과 금지)
     */
    public static long subExact(long a, long b) {
        if (b > a) {
            throw new EngineException(ErrorCode.NUMERIC_OVERFLOW, "Amount underflow: " + a + " - " + b);
        }
        return a - b;
    }

    public static long saturatingAdd(long a, long b) {
        long sum = a + b;
        return sum < 0 ? Long.MAX_VALUE : sum;
    }

    public static long saturatingSub(long a, long b) {
        return b >= a ? 0L : a - b;
    }

    /**
     * 토큰 수량 → USD (9 decimals)
     * usd = amount * price * 10^9 / 10^(amountDecimal + priceDecimal)
     */
    public static long amountToUsd(long amount, int amountDecimal, long price, int priceDecimal) {
        return toLongExact(amountToUsdBig(amount, amountDecimal, price, priceDecimal));
    }

    public static long amountToUsdSaturating(long amount, int amountDecimal, long price, int priceDecimal) {
        return saturate(amountToUsdBig(amount, amountDecimal, price, priceDecimal));
    }

    private static BigInteger amountToUsdBig(long amount, int amountDecimal, long price, int priceDecimal) {
        return BigInteger.valueOf(amount)
                .multiply(BigInteger.valueOf(price))
                .multiply(pow10(USD_DECIMAL))
                .divide(pow10(amountDecimal + priceDecimal));
    }

    /**
     * USD (9 decimals) → 토큰 수량
     * amount = usd * 10^(amountDecimal + priceDecimal) / (price * 10^9)
     */
    public static long usdToAmount(long usd, int amountDecimal, long price, int priceDecimal) {
        if (price <= 0) {
            throw new EngineException(ErrorCode.ORACLE_INVALID_PRICE, "Oracle price must be positive");
        }
        BigInteger amount = BigInteger.valueOf(usd)
                .multiply(pow10(amountDecimal + priceDecimal))
                .divide(BigInteger.valueOf(price).multiply(pow10(USD_DECIMAL)));
        return toLongExact(amount);
    }

    public static long applyBp(long value, long bp) {
        return mulDiv(value, bp, BP_SCALE);
    }

    public static long applyMbp(long value, long mbp) {
        return mulDiv(value, mbp, MBP_SCALE);
    }
}
