package dustin.perp.domains.engine.math;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;

/**
 * 고정소수점 연산 테스트
 * EngineMath conversions and overflow handling
 */
class EngineMathTest {

    @Test
    @DisplayName("mulDiv: 중간값이 long 범위를 넘어도 결과가 범위 안이면 정확히 계산")
    void mulDivUsesWideIntermediate() {
        long result = EngineMath.mulDiv(Long.MAX_VALUE, 1_000L, 2_000L);

        assertThat(result).isEqualTo(Long.MAX_VALUE / 2);
    }

    @Test
    @DisplayName("mulDiv: 0으로 나누거나 결과가 넘치면 NUMERIC_OVERFLOW")
    void mulDivOverflow() {
        assertThatThrownBy(() -> EngineMath.mulDiv(1L, 1L, 0L))
                .isInstanceOf(EngineException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.NUMERIC_OVERFLOW);
        assertThatThrownBy(() -> EngineMath.mulDiv(Long.MAX_VALUE, 3L, 2L))
                .isInstanceOf(EngineException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.NUMERIC_OVERFLOW);
    }

    @Test
    @DisplayName("mulDivSaturating: 넘치면 Long.MAX_VALUE, 0으로 나누면 Long.MAX_VALUE")
    void mulDivSaturates() {
        assertThat(EngineMath.mulDivSaturating(Long.MAX_VALUE, 3L, 2L)).isEqualTo(Long.MAX_VALUE);
        assertThat(EngineMath.mulDivSaturating(5L, 5L, 0L)).isEqualTo(Long.MAX_VALUE);
        assertThat(EngineMath.mulDivSaturating(7L, 3L, 2L)).isEqualTo(10L);
    }

    @Test
    @DisplayName("addExact / subExact: 오버플로와 음수 결과는 NUMERIC_OVERFLOW")
    void exactArithmetic() {
        assertThat(EngineMath.addExact(1L, 2L)).isEqualTo(3L);
        assertThat(EngineMath.subExact(5L, 5L)).isZero();

        assertThatThrownBy(() -> EngineMath.addExact(Long.MAX_VALUE, 1L))
                .isInstanceOf(EngineException.class);
        assertThatThrownBy(() -> EngineMath.subExact(1L, 2L))
                .isInstanceOf(EngineException.class)
                .hasMessageContaining("underflow");
    }

    @Test
    @DisplayName("포화 덧셈/뺄셈")
    void saturatingArithmetic() {
        assertThat(EngineMath.saturatingAdd(Long.MAX_VALUE, 10L)).isEqualTo(Long.MAX_VALUE);
        assertThat(EngineMath.saturatingSub(3L, 10L)).isZero();
        assertThat(EngineMath.saturatingSub(10L, 3L)).isEqualTo(7L);
    }

    @Test
    @DisplayName("토큰 수량 ↔ USD 환산 (USD 9 decimals)")
    void usdConversion() {
        // given: 1 BTC (9 decimals) at $10,000 (8 decimals)
        long oneBtc = 1_000_000_000L;
        long price = 1_000_000_000_000L;

        // when
        long usd = EngineMath.amountToUsd(oneBtc, 9, price, 8);

        // then: $10,000 = 10,000 * 1e9
        assertThat(usd).isEqualTo(10_000_000_000_000L);

        // 10 USD → USDC (6 decimals) at $1 (8 decimals)
        assertThat(EngineMath.usdToAmount(10_000_000_000L, 6, 100_000_000L, 8)).isEqualTo(10_000_000L);
    }

    @Test
    @DisplayName("usdToAmount: 가격이 0 이하면 ORACLE_INVALID_PRICE")
    void usdToAmountRejectsNonPositivePrice() {
        assertThatThrownBy(() -> EngineMath.usdToAmount(1L, 6, 0L, 8))
                .isInstanceOf(EngineException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.ORACLE_INVALID_PRICE);
    }

    @Test
    @DisplayName("bp / mbp 적용")
    void applyRates() {
        assertThat(EngineMath.applyBp(10_000_000_000_000L, 100L)).isEqualTo(100_000_000_000L);
        assertThat(EngineMath.applyMbp(10_000_000_000_000L, 10_000L)).isEqualTo(10_000_000_000L);
    }
}
