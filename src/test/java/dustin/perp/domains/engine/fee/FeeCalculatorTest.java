package dustin.perp.domains.engine.fee;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;
import dustin.perp.domains.engine.math.SignedAmount;
import dustin.perp.domains.engine.model.Side;
import dustin.perp.domains.engine.port.OraclePrice;

/**
 * 수수료 / 레버리지 / 청산 판정 테스트
 * Fee and leverage calculator
 *
 * 수수료 곡선 예시:
 * - base 10 mbp, max 100 mbp, 노출 한도 = TVL $1,000,000 의 5% = $50,000
 * - 가격 $500 (decimal 0), 수량 decimal 0
 */
class FeeCalculatorTest {

    private static final FeeCurve CURVE = new FeeCurve(10L, 100L, 500_000L);
    private static final long TVL_USD = 1_000_000L * 1_000_000_000L;
    private static final long PRICE = 500L;

    private static long feeRate(long longSize, long shortSize, Side side, long size) {
        return FeeCalculator.feeRateMbp(longSize, shortSize, TVL_USD, 0, PRICE, 0, side, size, CURVE);
    }

    // ============================================
    // 수수료율
    // ============================================

    @Test
    @DisplayName("불균형을 줄이는 주문은 base 수수료")
    void reducingOrderPaysBase() {
        assertThat(feeRate(1_000L, 0L, Side.SHORT, 100L)).isEqualTo(10L);
    }

    @Test
    @DisplayName("노출 한도 전부를 쓰는 주문은 max 수수료")
    void fullBudgetPaysMax() {
        // 100 * $500 = $50,000 = 한도 전체
        assertThat(feeRate(0L, 0L, Side.LONG, 100L)).isEqualTo(100L);
    }

    @Test
    @DisplayName("노출 한도의 절반이면 base와 max 사이 선형 보간")
    void halfBudgetIsLinear() {
        assertThat(feeRate(0L, 0L, Side.SHORT, 50L)).isEqualTo(55L);
    }

    @Test
    @DisplayName("방향 전환 주문: 새 불균형이 기존보다 크면 증가분만큼 부과")
    void flipAboveOriginalImbalance() {
        // 불균형 100 롱 → 200 숏 (증가분 100 = $50,000)
        assertThat(feeRate(100L, 0L, Side.SHORT, 300L)).isEqualTo(100L);
        // 불균형 100 롱 → 50 숏 (감소)
        assertThat(feeRate(100L, 0L, Side.SHORT, 150L)).isEqualTo(10L);
    }

    @Test
    @DisplayName("한도를 넘는 주문도 max로 상한")
    void cappedAtMax() {
        assertThat(feeRate(0L, 0L, Side.LONG, 1_000L)).isEqualTo(100L);
    }

    @Test
    @DisplayName("TVL 0 (노출 한도 0)이면 base")
    void zeroBudgetPaysBase() {
        long fee = FeeCalculator.feeRateMbp(0L, 0L, 0L, 0, PRICE, 0, Side.LONG, 100L, CURVE);

        assertThat(fee).isEqualTo(10L);
    }

    @Test
    @DisplayName("극단적인 입력에서도 오버플로 없이 [base, max] 범위")
    void saturatesOnExtremeInputs() {
        long fee = FeeCalculator.feeRateMbp(0L, 0L, Long.MAX_VALUE, 0, Long.MAX_VALUE, 0,
                Side.LONG, Long.MAX_VALUE / 2, CURVE);

        assertThat(fee).isBetween(10L, 100L);
        for (long size = 1; size <= 2_000; size += 37) {
            assertThat(feeRate(size, 0L, Side.LONG, size)).isBetween(10L, 100L);
        }
    }

    @Test
    @DisplayName("체결 수수료는 담보 토큰 단위로 환산")
    void tradingFeeInCollateralToken() {
        // 1 BTC @ $10,000, 0.1% → $10 → 10 USDC (6 decimals)
        OraclePrice btc = new OraclePrice(1_000_000_000_000L, 8, 0L);
        OraclePrice usdc = new OraclePrice(100_000_000L, 8, 0L);

        long fee = FeeCalculator.tradingFeeAmount(1_000_000_000L, 9, btc, 10_000L, usdc, 6);

        assertThat(fee).isEqualTo(10_000_000L);
    }

    // ============================================
    // 담보 충분성 / 레버리지
    // ============================================

    @Test
    @DisplayName("가용 담보는 수수료보다 커야 함 (같으면 거부)")
    void collateralMustExceedFee() {
        assertThatThrownBy(() -> FeeCalculator.checkCollateralForAdding(6L, 4L, 10L))
                .isInstanceOf(EngineException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.INSUFFICIENT_COLLATERAL);
        assertThatCode(() -> FeeCalculator.checkCollateralForAdding(7L, 4L, 10L)).doesNotThrowAnyException();

        assertThatThrownBy(() -> FeeCalculator.checkCollateralForReducing(0L, 5L, 5L, 10L))
                .isInstanceOf(EngineException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.INSUFFICIENT_COLLATERAL);
        assertThatCode(() -> FeeCalculator.checkCollateralForReducing(0L, 5L, 6L, 10L)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("레버리지: $10,000 / $1,000 = 10x, 담보 0이면 무한대")
    void leverage() {
        assertThat(FeeCalculator.leverageMbp(10_000_000_000_000L, 1_000_000_000_000L)).isEqualTo(100_000_000L);
        assertThat(FeeCalculator.leverageMbp(1L, 0L)).isEqualTo(Long.MAX_VALUE);
    }

    // ============================================
    // 청산 판정
    // ============================================

    @Test
    @DisplayName("담보 $1,000, 명목 $10,000, 유지증거금 150bp: 손실 $990 → 청산, $800 → 유지")
    void liquidationPredicate() {
        long collateral = usd(1_000);
        long notional = usd(10_000);

        assertThat(FeeCalculator.checkPositionLiquidated(collateral, SignedAmount.negative(usd(990)), 0L,
                SignedAmount.ZERO, notional, 150L)).isTrue();
        assertThat(FeeCalculator.checkPositionLiquidated(collateral, SignedAmount.negative(usd(800)), 0L,
                SignedAmount.ZERO, notional, 150L)).isFalse();
    }

    @Test
    @DisplayName("남은 담보가 유지증거금과 같으면 청산 대상 아님, 받을 펀딩은 담보에 더해짐")
    void liquidationBoundaryAndFunding() {
        long collateral = usd(1_000);
        long notional = usd(10_000);

        // 1,000 - 850 = 150 = 10,000 * 1.5%
        assertThat(FeeCalculator.checkPositionLiquidated(collateral, SignedAmount.negative(usd(850)), 0L,
                SignedAmount.ZERO, notional, 150L)).isFalse();
        // 1,000 - 990 + 150 = 160
        assertThat(FeeCalculator.checkPositionLiquidated(collateral, SignedAmount.negative(usd(990)), 0L,
                SignedAmount.negative(usd(150)), notional, 150L)).isFalse();
        // 비용 포함: 1,000 - 800 - 60 = 140
        assertThat(FeeCalculator.checkPositionLiquidated(collateral, SignedAmount.negative(usd(800)), usd(60),
                SignedAmount.ZERO, notional, 150L)).isTrue();
    }

    private static long usd(long dollars) {
        return dollars * 1_000_000_000L;
    }
}
