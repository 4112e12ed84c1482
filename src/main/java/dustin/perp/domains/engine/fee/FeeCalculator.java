// =====================================================
// FeeCalculator - 수수료/레버리지/증거금 계산
// =====================================================
// 역할: 모든 함수가 순수 함수 (상태 없음)
//
// 동적 수수료:
// 1. 체결 전 불균형 = |long - short|
// 2. 체결 후 불균형
//    - 불균형이 0이면 주문 수량
//    - 우세한 쪽 주문이면 불균형 + 수량
//    - 반대쪽 주문이 불균형보다 작거나 같으면 불균형 - 수량
//    - 반대쪽 주문이 불균형보다 크면 수량 - 불균형 (방향 전환)
// 3. 체결 후 불균형 <= 체결 전 불균형 → base
// 4. 예산 = TVL * allocatedExposure / 1e7, 예산이 0이면 base
// 5. fee = base + (max - base) * Δ불균형USD / 예산, max로 상한
//
// 증거금 판정:
// - 남은 담보 = 담보 + 손익 - 비용 - 펀딩
// - 남은 담보 < 명목가치 * 유지증거금률 → 청산 대상
// =====================================================

package dustin.perp.domains.engine.fee;

import java.math.BigInteger;

import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;
import dustin.perp.domains.engine.math.EngineMath;
import dustin.perp.domains.engine.math.SignedAmount;
import dustin.perp.domains.engine.model.Side;
import dustin.perp.domains.engine.port.OraclePrice;

/**
 * 수수료 및 레버리지 계산기
 * Fee and leverage calculator
 */
public final class FeeCalculator {

    private FeeCalculator() {
    }

    /**
     * 체결 수수료율 (mbp)
     *
     * @param longSize 현재 롱 포지션 총 수량
     * @param shortSize 현재 숏 포지션 총 수량
     * @param poolTvlUsd 풀 TVL (USD, 9 decimals)
     * @param sizeDecimal 수량 소수점 자리수
     * @param price 거래 가격
     * @param priceDecimal 가격 소수점 자리수
     * @param orderSide 주문 방향
     * @param orderSize 주문 수량
     * @param curve 수수료 곡선
     * @return base 이상 max 이하의 수수료율
     */
    public static long feeRateMbp(long longSize, long shortSize, long poolTvlUsd, int sizeDecimal,
                                  long price, int priceDecimal, Side orderSide, long orderSize,
                                  FeeCurve curve) {
        long base = curve.getBaseFeeMbp();
        long max = curve.getMaxFeeMbp();

        Side dominant = longSize >= shortSize ? Side.LONG : Side.SHORT;
        long original = Math.abs(longSize - shortSize);
        long updated;
        if (original == 0 || orderSide == dominant) {
            updated = EngineMath.saturatingAdd(original, orderSize);
        } else if (orderSize <= original) {
            updated = original - orderSize;
        } else {
            updated = orderSize - original;
        }

        if (updated <= original) {
            return base;
        }

        long budgetUsd = EngineMath.mulDivSaturating(poolTvlUsd, curve.getAllocatedExposureMbp(), EngineMath.MBP_SCALE);
        if (budgetUsd == 0) {
            return base;
        }

        long deltaUsd = EngineMath.amountToUsdSaturating(updated - original, sizeDecimal, price, priceDecimal);
        long extra = EngineMath.mulDivSaturating(max - base, deltaUsd, budgetUsd);
        return Math.min(max, EngineMath.saturatingAdd(base, extra));
    }

    /**
     * 체결 수수료 (담보 토큰 수량)
     * notionalUsd * feeMbp / 1e7 을 담보 토큰 가격으로 환산
     */
    public static long tradingFeeAmount(long size, int sizeDecimal, OraclePrice tradingPrice, long feeMbp,
                                        OraclePrice collateralPrice, int collateralDecimal) {
        long notionalUsd = EngineMath.amountToUsd(size, sizeDecimal, tradingPrice.getPrice(), tradingPrice.getDecimal());
        long feeUsd = EngineMath.mulDiv(notionalUsd, feeMbp, EngineMath.MBP_SCALE);
        return EngineMath.usdToAmount(feeUsd, collateralDecimal, collateralPrice.getPrice(), collateralPrice.getDecimal());
    }

    /**
     * 포지션 증가 시 담보 충분성 검사
     * 주문 담보 + 연결된 포지션 담보 > 수수료
     */
    public static void checkCollateralForAdding(long orderCollateral, long positionCollateral, long fee) {
        long available = EngineMath.saturatingAdd(orderCollateral, positionCollateral);
        if (available <= fee) {
            throw new EngineException(ErrorCode.INSUFFICIENT_COLLATERAL,
                    "Collateral " + available + " does not cover trading fee " + fee);
        }
    }

    /**
     * 포지션 감소 시 담보 충분성 검사
     * 주문 담보 + 포지션 담보 + 미실현 이익 > 수수료
     */
    public static void checkCollateralForReducing(long orderCollateral, long positionCollateral,
                                                  long unrealizedProfit, long fee) {
        long available = EngineMath.saturatingAdd(
                EngineMath.saturatingAdd(orderCollateral, positionCollateral), unrealizedProfit);
        if (available <= fee) {
            throw new EngineException(ErrorCode.INSUFFICIENT_COLLATERAL,
                    "Collateral and profit " + available + " do not cover trading fee " + fee);
        }
    }

    /**
     * 레버리지 (mbp, 1x = 10,000,000)
     * 담보가 0이면 무한대 취급 (Long.MAX_VALUE)
     */
    public static long leverageMbp(long notionalUsd, long collateralUsd) {
        if (collateralUsd == 0) {
            return Long.MAX_VALUE;
        }
        return EngineMath.mulDivSaturating(notionalUsd, EngineMath.MBP_SCALE, collateralUsd);
    }

    /**
     * 남은 담보 (USD) = 담보 + 손익 - 비용 - 펀딩
     *
     * @param fundingUsd 양수면 포지션이 지불, 음수면 수취
     */
    public static SignedAmount remainingCollateralUsd(long collateralUsd, SignedAmount pnlUsd, long costsUsd,
                                                      SignedAmount fundingUsd) {
        BigInteger remaining = BigInteger.valueOf(collateralUsd)
                .add(pnlUsd.toBigInteger())
                .subtract(BigInteger.valueOf(costsUsd))
                .subtract(fundingUsd.toBigInteger());
        return SignedAmount.fromBigInteger(remaining);
    }

    /**
     * 유지증거금 기준 (USD) = 명목가치 * mmBp / 10,000
     */
    public static long maintenanceMarginUsd(long notionalUsd, long maintenanceMarginBp) {
        return EngineMath.mulDivSaturating(notionalUsd, maintenanceMarginBp, EngineMath.BP_SCALE);
    }

    /**
     * 청산 대상 여부
     * 남은 담보 < 명목가치 * 유지증거금률
     */
    public static boolean checkPositionLiquidated(long collateralUsd, SignedAmount pnlUsd, long costsUsd,
                                                  SignedAmount fundingUsd, long notionalUsd,
                                                  long maintenanceMarginBp) {
        SignedAmount remaining = remainingCollateralUsd(collateralUsd, pnlUsd, costsUsd, fundingUsd);
        long threshold = maintenanceMarginUsd(notionalUsd, maintenanceMarginBp);
        return remaining.compareTo(SignedAmount.positive(threshold)) < 0;
    }
}
