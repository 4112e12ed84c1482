// =====================================================
// FundingEngine - 펀딩 인덱스 갱신
// =====================================================
// 역할: 구간마다 롱/숏 불균형에 비례해 누적 펀딩 인덱스를 이동
//
// 처리 흐름:
// 1. aligned = now 를 펀딩 구간 경계로 내림
// 2. aligned <= lastFundingTs → 아무것도 하지 않음 (재시도 안전)
// 3. intervals = (aligned - lastFundingTs) / interval
// 4. exposureUsd = |long - short| 의 USD 가치
// 5. increment = basicFundingRate * exposureUsd / tvlUsd * intervals (TVL 0 이면 0)
// 6. 이전 스냅샷 보관 후 인덱스 갱신
//    - 롱 우세: 인덱스 증가 (롱이 숏에게 지불)
//    - 숏 우세: 인덱스 감소 (0을 지나면 부호 전환)
// =====================================================

package dustin.perp.domains.engine.funding;

import dustin.perp.domains.engine.EngineContext;
import dustin.perp.domains.engine.event.EngineEventType;
import dustin.perp.domains.engine.market.MarketConfig;
import dustin.perp.domains.engine.market.MarketInfo;
import dustin.perp.domains.engine.market.SymbolMarket;
import dustin.perp.domains.engine.math.EngineMath;
import dustin.perp.domains.engine.math.SignedAmount;
import dustin.perp.domains.engine.port.OraclePrice;
import lombok.extern.slf4j.Slf4j;

/**
 * 펀딩 엔진
 * Funding engine
 */
@Slf4j
public class FundingEngine {

    /**
     * 펀딩 구간 경계로 내림
     */
    public static long alignedTime(long nowMs, long intervalMs) {
        return nowMs / intervalMs * intervalMs;
    }

    /**
     * 펀딩 인덱스 갱신
     *
     * @param ctx 실행 컨텍스트 (거래 가격 필요)
     * @return 갱신 결과 (구간이 지나지 않았으면 updated=false)
     */
    public FundingUpdate updateFunding(EngineContext ctx) {
        SymbolMarket symbolMarket = ctx.getSymbolMarket();
        MarketInfo info = symbolMarket.getInfo();
        MarketConfig config = symbolMarket.getConfig();

        long aligned = alignedTime(ctx.getNowMs(), config.getFundingIntervalMs());
        if (aligned <= info.getLastFundingTs()) {
            return FundingUpdate.builder()
                    .symbol(symbolMarket.getBaseToken())
                    .updated(false)
                    .increment(SignedAmount.ZERO)
                    .previousIndex(info.getCumulativeFundingIndex())
                    .currentIndex(info.getCumulativeFundingIndex())
                    .lastFundingTs(info.getLastFundingTs())
                    .build();
        }

        long intervals = (aligned - info.getLastFundingTs()) / config.getFundingIntervalMs();
        long longSize = info.getUserLongPositionSize();
        long shortSize = info.getUserShortPositionSize();
        OraclePrice price = ctx.getTradingPrice();
        long exposureUsd = EngineMath.amountToUsdSaturating(Math.abs(longSize - shortSize), info.getSizeDecimal(),
                price.getPrice(), price.getDecimal());

        long tvlUsd = ctx.getPool().tvlUsd();
        long magnitude = tvlUsd == 0 ? 0L
                : EngineMath.mulDiv(EngineMath.mulDiv(config.getBasicFundingRate(), exposureUsd, tvlUsd), intervals, 1L);
        SignedAmount increment = longSize >= shortSize
                ? SignedAmount.positive(magnitude)
                : SignedAmount.negative(magnitude);

        SignedAmount previous = info.getCumulativeFundingIndex();
        info.setPreviousLastFundingTs(info.getLastFundingTs());
        info.setPreviousCumulativeFundingIndex(previous);
        info.setCumulativeFundingIndex(previous.add(increment));
        info.setLastFundingTs(aligned);

        ctx.emit(ctx.event(EngineEventType.FUNDING_UPDATED)
                .detail(increment.isNegative() ? "shorts_pay" : "longs_pay")
                .amount("intervals", intervals)
                .amount("exposure_usd", exposureUsd)
                .amount("increment", magnitude)
                .amount("index_before", previous.getMagnitude())
                .amount("index_after", info.getCumulativeFundingIndex().getMagnitude())
                .amount("index_after_negative", info.getCumulativeFundingIndex().isNegative() ? 1L : 0L));
        log.info("[FundingEngine] 펀딩 갱신: symbol={}, intervals={}, increment={}, index={}",
                symbolMarket.getBaseToken(), intervals, increment, info.getCumulativeFundingIndex());

        return FundingUpdate.builder()
                .symbol(symbolMarket.getBaseToken())
                .updated(true)
                .intervals(intervals)
                .exposureUsd(exposureUsd)
                .increment(increment)
                .previousIndex(previous)
                .currentIndex(info.getCumulativeFundingIndex())
                .lastFundingTs(aligned)
                .build();
    }
}
