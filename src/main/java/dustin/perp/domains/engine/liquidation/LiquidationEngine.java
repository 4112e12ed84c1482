// =====================================================
// LiquidationEngine - 청산
// =====================================================
// 역할: 유지증거금 미달 포지션 청산, 청산 대상 조회, receipt 보관분 정산
//
// 청산 흐름:
// 1. 포지션 평가 (차입/펀딩 누적, 종료 수수료 포함)
// 2. 청산 대상이 아니면 중단 (POSITION_HEALTHY)
// 3. 포지션 제거, 미결제약정 감소, 연결 주문 취소/환불
// 4. 준비금 해제
// 5. 청산자 수수료 = 명목가치 * 100bp (가용 담보로 상한)
// 6. 나머지 담보는 풀로 (손실 보전)
//    옵션 담보: 만기 receipt 행사, 미만기 receipt는 미지급분과 함께 보관
// =====================================================

package dustin.perp.domains.engine.liquidation;

import java.util.ArrayList;
import java.util.List;

import dustin.perp.domains.engine.EngineContext;
import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;
import dustin.perp.domains.engine.event.EngineEventType;
import dustin.perp.domains.engine.market.SymbolMarket;
import dustin.perp.domains.engine.math.EngineMath;
import dustin.perp.domains.engine.position.Position;
import dustin.perp.domains.engine.position.PositionLedger;
import dustin.perp.domains.engine.position.PositionValuation;
import lombok.extern.slf4j.Slf4j;

/**
 * 청산 엔진
 * Liquidation engine
 */
@Slf4j
public class LiquidationEngine {

    /**
     * 청산자 수수료율 (bp)
     */
    public static final long LIQUIDATOR_FEE_BP = 100L;

    private final PositionLedger ledger;
    private final ReceiptSettler receiptSettler;

    public LiquidationEngine(PositionLedger ledger, ReceiptSettler receiptSettler) {
        this.ledger = ledger;
        this.receiptSettler = receiptSettler;
    }

    /**
     * 포지션 청산
     *
     * @param ctx 실행 컨텍스트 (담보 토큰 = 포지션 담보 토큰)
     * @param positionId 포지션 id
     * @param liquidator 청산 호출자
     * @throws EngineException POSITION_NOT_FOUND, POSITION_HEALTHY
     */
    public LiquidationResult liquidate(EngineContext ctx, long positionId, String liquidator) {
        SymbolMarket symbolMarket = ctx.getSymbolMarket();
        Position position = symbolMarket.getPositions().get(positionId)
                .orElseThrow(() -> new EngineException(ErrorCode.POSITION_NOT_FOUND, "Position not found: " + positionId));
        if (!position.getCollateralToken().equals(ctx.getCollateralToken())) {
            throw new EngineException(ErrorCode.COLLATERAL_TOKEN_MISMATCH,
                    "Position " + positionId + " is collateralized in " + position.getCollateralToken());
        }

        PositionValuation valuation = ledger.evaluate(ctx, position);
        if (!valuation.isLiquidated()) {
            throw new EngineException(ErrorCode.POSITION_HEALTHY,
                    "Position " + positionId + " is above maintenance margin: remaining="
                            + valuation.getRemainingUsd() + ", required=" + valuation.getMaintenanceMarginUsd());
        }

        String token = position.getCollateralToken();
        symbolMarket.getPositions().remove(positionId);
        symbolMarket.getInfo().subPositionSize(position.getSide(), position.getSize());
        ledger.cancelLinkedOrders(ctx, position, "position liquidated");
        if (position.getReserveAmount() > 0) {
            ctx.getPool().updateReserveAmount(token, false, position.getReserveAmount());
        }

        long feeOwed = ledger.toCollateralAmount(ctx,
                EngineMath.applyBp(valuation.getNotionalUsd(), LIQUIDATOR_FEE_BP));
        long available = ledger.collateralValue(ctx, position);
        long liquidatorFee = Math.min(feeOwed, available);
        long toPool = available - liquidatorFee;

        if (position.isOptionCollateral()) {
            receiptSettler.settle(ctx, positionId, position.getUser(), position.getVaultIndex(), token,
                    position.getReceipts(), liquidator, liquidatorFee, toPool);
        } else {
            ctx.getPayouts().credit(liquidator, token, liquidatorFee);
            if (toPool > 0) {
                ctx.getPool().putCollateral(token, toPool);
            }
        }

        ctx.emit(ctx.event(EngineEventType.POSITION_LIQUIDATED)
                .user(position.getUser())
                .positionId(positionId)
                .detail(liquidator)
                .amount("size", position.getSize())
                .amount("collateral", available)
                .amount("liquidator_fee", liquidatorFee)
                .amount("to_pool", toPool)
                .amount("notional_usd", valuation.getNotionalUsd())
                .amount("maintenance_margin_usd", valuation.getMaintenanceMarginUsd()));
        log.info("[LiquidationEngine] 포지션 청산: positionId={}, user={}, liquidator={}, liquidatorFee={}, toPool={}",
                positionId, position.getUser(), liquidator, liquidatorFee, toPool);

        return LiquidationResult.builder()
                .positionId(positionId)
                .user(position.getUser())
                .liquidator(liquidator)
                .collateralToken(token)
                .liquidatorFee(liquidatorFee)
                .toPool(toPool)
                .valuation(valuation)
                .build();
    }

    /**
     * 담보 토큰 기준 청산 대상 조회 (상태 변경 없음)
     *
     * @param includeAll true면 건전한 포지션도 포함
     */
    public List<LiquidationInfo> getLiquidationInfo(EngineContext ctx, boolean includeAll) {
        SymbolMarket symbolMarket = ctx.getSymbolMarket();
        List<LiquidationInfo> result = new ArrayList<>();
        for (Position position : symbolMarket.getPositions().all()) {
            if (!position.getCollateralToken().equals(ctx.getCollateralToken())) {
                continue;
            }
            PositionValuation valuation = ledger.evaluate(ctx, position);
            if (!includeAll && !valuation.isLiquidated()) {
                continue;
            }
            result.add(LiquidationInfo.builder()
                    .symbol(symbolMarket.getBaseToken())
                    .positionId(position.getPositionId())
                    .user(position.getUser())
                    .side(position.getSide())
                    .size(position.getSize())
                    .collateralToken(position.getCollateralToken())
                    .liquidated(valuation.isLiquidated())
                    .remainingUsd(valuation.getRemainingUsd())
                    .maintenanceMarginUsd(valuation.getMaintenanceMarginUsd())
                    .build());
        }
        return result;
    }

    /**
     * 보관 중인 receipt 정산
     *
     * @return 정산된 보관 기록 수
     */
    public int settleUnsettledReceipts(EngineContext ctx, int maxOps) {
        int settled = receiptSettler.settleEscrows(ctx, maxOps);
        if (settled > 0) {
            log.info("[LiquidationEngine] receipt 보관분 정산: market={}, settled={}, remaining={}",
                    ctx.getMarket().getLpToken(), settled, ctx.getMarket().getUnsettledReceipts().size());
        }
        return settled;
    }
}
