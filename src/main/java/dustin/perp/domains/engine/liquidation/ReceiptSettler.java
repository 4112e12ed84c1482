// =====================================================
// ReceiptSettler - 옵션 담보 receipt 정산
// =====================================================
// 역할: 옵션 담보 포지션 종료/청산 시 receipt를 행사하거나 보관
//
// 처리 흐름:
// 1. 만기된 receipt 행사 → bid 토큰 확보
// 2. 분배 순서: 청산자 몫 → 풀 몫 → 남은 금액은 포지션 소유자
// 3. 미지급 금액이 남고 미만기 receipt가 있으면 보관 기록 생성
// 4. 미지급 금액이 없으면 미만기 receipt는 소유자에게 반환
// 5. 미지급 금액이 남았는데 receipt도 없으면 풀 손실로 처리 (로깅)
// =====================================================

package dustin.perp.domains.engine.liquidation;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import dustin.perp.domains.engine.EngineContext;
import dustin.perp.domains.engine.event.EngineEventType;
import dustin.perp.domains.engine.market.Market;
import dustin.perp.domains.engine.port.BidReceipt;
import dustin.perp.domains.engine.port.OptionVault;
import lombok.extern.slf4j.Slf4j;

/**
 * 옵션 receipt 정산기
 * Exercises, returns or escrows option bid receipts
 */
@Slf4j
public class ReceiptSettler {

    /**
     * 포지션 종료/청산 시 receipt 정산
     *
     * @param ctx 실행 컨텍스트
     * @param positionId 포지션 id
     * @param user 포지션 소유자
     * @param vaultIndex 볼트 인덱스
     * @param bidToken bid 토큰
     * @param receipts 포지션 담보 receipt 전체
     * @param liquidator 청산자 (없으면 null)
     * @param owedToLiquidator 청산자에게 지급할 bid 토큰 수량
     * @param owedToPool 풀에 지급할 bid 토큰 수량
     */
    public void settle(EngineContext ctx, long positionId, String user, long vaultIndex, String bidToken,
                       List<BidReceipt> receipts, String liquidator, long owedToLiquidator, long owedToPool) {
        OptionVault vault = ctx.getVault();
        long exercised = 0;
        List<BidReceipt> unexpired = new ArrayList<>();
        for (BidReceipt receipt : receipts) {
            if (vault.isExpired(receipt, ctx.getNowMs())) {
                exercised += vault.exercise(receipt, ctx.getNowMs());
            } else {
                unexpired.add(receipt);
            }
        }

        long toLiquidator = Math.min(owedToLiquidator, exercised);
        exercised -= toLiquidator;
        long toPool = Math.min(owedToPool, exercised);
        exercised -= toPool;
        long remainingLiquidator = owedToLiquidator - toLiquidator;
        long remainingPool = owedToPool - toPool;

        if (toLiquidator > 0) {
            ctx.getPayouts().credit(liquidator, bidToken, toLiquidator);
        }
        if (toPool > 0) {
            ctx.getPool().putCollateral(bidToken, toPool);
        }
        ctx.getPayouts().credit(user, bidToken, exercised);

        if (remainingLiquidator == 0 && remainingPool == 0) {
            ctx.getPayouts().returnReceipts(user, unexpired);
            return;
        }

        if (unexpired.isEmpty()) {
            log.warn("[ReceiptSettler] 옵션 담보 부족, 풀 손실 처리: positionId={}, owedToPool={}, owedToLiquidator={}",
                    positionId, remainingPool, remainingLiquidator);
            return;
        }

        Market market = ctx.getMarket();
        UnsettledReceipt escrow = UnsettledReceipt.builder()
                .escrowId(market.takeNextEscrowId())
                .symbol(ctx.getSymbolMarket().getBaseToken())
                .positionId(positionId)
                .user(user)
                .liquidator(liquidator)
                .bidToken(bidToken)
                .vaultIndex(vaultIndex)
                .receipts(unexpired)
                .owedToLiquidator(remainingLiquidator)
                .owedToPool(remainingPool)
                .createdAtMs(ctx.getNowMs())
                .build();
        market.getUnsettledReceipts().add(escrow);
        ctx.emit(ctx.event(EngineEventType.RECEIPT_ESCROWED)
                .user(user)
                .positionId(positionId)
                .amount("escrow_id", escrow.getEscrowId())
                .amount("receipt_count", (long) unexpired.size())
                .amount("owed_to_liquidator", remainingLiquidator)
                .amount("owed_to_pool", remainingPool));
        log.info("[ReceiptSettler] 미만기 receipt 보관: escrowId={}, positionId={}, receipts={}",
                escrow.getEscrowId(), positionId, unexpired.size());
    }

    /**
     * 보관 중인 receipt 정산 (모든 receipt가 만기된 기록만)
     *
     * @param ctx 실행 컨텍스트 (market 필수)
     * @param maxOps 처리할 최대 기록 수
     * @return 정산된 기록 수
     */
    public int settleEscrows(EngineContext ctx, int maxOps) {
        OptionVault vault = ctx.getVault();
        int settled = 0;
        Iterator<UnsettledReceipt> it = ctx.getMarket().getUnsettledReceipts().iterator();
        while (it.hasNext() && settled < maxOps) {
            UnsettledReceipt escrow = it.next();
            boolean allExpired = escrow.getReceipts().stream()
                    .allMatch(r -> vault.isExpired(r, ctx.getNowMs()));
            if (!allExpired) {
                continue;
            }

            long exercised = 0;
            for (BidReceipt receipt : escrow.getReceipts()) {
                exercised += vault.exercise(receipt, ctx.getNowMs());
            }
            long toLiquidator = Math.min(escrow.getOwedToLiquidator(), exercised);
            exercised -= toLiquidator;
            long toPool = Math.min(escrow.getOwedToPool(), exercised);
            exercised -= toPool;

            if (toLiquidator > 0) {
                ctx.getPayouts().credit(escrow.getLiquidator(), escrow.getBidToken(), toLiquidator);
            }
            if (toPool > 0) {
                ctx.getPool().putCollateral(escrow.getBidToken(), toPool);
            }
            ctx.getPayouts().credit(escrow.getUser(), escrow.getBidToken(), exercised);

            long shortfall = escrow.getOwedToLiquidator() - toLiquidator + escrow.getOwedToPool() - toPool;
            if (shortfall > 0) {
                log.warn("[ReceiptSettler] receipt 행사 금액 부족: escrowId={}, shortfall={}",
                        escrow.getEscrowId(), shortfall);
            }

            it.remove();
            settled++;
            ctx.emit(ctx.event(EngineEventType.RECEIPT_SETTLED)
                    .symbol(escrow.getSymbol())
                    .user(escrow.getUser())
                    .positionId(escrow.getPositionId())
                    .amount("escrow_id", escrow.getEscrowId())
                    .amount("to_liquidator", toLiquidator)
                    .amount("to_pool", toPool)
                    .amount("to_user", exercised)
                    .amount("shortfall", shortfall));
        }
        return settled;
    }
}
