// =====================================================
// PositionLedger - 포지션 원장
// =====================================================
// 역할: 체결된 주문을 포지션에 반영하고 비용/손익을 실현
//
// 체결 처리 흐름:
// 1. planFill: 수수료율 계산 (동적 수수료 곡선) + 모든 검증, 상태 변경 없음
// 2. applyFill: 연결 포지션이 없으면 → 신규 포지션 생성
// 3. 연결 포지션이 있으면
//    a. 같은 방향 → 차입 비용/펀딩 실현 후 수량 증가, 가중 평균 진입가
//    b. 반대 방향 → 수량 감소, 손익 실현 (이익은 해제되는 준비금으로 상한)
//       누적 비용은 손익과 함께 정산
//    c. 수량 0 + 초과분 → 방향 전환, 기존 연결 주문 취소
//    d. 수량 0 → 포지션 종료, 담보 반환, 연결 주문 취소
//
// 담보 방식:
// - TOKEN: 비용/손익을 담보 토큰 잔고에서 즉시 차감/가산
// - OPTION: receipt는 행사 전까지 차감 불가 → pendingCost에 누적
//
// 풀과의 자금 흐름:
// - 이익/펀딩 수취: pool.requestCollateral
// - 손실/차입 비용/펀딩 지불: pool.putCollateral
// - 수수료: 프로토콜 몫은 마켓 금고, 나머지는 pool.orderFilled
// =====================================================

package dustin.perp.domains.engine.position;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import dustin.perp.domains.engine.EngineContext;
import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;
import dustin.perp.domains.engine.event.EngineEventType;
import dustin.perp.domains.engine.fee.FeeCalculator;
import dustin.perp.domains.engine.liquidation.ReceiptSettler;
import dustin.perp.domains.engine.market.Market;
import dustin.perp.domains.engine.market.MarketConfig;
import dustin.perp.domains.engine.market.MarketInfo;
import dustin.perp.domains.engine.market.SymbolMarket;
import dustin.perp.domains.engine.math.EngineMath;
import dustin.perp.domains.engine.math.SignedAmount;
import dustin.perp.domains.engine.model.Side;
import dustin.perp.domains.engine.order.OrderBucket;
import dustin.perp.domains.engine.order.OrderRefunds;
import dustin.perp.domains.engine.order.TradingOrder;
import dustin.perp.domains.engine.port.BidReceipt;
import dustin.perp.domains.engine.port.LiquidityPool;
import dustin.perp.domains.engine.port.OraclePrice;
import lombok.extern.slf4j.Slf4j;

/**
 * 포지션 원장
 * Position ledger
 */
@Slf4j
public class PositionLedger {

    private final ReceiptSettler receiptSettler;

    public PositionLedger(ReceiptSettler receiptSettler) {
        this.receiptSettler = receiptSettler;
    }

    // ============================================
    // 체결 반영
    // ============================================

    /**
     * 체결된 주문을 원장에 반영 (체결 가격 = 현재 오라클 가격)
     *
     * @param ctx 실행 컨텍스트
     * @param order 발동된 주문 (주문장에서 이미 빠진 상태)
     * @return 체결 결과
     * @throws EngineException 체결 불가 시 (상태 변경 없음)
     */
    public FillOutcome orderFilled(EngineContext ctx, TradingOrder order) {
        return applyFill(ctx, order, planFill(ctx, order));
    }

    /**
     * 체결 계획: 체결에 필요한 모든 검증을 상태 변경 없이 수행
     * 차단되지 않은 계획은 applyFill에서 실패하지 않음
     */
    public FillPlan planFill(EngineContext ctx, TradingOrder order) {
        long feeMbp = feeRateFor(ctx, order.getSide(), order.getSize());
        FillPlan plan = new FillPlan(feeMbp, feeAmount(ctx, order.getSize(), feeMbp));
        if (!order.getCollateralToken().equals(ctx.getCollateralToken())) {
            return plan.block(ErrorCode.COLLATERAL_TOKEN_MISMATCH, "collateral token mismatch");
        }
        LiquidityPool pool = ctx.getPool();
        if (!order.isReduceOnly() && !(pool.isActive() && pool.isTokenActive(order.getCollateralToken()))) {
            return plan.block(ErrorCode.POOL_INACTIVE, "pool inactive");
        }

        Position position = null;
        if (order.getLinkedPositionId() != null) {
            position = ctx.getSymbolMarket().getPositions().get(order.getLinkedPositionId()).orElse(null);
            if (position == null) {
                return plan.block(ErrorCode.POSITION_NOT_FOUND, "linked position gone");
            }
            plan.position = position;
            plan.costs = accrued(ctx, position);
        }
        long orderCollateral = orderCollateralValue(ctx, order);

        if (position == null || position.getSide() == order.getSide()) {
            if (order.isReduceOnly()) {
                return plan.block(ErrorCode.INVALID_REDUCE_ONLY, "reduce-only order on the position side");
            }
            if (checkHeadroom(ctx, plan, order.getSide(), order.getSize(), order.getCollateralToken()).isBlocked()) {
                return plan;
            }
            long positionCollateral = 0;
            if (position != null) {
                if (!position.isOptionCollateral() && !costsCovered(position, plan.costs)) {
                    return plan.block(ErrorCode.INSUFFICIENT_COLLATERAL, "accrued costs exceed collateral");
                }
                SignedAmount net = netCollateral(ctx, position, plan.costs);
                positionCollateral = net.isNegative() ? 0 : net.getMagnitude();
            }
            try {
                FeeCalculator.checkCollateralForAdding(orderCollateral, positionCollateral, plan.getFee());
            } catch (EngineException e) {
                return plan.block(e.getCode(), "insufficient collateral");
            }
            return plan;
        }

        ReducePlan reduce = planReduce(ctx, position, order, plan.getFee(), plan.costs);
        if (!reduce.feasible) {
            return plan.block(ErrorCode.INSUFFICIENT_COLLATERAL, "insufficient collateral");
        }
        if (reduce.overshoot > 0
                && checkHeadroom(ctx, plan, order.getSide(), reduce.overshoot, order.getCollateralToken()).isBlocked()) {
            return plan;
        }
        plan.reduce = reduce;
        return plan;
    }

    /**
     * 검증된 체결 계획을 원장에 반영
     *
     * @throws EngineException 차단된 계획인 경우 (상태 변경 없음)
     */
    public FillOutcome applyFill(EngineContext ctx, TradingOrder order, FillPlan plan) {
        if (plan.isBlocked()) {
            throw new EngineException(plan.getBlockCode(),
                    "Order " + order.getOrderId() + " cannot be filled: " + plan.getBlocker());
        }
        if (plan.position == null) {
            return openPosition(ctx, order, plan.getFeeMbp(), plan.getFee());
        }

        Position position = plan.position;
        position.unlinkOrder(order.getOrderId());
        if (plan.reduce == null) {
            realizeAccruedCosts(ctx, position, plan.costs);
            return increasePosition(ctx, position, order, plan.getFeeMbp(), plan.getFee());
        }
        return reducePosition(ctx, position, order, plan);
    }

    private FillPlan checkHeadroom(EngineContext ctx, FillPlan plan, Side side, long size, String token) {
        SymbolMarket symbolMarket = ctx.getSymbolMarket();
        long openInterest = EngineMath.saturatingAdd(symbolMarket.getInfo().positionSize(side), size);
        if (openInterest > symbolMarket.getConfig().getMaxOpenInterest()) {
            return plan.block(ErrorCode.OPEN_INTEREST_EXCEEDED, "open interest limit");
        }
        if (ctx.getPool().tokenState(token).freeLiquidity() < reserveFor(ctx, size)) {
            return plan.block(ErrorCode.INSUFFICIENT_RESERVE, "insufficient pool reserve");
        }
        return plan;
    }

    private FillOutcome openPosition(EngineContext ctx, TradingOrder order, long feeMbp, long fee) {
        SymbolMarket symbolMarket = ctx.getSymbolMarket();
        MarketInfo info = symbolMarket.getInfo();
        OraclePrice price = ctx.getTradingPrice();

        checkOpenInterest(symbolMarket, order.getSide(), order.getSize());

        long reserve = reserveFor(ctx, order.getSize());
        ctx.getPool().updateReserveAmount(order.getCollateralToken(), true, reserve);

        Position position = Position.builder()
                .positionId(info.takeNextPositionId())
                .user(order.getUser())
                .side(order.getSide())
                .size(order.getSize())
                .collateralMode(order.getCollateralMode())
                .collateralToken(order.getCollateralToken())
                .vaultIndex(order.getVaultIndex())
                .receipts(new ArrayList<>(order.getReceipts()))
                .entryPrice(price.getPrice())
                .priceDecimal(price.getDecimal())
                .reserveAmount(reserve)
                .lastBorrowRate(ctx.getBorrowRate())
                .lastFundingIndex(info.getCumulativeFundingIndex())
                .createdAtMs(ctx.getNowMs())
                .updatedAtMs(ctx.getNowMs())
                .build();
        chargeTradingFee(ctx, position, order.getCollateralAmount(), fee);
        position.setRealizedTradingFee(fee);

        info.addPositionSize(order.getSide(), order.getSize());
        symbolMarket.getPositions().insert(position);

        ctx.emit(ctx.event(EngineEventType.POSITION_OPENED)
                .user(position.getUser())
                .orderId(order.getOrderId())
                .positionId(position.getPositionId())
                .amount("size", position.getSize())
                .amount("entry_price", position.getEntryPrice())
                .amount("collateral", collateralValue(ctx, position))
                .amount("reserve", reserve)
                .amount("fee", fee)
                .amount("fee_mbp", feeMbp));
        log.info("[PositionLedger] 포지션 생성: positionId={}, user={}, side={}, size={}, entry={}",
                position.getPositionId(), position.getUser(), position.getSide(), position.getSize(), position.getEntryPrice());

        return FillOutcome.builder()
                .action(FillOutcome.Action.OPENED)
                .positionId(position.getPositionId())
                .filledSize(order.getSize())
                .fillPrice(price.getPrice())
                .feeMbp(feeMbp)
                .feeAmount(fee)
                .build();
    }

    private FillOutcome increasePosition(EngineContext ctx, Position position, TradingOrder order,
                                         long feeMbp, long fee) {
        SymbolMarket symbolMarket = ctx.getSymbolMarket();
        OraclePrice price = ctx.getTradingPrice();

        checkOpenInterest(symbolMarket, order.getSide(), order.getSize());

        long addedReserve = reserveFor(ctx, order.getSize());
        ctx.getPool().updateReserveAmount(position.getCollateralToken(), true, addedReserve);

        long newSize = EngineMath.addExact(position.getSize(), order.getSize());
        BigInteger weighted = BigInteger.valueOf(position.getEntryPrice()).multiply(BigInteger.valueOf(position.getSize()))
                .add(BigInteger.valueOf(price.getPrice()).multiply(BigInteger.valueOf(order.getSize())));
        position.setEntryPrice(EngineMath.toLongExact(weighted.divide(BigInteger.valueOf(newSize))));
        position.setSize(newSize);
        position.setReserveAmount(EngineMath.addExact(position.getReserveAmount(), addedReserve));
        position.getReceipts().addAll(order.getReceipts());
        chargeTradingFee(ctx, position, order.getCollateralAmount(), fee);
        position.setRealizedTradingFee(EngineMath.addExact(position.getRealizedTradingFee(), fee));
        position.setUpdatedAtMs(ctx.getNowMs());

        symbolMarket.getInfo().addPositionSize(order.getSide(), order.getSize());

        ctx.emit(ctx.event(EngineEventType.POSITION_INCREASED)
                .user(position.getUser())
                .orderId(order.getOrderId())
                .positionId(position.getPositionId())
                .amount("size_delta", order.getSize())
                .amount("size_after", newSize)
                .amount("entry_price", position.getEntryPrice())
                .amount("collateral", collateralValue(ctx, position))
                .amount("fee", fee)
                .amount("fee_mbp", feeMbp));

        return FillOutcome.builder()
                .action(FillOutcome.Action.INCREASED)
                .positionId(position.getPositionId())
                .filledSize(order.getSize())
                .fillPrice(price.getPrice())
                .feeMbp(feeMbp)
                .feeAmount(fee)
                .build();
    }

    /**
     * 반대 방향 체결: 누적 비용은 실현 손익과 함께 정산 (담보 부족분은 이익으로 충당)
     */
    private FillOutcome reducePosition(EngineContext ctx, Position position, TradingOrder order, FillPlan fillPlan) {
        SymbolMarket symbolMarket = ctx.getSymbolMarket();
        LiquidityPool pool = ctx.getPool();
        OraclePrice price = ctx.getTradingPrice();
        String token = position.getCollateralToken();
        ReducePlan plan = fillPlan.reduce;
        long fee = fillPlan.getFee();
        long feeMbp = fillPlan.getFeeMbp();

        settleAccruedCosts(ctx, position, fillPlan.costs);
        pool.updateReserveAmount(token, false, plan.reserveRelease);
        if (position.isOptionCollateral()) {
            position.getReceipts().addAll(order.getReceipts());
            position.setPendingCost(position.getPendingCost()
                    .add(SignedAmount.positive(fee))
                    .add(SignedAmount.positive(plan.loss))
                    .subtract(SignedAmount.positive(plan.profit)));
        } else {
            if (plan.profit > 0) {
                pool.requestCollateral(token, plan.profit);
            }
            if (plan.loss > 0) {
                pool.putCollateral(token, plan.loss);
            }
            collectTradingFee(ctx, token, fee);
            position.setCollateralAmount(plan.collateralAfter.getMagnitude());
        }

        SignedAmount realized = SignedAmount.positive(plan.profit).subtract(SignedAmount.positive(plan.loss));
        position.setRealizedPnl(position.getRealizedPnl().add(realized));
        position.setRealizedTradingFee(EngineMath.addExact(position.getRealizedTradingFee(), fee));
        position.setSize(position.getSize() - plan.reduceSize);
        position.setReserveAmount(position.getReserveAmount() - plan.reserveRelease);
        position.setUpdatedAtMs(ctx.getNowMs());
        symbolMarket.getInfo().subPositionSize(position.getSide(), plan.reduceSize);

        FillOutcome.FillOutcomeBuilder outcome = FillOutcome.builder()
                .positionId(position.getPositionId())
                .filledSize(order.getSize())
                .fillPrice(price.getPrice())
                .feeMbp(feeMbp)
                .feeAmount(fee)
                .realizedPnl(realized);

        if (position.getSize() > 0) {
            ctx.emit(ctx.event(EngineEventType.POSITION_REDUCED)
                    .user(position.getUser())
                    .orderId(order.getOrderId())
                    .positionId(position.getPositionId())
                    .amount("size_delta", plan.reduceSize)
                    .amount("size_after", position.getSize())
                    .amount("profit", plan.profit)
                    .amount("loss", plan.loss)
                    .amount("fee", fee));
            return outcome.action(FillOutcome.Action.REDUCED).build();
        }

        if (plan.overshoot > 0) {
            flipPosition(ctx, position, order.getSide(), plan.overshoot);
            return outcome.action(FillOutcome.Action.FLIPPED).build();
        }

        closePosition(ctx, position);
        return outcome.action(FillOutcome.Action.CLOSED).build();
    }

    /**
     * 방향 전환: 이전 방향 기준으로 걸린 연결 주문은 모두 취소 후 환불
     */
    private void flipPosition(EngineContext ctx, Position position, Side newSide, long size) {
        SymbolMarket symbolMarket = ctx.getSymbolMarket();
        checkOpenInterest(symbolMarket, newSide, size);
        cancelLinkedOrders(ctx, position, "position flipped");
        long reserve = reserveFor(ctx, size);
        ctx.getPool().updateReserveAmount(position.getCollateralToken(), true, reserve);

        position.setSide(newSide);
        position.setSize(size);
        position.setEntryPrice(ctx.getTradingPrice().getPrice());
        position.setReserveAmount(reserve);
        symbolMarket.getInfo().addPositionSize(newSide, size);

        ctx.emit(ctx.event(EngineEventType.POSITION_FLIPPED)
                .user(position.getUser())
                .positionId(position.getPositionId())
                .detail(newSide.name())
                .amount("size_after", size)
                .amount("entry_price", position.getEntryPrice())
                .amount("reserve", reserve));
        log.info("[PositionLedger] 포지션 방향 전환: positionId={}, side={}, size={}",
                position.getPositionId(), newSide, size);
    }

    /**
     * 포지션 종료: 저장소에서 제거, 연결 주문 취소, 담보 반환
     */
    public void closePosition(EngineContext ctx, Position position) {
        SymbolMarket symbolMarket = ctx.getSymbolMarket();
        LiquidityPool pool = ctx.getPool();
        String token = position.getCollateralToken();

        symbolMarket.getPositions().remove(position.getPositionId());
        cancelLinkedOrders(ctx, position, "position closed");
        if (position.getReserveAmount() > 0) {
            pool.updateReserveAmount(token, false, position.getReserveAmount());
            position.setReserveAmount(0);
        }

        long returned;
        if (position.isOptionCollateral()) {
            SignedAmount pending = position.getPendingCost();
            long owedToPool = 0;
            if (pending.isNegative()) {
                pool.requestCollateral(token, pending.getMagnitude());
                ctx.getPayouts().credit(position.getUser(), token, pending.getMagnitude());
            } else {
                owedToPool = pending.getMagnitude();
            }
            returned = collateralValue(ctx, position);
            receiptSettler.settle(ctx, position.getPositionId(), position.getUser(), position.getVaultIndex(),
                    token, position.getReceipts(), null, 0L, owedToPool);
        } else {
            returned = position.getCollateralAmount();
            ctx.getPayouts().credit(position.getUser(), token, returned);
        }

        ctx.emit(ctx.event(EngineEventType.POSITION_CLOSED)
                .user(position.getUser())
                .positionId(position.getPositionId())
                .amount("collateral_returned", returned)
                .amount("realized_trading_fee", position.getRealizedTradingFee())
                .amount("realized_borrow_fee", position.getRealizedBorrowFee()));
        log.info("[PositionLedger] 포지션 종료: positionId={}, user={}, collateralReturned={}",
                position.getPositionId(), position.getUser(), returned);
    }

    /**
     * 포지션에 연결된 대기 주문 취소 및 환불
     */
    public void cancelLinkedOrders(EngineContext ctx, Position position, String reason) {
        SymbolMarket symbolMarket = ctx.getSymbolMarket();
        for (LinkedOrderRef ref : new ArrayList<>(position.getLinkedOrders())) {
            Optional<OrderBucket> bucket = symbolMarket.getOrderBook().locate(ref.getTriggerPrice(), ref.getOrderId());
            if (bucket.isEmpty()) {
                continue;
            }
            TradingOrder order = symbolMarket.getOrderBook()
                    .remove(bucket.get(), ref.getTriggerPrice(), ref.getOrderId())
                    .orElseThrow();
            symbolMarket.getInfo().subOrderSize(order.getSide(), order.getSize());
            OrderRefunds.refund(ctx, order);
            ctx.emit(ctx.event(EngineEventType.ORDER_RELEASED)
                    .user(order.getUser())
                    .orderId(order.getOrderId())
                    .positionId(position.getPositionId())
                    .detail(reason)
                    .amount("size", order.getSize())
                    .amount("trigger_price", order.getTriggerPrice()));
        }
        position.getLinkedOrders().clear();
    }

    // ============================================
    // 비용 실현
    // ============================================

    /**
     * 마지막 스냅샷 이후 누적된 차입 비용과 펀딩을 실현하고 스냅샷 갱신
     *
     * @throws EngineException 토큰 담보가 누적 비용을 감당하지 못하는 경우 (상태 변경 없음)
     */
    public void realizeAccruedCosts(EngineContext ctx, Position position) {
        AccruedCosts costs = accrued(ctx, position);
        if (!position.isOptionCollateral() && !costsCovered(position, costs)) {
            throw new EngineException(ErrorCode.INSUFFICIENT_COLLATERAL,
                    "Accrued costs exceed collateral of position " + position.getPositionId());
        }
        realizeAccruedCosts(ctx, position, costs);
    }

    private void realizeAccruedCosts(EngineContext ctx, Position position, AccruedCosts costs) {
        settleAccruedCosts(ctx, position, costs);
        if (!position.isOptionCollateral()) {
            long available = EngineMath.addExact(position.getCollateralAmount(), costs.credit());
            position.setCollateralAmount(available - costs.debit());
        }
    }

    /**
     * 토큰 담보 잔고 + 펀딩 수취분 >= 차입 비용 + 펀딩 지불분
     */
    boolean costsCovered(Position position, AccruedCosts costs) {
        return costs.debit() <= EngineMath.saturatingAdd(position.getCollateralAmount(), costs.credit());
    }

    /**
     * 비용의 풀 자금 흐름과 스냅샷 갱신 (토큰 담보 잔고는 호출자가 반영)
     * 옵션 담보는 미정산 비용에 누적
     */
    private void settleAccruedCosts(EngineContext ctx, Position position, AccruedCosts costs) {
        MarketInfo info = ctx.getSymbolMarket().getInfo();

        if (position.isOptionCollateral()) {
            position.setPendingCost(position.getPendingCost()
                    .add(SignedAmount.positive(costs.borrowFee))
                    .add(costs.fundingFee));
        } else {
            String token = position.getCollateralToken();
            if (costs.debit() > 0) {
                ctx.getPool().putCollateral(token, costs.debit());
            }
            if (costs.credit() > 0) {
                ctx.getPool().requestCollateral(token, costs.credit());
            }
        }

        position.setRealizedBorrowFee(EngineMath.addExact(position.getRealizedBorrowFee(), costs.borrowFee));
        position.setRealizedFundingFee(position.getRealizedFundingFee().add(costs.fundingFee));
        position.setLastBorrowRate(Math.max(position.getLastBorrowRate(), ctx.getBorrowRate()));
        position.setLastFundingIndex(info.getCumulativeFundingIndex());

        if (costs.borrowFee > 0 || !costs.fundingFee.isZero()) {
            ctx.emit(ctx.event(EngineEventType.COSTS_REALIZED)
                    .user(position.getUser())
                    .positionId(position.getPositionId())
                    .amount("borrow_fee", costs.borrowFee)
                    .amount("funding_fee", costs.fundingFee.getMagnitude())
                    .detail(costs.fundingFee.isNegative() ? "funding_received" : "funding_paid"));
        }
    }

    // ============================================
    // 담보 증감
    // ============================================

    /**
     * 담보 추가 (토큰 수량 또는 receipt)
     */
    public void increaseCollateral(EngineContext ctx, long positionId, String user, long amount,
                                   List<BidReceipt> receipts) {
        Position position = ownedPosition(ctx, positionId, user);
        if (!position.getCollateralToken().equals(ctx.getCollateralToken())) {
            throw new EngineException(ErrorCode.COLLATERAL_TOKEN_MISMATCH,
                    "Position collateral is " + position.getCollateralToken());
        }
        realizeAccruedCosts(ctx, position);
        long before = collateralValue(ctx, position);

        if (position.isOptionCollateral()) {
            if (receipts.isEmpty() || amount != 0) {
                throw new EngineException(ErrorCode.INVALID_ARGUMENT, "Option collateral is increased with receipts only");
            }
            for (BidReceipt receipt : receipts) {
                if (receipt.getVaultIndex() != position.getVaultIndex()) {
                    throw new EngineException(ErrorCode.BID_TOKEN_MISMATCH,
                            "Receipt " + receipt.getReceiptId() + " belongs to vault " + receipt.getVaultIndex());
                }
            }
            position.getReceipts().addAll(receipts);
        } else {
            if (amount <= 0 || !receipts.isEmpty()) {
                throw new EngineException(ErrorCode.INVALID_ARGUMENT, "Collateral amount must be positive");
            }
            position.setCollateralAmount(EngineMath.addExact(position.getCollateralAmount(), amount));
        }
        position.setUpdatedAtMs(ctx.getNowMs());

        ctx.emit(ctx.event(EngineEventType.COLLATERAL_INCREASED)
                .user(user)
                .positionId(positionId)
                .amount("collateral_before", before)
                .amount("collateral_after", collateralValue(ctx, position)));
    }

    /**
     * 담보 해제 (토큰 담보만)
     * 해제 후 청산 대상이 되거나 레버리지 한도를 넘으면 거부
     *
     * @return 해제된 수량
     */
    public long releaseCollateral(EngineContext ctx, long positionId, String user, long amount) {
        Position position = ownedPosition(ctx, positionId, user);
        if (position.isOptionCollateral()) {
            throw new EngineException(ErrorCode.COLLATERAL_MODE_MISMATCH,
                    "Option collateral is returned only when the position closes");
        }
        if (!position.getCollateralToken().equals(ctx.getCollateralToken())) {
            throw new EngineException(ErrorCode.COLLATERAL_TOKEN_MISMATCH,
                    "Position collateral is " + position.getCollateralToken());
        }
        if (amount <= 0) {
            throw new EngineException(ErrorCode.INVALID_ARGUMENT, "Release amount must be positive");
        }
        realizeAccruedCosts(ctx, position);
        long before = position.getCollateralAmount();
        if (amount > before) {
            throw new EngineException(ErrorCode.INSUFFICIENT_COLLATERAL,
                    "Release amount " + amount + " exceeds collateral " + before);
        }
        position.setCollateralAmount(before - amount);

        PositionValuation valuation = evaluate(ctx, position);
        if (valuation.isLiquidated()) {
            throw new EngineException(ErrorCode.RELEASE_TRIGGERS_LIQUIDATION,
                    "Releasing " + amount + " would make position " + positionId + " liquidatable");
        }
        MarketConfig config = ctx.getSymbolMarket().getConfig();
        long leverage = FeeCalculator.leverageMbp(valuation.getNotionalUsd(), valuation.getCollateralUsd());
        if (leverage > config.maxLeverageMbp(false)) {
            throw new EngineException(ErrorCode.LEVERAGE_EXCEEDED,
                    "Leverage " + leverage + " mbp exceeds cap " + config.getMaxLeverageMbp());
        }
        position.setUpdatedAtMs(ctx.getNowMs());
        ctx.getPayouts().credit(user, position.getCollateralToken(), amount);

        ctx.emit(ctx.event(EngineEventType.COLLATERAL_RELEASED)
                .user(user)
                .positionId(positionId)
                .amount("collateral_before", before)
                .amount("collateral_after", position.getCollateralAmount()));
        return amount;
    }

    private Position ownedPosition(EngineContext ctx, long positionId, String user) {
        Position position = ctx.getSymbolMarket().getPositions().get(positionId)
                .orElseThrow(() -> new EngineException(ErrorCode.POSITION_NOT_FOUND, "Position not found: " + positionId));
        if (!position.getUser().equals(user)) {
            throw new EngineException(ErrorCode.UNAUTHORIZED, "Position " + positionId + " is not owned by " + user);
        }
        return position;
    }

    // ============================================
    // 평가
    // ============================================

    /**
     * 현재 오라클 가격 기준 포지션 평가 (상태 변경 없음)
     * 비용 = 미실현 차입 비용 + 종료 수수료 (+ 옵션 담보 미정산 비용)
     */
    public PositionValuation evaluate(EngineContext ctx, Position position) {
        SymbolMarket symbolMarket = ctx.getSymbolMarket();
        AccruedCosts costs = accrued(ctx, position);

        long notionalUsd = notionalUsd(ctx, position.getSize());
        SignedAmount pnlUsd = pnlUsd(ctx, position, position.getSize());
        long closeFeeMbp = feeRateFor(ctx, position.getSide().opposite(), position.getSize());
        long closeFeeUsd = EngineMath.mulDiv(notionalUsd, closeFeeMbp, EngineMath.MBP_SCALE);
        long borrowUsd = toUsd(ctx, costs.borrowFee);

        long collateralUsd = toUsd(ctx, collateralValue(ctx, position));
        long costsUsd = EngineMath.addExact(borrowUsd, closeFeeUsd);
        SignedAmount pending = position.getPendingCost();
        long pendingUsd = toUsd(ctx, pending.getMagnitude());
        if (pending.isNegative()) {
            collateralUsd = EngineMath.addExact(collateralUsd, pendingUsd);
        } else {
            costsUsd = EngineMath.addExact(costsUsd, pendingUsd);
        }

        SignedAmount fundingUsd = fundingFeeUsd(position, symbolMarket.getInfo().getCumulativeFundingIndex(), notionalUsd);
        long mmBp = symbolMarket.getConfig().maintenanceMarginBp(position.isOptionCollateral());

        return PositionValuation.builder()
                .positionId(position.getPositionId())
                .user(position.getUser())
                .side(position.getSide())
                .size(position.getSize())
                .collateralToken(position.getCollateralToken())
                .notionalUsd(notionalUsd)
                .collateralUsd(collateralUsd)
                .pnlUsd(pnlUsd)
                .borrowFee(costs.borrowFee)
                .closeFeeMbp(closeFeeMbp)
                .costsUsd(costsUsd)
                .fundingUsd(fundingUsd)
                .remainingUsd(FeeCalculator.remainingCollateralUsd(collateralUsd, pnlUsd, costsUsd, fundingUsd))
                .maintenanceMarginUsd(FeeCalculator.maintenanceMarginUsd(notionalUsd, mmBp))
                .liquidated(FeeCalculator.checkPositionLiquidated(collateralUsd, pnlUsd, costsUsd, fundingUsd,
                        notionalUsd, mmBp))
                .build();
    }

    // ============================================
    // 계산 도우미
    // ============================================

    public long feeRateFor(EngineContext ctx, Side side, long size) {
        SymbolMarket symbolMarket = ctx.getSymbolMarket();
        MarketInfo info = symbolMarket.getInfo();
        OraclePrice price = ctx.getTradingPrice();
        return FeeCalculator.feeRateMbp(info.getUserLongPositionSize(), info.getUserShortPositionSize(),
                ctx.getPool().tvlUsd(), info.getSizeDecimal(), price.getPrice(), price.getDecimal(),
                side, size, symbolMarket.getConfig().feeCurve());
    }

    public long feeAmount(EngineContext ctx, long size, long feeMbp) {
        return FeeCalculator.tradingFeeAmount(size, ctx.sizeDecimal(), ctx.getTradingPrice(), feeMbp,
                ctx.getCollateralPrice(), ctx.getCollateralDecimal());
    }

    public long notionalUsd(EngineContext ctx, long size) {
        OraclePrice price = ctx.getTradingPrice();
        return EngineMath.amountToUsd(size, ctx.sizeDecimal(), price.getPrice(), price.getDecimal());
    }

    /**
     * 가격 손익 (USD), 롱은 가격 상승 시 이익
     */
    public SignedAmount pnlUsd(EngineContext ctx, Position position, long size) {
        OraclePrice price = ctx.getTradingPrice();
        long current = price.getPrice();
        long entry = position.getEntryPrice();
        boolean gain = position.getSide().isLong() ? current >= entry : current <= entry;
        long usd = EngineMath.amountToUsd(size, ctx.sizeDecimal(), Math.abs(current - entry), price.getDecimal());
        return SignedAmount.of(usd, !gain);
    }

    /**
     * 차입 비용 = (현재 누적 이자율 - 스냅샷) * 준비금 / 1e9
     */
    public long borrowFee(Position position, long cumulativeBorrowRate) {
        if (cumulativeBorrowRate <= position.getLastBorrowRate()) {
            return 0L;
        }
        return EngineMath.mulDiv(cumulativeBorrowRate - position.getLastBorrowRate(),
                position.getReserveAmount(), EngineMath.INDEX_SCALE);
    }

    /**
     * 펀딩 비용 (USD), 양수면 포지션이 지불
     * 롱: (현재 인덱스 - 스냅샷) * 명목가치 / 1e9, 숏은 부호 반대
     */
    public SignedAmount fundingFeeUsd(Position position, SignedAmount fundingIndex, long notionalUsd) {
        SignedAmount delta = fundingIndex.subtract(position.getLastFundingIndex());
        SignedAmount fee = delta.mulDiv(notionalUsd, EngineMath.INDEX_SCALE);
        return position.getSide().isLong() ? fee : fee.negate();
    }

    /**
     * 담보 가치 (담보 토큰 수량): 토큰 잔고 또는 receipt 내재가치
     */
    public long collateralValue(EngineContext ctx, Position position) {
        return position.isOptionCollateral()
                ? intrinsicValue(ctx, position.getReceipts())
                : position.getCollateralAmount();
    }

    public long orderCollateralValue(EngineContext ctx, TradingOrder order) {
        return order.isOptionCollateral()
                ? intrinsicValue(ctx, order.getReceipts())
                : order.getCollateralAmount();
    }

    public long intrinsicValue(EngineContext ctx, List<BidReceipt> receipts) {
        long total = 0;
        for (BidReceipt receipt : receipts) {
            total = EngineMath.saturatingAdd(total, ctx.getVault().intrinsicValue(receipt, ctx.getNowMs()));
        }
        return total;
    }

    /**
     * 체결 수량에 필요한 준비금 (담보 토큰 수량)
     */
    public long reserveFor(EngineContext ctx, long size) {
        return toCollateralAmount(ctx, notionalUsd(ctx, size));
    }

    public long toCollateralAmount(EngineContext ctx, long usd) {
        OraclePrice price = ctx.getCollateralPrice();
        return EngineMath.usdToAmount(usd, ctx.getCollateralDecimal(), price.getPrice(), price.getDecimal());
    }

    public long toUsd(EngineContext ctx, long amount) {
        OraclePrice price = ctx.getCollateralPrice();
        return EngineMath.amountToUsd(amount, ctx.getCollateralDecimal(), price.getPrice(), price.getDecimal());
    }

    AccruedCosts accrued(EngineContext ctx, Position position) {
        long borrow = borrowFee(position, ctx.getBorrowRate());
        SignedAmount fundingUsd = fundingFeeUsd(position,
                ctx.getSymbolMarket().getInfo().getCumulativeFundingIndex(),
                notionalUsd(ctx, position.getSize()));
        SignedAmount funding = SignedAmount.of(toCollateralAmount(ctx, fundingUsd.getMagnitude()), fundingUsd.isNegative());
        return new AccruedCosts(borrow, funding);
    }

    /**
     * 비용 반영 후 순 담보 (담보 토큰 수량, 음수 가능)
     */
    SignedAmount netCollateral(EngineContext ctx, Position position, AccruedCosts costs) {
        return SignedAmount.positive(collateralValue(ctx, position))
                .subtract(position.getPendingCost())
                .subtract(SignedAmount.positive(costs.borrowFee))
                .subtract(costs.fundingFee);
    }

    private ReducePlan planReduce(EngineContext ctx, Position position, TradingOrder order, long fee,
                                  AccruedCosts costs) {
        ReducePlan plan = new ReducePlan();
        plan.reduceSize = Math.min(order.getSize(), position.getSize());
        plan.overshoot = order.isReduceOnly() ? 0L : order.getSize() - plan.reduceSize;
        plan.reserveRelease = EngineMath.mulDiv(position.getReserveAmount(), plan.reduceSize, position.getSize());

        SignedAmount pnlUsd = pnlUsd(ctx, position, plan.reduceSize);
        if (pnlUsd.isPositive()) {
            plan.profit = Math.min(toCollateralAmount(ctx, pnlUsd.getMagnitude()), plan.reserveRelease);
        } else if (pnlUsd.isNegative()) {
            plan.loss = toCollateralAmount(ctx, pnlUsd.getMagnitude());
        }

        long orderCollateral = orderCollateralValue(ctx, order);
        SignedAmount net = netCollateral(ctx, position, costs);
        long netPositive = net.isNegative() ? 0L : net.getMagnitude();
        boolean feeCovered = EngineMath.saturatingAdd(EngineMath.saturatingAdd(orderCollateral, netPositive), plan.profit) > fee;

        plan.collateralAfter = net
                .add(SignedAmount.positive(orderCollateral))
                .add(SignedAmount.positive(plan.profit))
                .subtract(SignedAmount.positive(plan.loss))
                .subtract(SignedAmount.positive(fee));
        plan.feasible = feeCovered && !plan.collateralAfter.isNegative();
        return plan;
    }

    private void checkOpenInterest(SymbolMarket symbolMarket, Side side, long size) {
        long openInterest = EngineMath.saturatingAdd(symbolMarket.getInfo().positionSize(side), size);
        if (openInterest > symbolMarket.getConfig().getMaxOpenInterest()) {
            throw new EngineException(ErrorCode.OPEN_INTEREST_EXCEEDED,
                    "Open interest " + openInterest + " exceeds " + symbolMarket.getConfig().getMaxOpenInterest());
        }
    }

    /**
     * 수수료 부과: 토큰 담보는 즉시 차감 후 분배, 옵션 담보는 미정산 비용에 누적
     */
    private void chargeTradingFee(EngineContext ctx, Position position, long addedCollateral, long fee) {
        if (position.isOptionCollateral()) {
            position.setPendingCost(position.getPendingCost().add(SignedAmount.positive(fee)));
            return;
        }
        long total = EngineMath.addExact(position.getCollateralAmount(), addedCollateral);
        position.setCollateralAmount(EngineMath.subExact(total, fee));
        collectTradingFee(ctx, position.getCollateralToken(), fee);
    }

    /**
     * 수수료 분배: 프로토콜 몫은 마켓 금고, 나머지는 풀 수입
     */
    public void collectTradingFee(EngineContext ctx, String token, long fee) {
        if (fee == 0) {
            return;
        }
        Market market = ctx.getMarket();
        long protocolShare = EngineMath.mulDiv(fee, market.getProtocolFeeShareBp(), EngineMath.BP_SCALE);
        market.accrueProtocolFee(token, protocolShare);
        ctx.getPool().orderFilled(token, fee - protocolShare);
    }

    static final class AccruedCosts {
        static final AccruedCosts NONE = new AccruedCosts(0L, SignedAmount.ZERO);

        final long borrowFee;
        final SignedAmount fundingFee;

        AccruedCosts(long borrowFee, SignedAmount fundingFee) {
            this.borrowFee = borrowFee;
            this.fundingFee = fundingFee;
        }

        // 포지션이 내는 금액: 차입 비용 + 펀딩 지불
        long debit() {
            return EngineMath.saturatingAdd(borrowFee, fundingFee.isPositive() ? fundingFee.getMagnitude() : 0L);
        }

        long credit() {
            return fundingFee.isNegative() ? fundingFee.getMagnitude() : 0L;
        }
    }

    static final class ReducePlan {
        long reduceSize;
        long overshoot;
        long reserveRelease;
        long profit;
        long loss;
        SignedAmount collateralAfter = SignedAmount.ZERO;
        boolean feasible;
    }
}
