// =====================================================
// OrderEngine - 조건부 주문 생성/취소/매칭
// =====================================================
// 역할: 주문 검증, 주문장 보관, 발동 가격 도달 시 체결
//
// 주문 생성 흐름:
// 1. 활성 상태 검증 (reduce-only 주문은 비활성 검사 면제)
// 2. 담보 검증 (토큰 담보: 풀 토큰, 옵션 담보: 볼트 bid 토큰)
// 3. 수량 검증 (lot 정렬, 최소 수량)
// 4. 레버리지 검증 (발동 가격 기준 명목가치 / 담보가치)
// 5. 미결제약정 여유 (연결 주문은 생략), 풀 준비금 여유
// 6. 이미 발동 조건 충족 → 즉시 체결
//    아니면 → 주문장에 보관, 대기 주문 수량 증가, 포지션에 연결
//
// 매칭 흐름:
// 1. 가격 레벨 전체를 꺼냄
// 2. 리스트 뒤에서부터 작업 예산만큼 처리 (LIFO, 시간 우선 없음)
//    - 체결 계획 (검증만, 상태 변경 없음)
//    - 연결 포지션이 사라졌거나 reduce-only가 더 이상 줄일 수 없는 주문 → 환불
//    - 그 밖의 체결 불가 → 보류 목록
//    - 체결 가능 → 원장에 반영
// 3. 처리 못한 주문 + 보류 주문을 다시 주문장에 넣음
// =====================================================

package dustin.perp.domains.engine.order;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import dustin.perp.domains.engine.EngineContext;
import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;
import dustin.perp.domains.engine.event.EngineEventType;
import dustin.perp.domains.engine.fee.FeeCalculator;
import dustin.perp.domains.engine.market.Market;
import dustin.perp.domains.engine.market.MarketConfig;
import dustin.perp.domains.engine.market.MarketInfo;
import dustin.perp.domains.engine.market.SymbolMarket;
import dustin.perp.domains.engine.math.EngineMath;
import dustin.perp.domains.engine.math.SignedAmount;
import dustin.perp.domains.engine.model.CollateralMode;
import dustin.perp.domains.engine.port.BidReceipt;
import dustin.perp.domains.engine.port.LiquidityPool;
import dustin.perp.domains.engine.port.OraclePrice;
import dustin.perp.domains.engine.position.FillOutcome;
import dustin.perp.domains.engine.position.FillPlan;
import dustin.perp.domains.engine.position.Position;
import dustin.perp.domains.engine.position.PositionLedger;
import lombok.extern.slf4j.Slf4j;

/**
 * 주문 엔진
 * Order engine
 */
@Slf4j
public class OrderEngine {

    private final PositionLedger ledger;

    public OrderEngine(PositionLedger ledger) {
        this.ledger = ledger;
    }

    // ============================================
    // 주문 생성
    // ============================================

    /**
     * 주문 생성
     *
     * @param ctx 실행 컨텍스트 (거래 가격, 담보 토큰 가격 검증 완료)
     * @param command 주문 요청
     * @return 주문 결과 (보관 또는 즉시 체결)
     * @throws EngineException 검증 실패 시 (상태 변경 없음)
     */
    public OrderResult createOrder(EngineContext ctx, CreateOrderCommand command) {
        Market market = ctx.getMarket();
        SymbolMarket symbolMarket = ctx.getSymbolMarket();
        MarketInfo info = symbolMarket.getInfo();
        MarketConfig config = symbolMarket.getConfig();
        LiquidityPool pool = ctx.getPool();
        String collateralToken = ctx.getCollateralToken();

        if (!command.isReduceOnly()) {
            if (!market.isActive()) {
                throw new EngineException(ErrorCode.MARKET_INACTIVE, "Market is suspended: " + market.getLpToken());
            }
            if (!info.isActive()) {
                throw new EngineException(ErrorCode.SYMBOL_INACTIVE, "Symbol is suspended: " + symbolMarket.getBaseToken());
            }
            if (!pool.isActive() || !pool.isTokenActive(collateralToken)) {
                throw new EngineException(ErrorCode.POOL_INACTIVE, "Pool is not accepting " + collateralToken);
            }
        }
        if (command.getSize() <= 0 || command.getTriggerPrice() <= 0) {
            throw new EngineException(ErrorCode.INVALID_ARGUMENT, "Size and trigger price must be positive");
        }
        validateCollateral(ctx, command);
        if (command.getSize() % config.getLotSize() != 0) {
            throw new EngineException(ErrorCode.SIZE_NOT_LOT_ALIGNED,
                    "Size " + command.getSize() + " is not a multiple of lot size " + config.getLotSize());
        }

        Position linked = null;
        if (command.getLinkedPositionId() != null) {
            linked = linkedPosition(ctx, command);
        }

        long leverageMbp = 0;
        if (command.isReduceOnly()) {
            if (linked == null || linked.getSide() == command.getSide() || command.getSize() > linked.getSize()) {
                throw new EngineException(ErrorCode.INVALID_REDUCE_ONLY,
                        "Reduce-only order must oppose a linked position and not exceed its size");
            }
        } else {
            if (command.getSize() < config.getMinSize()) {
                throw new EngineException(ErrorCode.SIZE_BELOW_MINIMUM,
                        "Size " + command.getSize() + " is below minimum " + config.getMinSize());
            }
            leverageMbp = checkLeverageAndHeadroom(ctx, command, linked);
        }

        OraclePrice price = ctx.getTradingPrice();
        TradingOrder order = TradingOrder.builder()
                .orderId(info.takeNextOrderId())
                .user(command.getUser())
                .side(command.getSide())
                .stopOrder(command.isStopOrder())
                .reduceOnly(command.isReduceOnly())
                .size(command.getSize())
                .triggerPrice(command.getTriggerPrice())
                .collateralMode(command.getCollateralMode())
                .collateralToken(collateralToken)
                .collateralAmount(command.getCollateralAmount())
                .vaultIndex(command.getVaultIndex())
                .receipts(new ArrayList<>(command.getReceipts()))
                .leverageMbp(leverageMbp)
                .linkedPositionId(command.getLinkedPositionId())
                .oraclePriceWhenPlacing(price.getPrice())
                .createdAtMs(ctx.getNowMs())
                .build();
        OrderBucket bucket = order.bucket();

        ctx.emit(ctx.event(EngineEventType.ORDER_CREATED)
                .user(order.getUser())
                .orderId(order.getOrderId())
                .positionId(order.getLinkedPositionId())
                .detail(bucket.getTag())
                .amount("size", order.getSize())
                .amount("trigger_price", order.getTriggerPrice())
                .amount("collateral", ledger.orderCollateralValue(ctx, order))
                .amount("leverage_mbp", leverageMbp));

        if (bucket.isTriggered(price.getPrice(), order.getTriggerPrice())) {
            FillOutcome outcome = fill(ctx, order);
            log.info("[OrderEngine] 주문 즉시 체결: orderId={}, user={}, bucket={}, size={}, price={}",
                    order.getOrderId(), order.getUser(), bucket.getTag(), order.getSize(), price.getPrice());
            return OrderResult.builder()
                    .orderId(order.getOrderId())
                    .bucket(bucket)
                    .triggerPrice(order.getTriggerPrice())
                    .leverageMbp(leverageMbp)
                    .filled(true)
                    .fill(outcome)
                    .build();
        }

        symbolMarket.getOrderBook().add(order);
        info.addOrderSize(order.getSide(), order.getSize());
        if (linked != null) {
            linked.linkOrder(order.getOrderId(), order.getTriggerPrice());
        }
        log.info("[OrderEngine] 주문 등록: orderId={}, user={}, bucket={}, size={}, trigger={}",
                order.getOrderId(), order.getUser(), bucket.getTag(), order.getSize(), order.getTriggerPrice());
        return OrderResult.builder()
                .orderId(order.getOrderId())
                .bucket(bucket)
                .triggerPrice(order.getTriggerPrice())
                .leverageMbp(leverageMbp)
                .filled(false)
                .build();
    }

    private void validateCollateral(EngineContext ctx, CreateOrderCommand command) {
        String collateralToken = ctx.getCollateralToken();
        if (command.getCollateralMode() == CollateralMode.TOKEN) {
            if (!ctx.getPool().hasToken(collateralToken)) {
                throw new EngineException(ErrorCode.COLLATERAL_TOKEN_MISMATCH,
                        "Token is not a pool collateral: " + collateralToken);
            }
            if (!command.getReceipts().isEmpty() || command.getCollateralAmount() < 0) {
                throw new EngineException(ErrorCode.INVALID_ARGUMENT, "Token collateral order takes an amount only");
            }
            return;
        }

        // reduce-only 주문은 포지션 receipt를 그대로 쓰므로 추가 receipt 없이 허용
        boolean receiptsRequired = !command.isReduceOnly();
        if (command.getVaultIndex() == null || command.getCollateralAmount() != 0
                || (receiptsRequired && command.getReceipts().isEmpty())) {
            throw new EngineException(ErrorCode.INVALID_ARGUMENT, "Option collateral order takes a vault and receipts");
        }
        String bidToken = ctx.getVault().bidToken(command.getVaultIndex());
        if (!bidToken.equals(collateralToken)) {
            throw new EngineException(ErrorCode.BID_TOKEN_MISMATCH,
                    "Vault " + command.getVaultIndex() + " bids in " + bidToken + ", not " + collateralToken);
        }
        for (BidReceipt receipt : command.getReceipts()) {
            if (receipt.getVaultIndex() != command.getVaultIndex()) {
                throw new EngineException(ErrorCode.BID_TOKEN_MISMATCH,
                        "Receipt " + receipt.getReceiptId() + " belongs to vault " + receipt.getVaultIndex());
            }
        }
    }

    private Position linkedPosition(EngineContext ctx, CreateOrderCommand command) {
        Position position = ctx.getSymbolMarket().getPositions().get(command.getLinkedPositionId())
                .orElseThrow(() -> new EngineException(ErrorCode.POSITION_NOT_FOUND,
                        "Linked position not found: " + command.getLinkedPositionId()));
        if (!position.getUser().equals(command.getUser())) {
            throw new EngineException(ErrorCode.UNAUTHORIZED,
                    "Position " + position.getPositionId() + " is not owned by " + command.getUser());
        }
        if (position.getCollateralMode() != command.getCollateralMode()) {
            throw new EngineException(ErrorCode.COLLATERAL_MODE_MISMATCH,
                    "Position " + position.getPositionId() + " uses " + position.getCollateralMode() + " collateral");
        }
        if (!position.getCollateralToken().equals(ctx.getCollateralToken())) {
            throw new EngineException(ErrorCode.COLLATERAL_TOKEN_MISMATCH,
                    "Position " + position.getPositionId() + " is collateralized in " + position.getCollateralToken());
        }
        if (position.isOptionCollateral() && !position.getVaultIndex().equals(command.getVaultIndex())) {
            throw new EngineException(ErrorCode.BID_TOKEN_MISMATCH,
                    "Position " + position.getPositionId() + " holds receipts of vault " + position.getVaultIndex());
        }
        return position;
    }

    /**
     * 레버리지 / 미결제약정 / 풀 준비금 검증
     * 반대 방향 연결 주문은 포지션 수량을 넘는 초과분만 새 노출로 계산
     *
     * @return 주문 레버리지 (mbp)
     */
    private long checkLeverageAndHeadroom(EngineContext ctx, CreateOrderCommand command, Position linked) {
        SymbolMarket symbolMarket = ctx.getSymbolMarket();
        MarketInfo info = symbolMarket.getInfo();
        MarketConfig config = symbolMarket.getConfig();
        OraclePrice price = ctx.getTradingPrice();
        boolean option = command.getCollateralMode() == CollateralMode.OPTION;

        long exposureSize = command.getSize();
        if (linked != null && linked.getSide() != command.getSide()) {
            exposureSize = Math.max(0L, command.getSize() - linked.getSize());
        }

        long orderCollateral = option
                ? ledger.intrinsicValue(ctx, command.getReceipts())
                : command.getCollateralAmount();
        long collateralUsd = ledger.toUsd(ctx, orderCollateral);
        long notionalUsd = EngineMath.amountToUsdSaturating(exposureSize, info.getSizeDecimal(),
                command.getTriggerPrice(), price.getDecimal());

        if (linked != null && linked.getSide() == command.getSide()) {
            long positionNotional = EngineMath.amountToUsdSaturating(linked.getSize(), info.getSizeDecimal(),
                    command.getTriggerPrice(), price.getDecimal());
            notionalUsd = EngineMath.saturatingAdd(notionalUsd, positionNotional);
            long positionCollateral = ledger.collateralValue(ctx, linked);
            SignedAmount pending = linked.getPendingCost();
            long netCollateral = pending.isNegative()
                    ? EngineMath.saturatingAdd(positionCollateral, pending.getMagnitude())
                    : EngineMath.saturatingSub(positionCollateral, pending.getMagnitude());
            collateralUsd = EngineMath.saturatingAdd(collateralUsd, ledger.toUsd(ctx, netCollateral));
        }

        long leverageMbp = exposureSize == 0 ? 0L : FeeCalculator.leverageMbp(notionalUsd, collateralUsd);
        long cap = config.maxLeverageMbp(option);
        if (leverageMbp > cap) {
            throw new EngineException(ErrorCode.LEVERAGE_EXCEEDED,
                    "Leverage " + leverageMbp + " mbp exceeds cap " + cap + " mbp");
        }

        if (linked == null) {
            long openInterest = EngineMath.saturatingAdd(
                    EngineMath.saturatingAdd(info.positionSize(command.getSide()), info.orderSize(command.getSide())),
                    command.getSize());
            if (openInterest > config.getMaxOpenInterest()) {
                throw new EngineException(ErrorCode.OPEN_INTEREST_EXCEEDED,
                        "Open interest " + openInterest + " exceeds " + config.getMaxOpenInterest());
            }
        }

        if (exposureSize > 0) {
            long reserveNeeded = ledger.toCollateralAmount(ctx, notionalUsd);
            long free = ctx.getPool().tokenState(ctx.getCollateralToken()).freeLiquidity();
            if (free < reserveNeeded) {
                throw new EngineException(ErrorCode.INSUFFICIENT_RESERVE,
                        "Pool free liquidity " + free + " is below required reserve " + reserveNeeded);
            }
        }
        return leverageMbp;
    }

    private FillOutcome fill(EngineContext ctx, TradingOrder order) {
        return fill(ctx, order, ledger.planFill(ctx, order));
    }

    private FillOutcome fill(EngineContext ctx, TradingOrder order, FillPlan plan) {
        FillOutcome outcome = ledger.applyFill(ctx, order, plan);
        ctx.emit(ctx.event(EngineEventType.ORDER_FILLED)
                .user(order.getUser())
                .orderId(order.getOrderId())
                .positionId(outcome.getPositionId())
                .detail(outcome.getAction().name())
                .amount("size", order.getSize())
                .amount("fill_price", outcome.getFillPrice())
                .amount("fee", outcome.getFeeAmount())
                .amount("fee_mbp", outcome.getFeeMbp()));
        return outcome;
    }

    // ============================================
    // 주문 취소
    // ============================================

    /**
     * 사용자 주문 취소
     *
     * @return 취소된 주문
     */
    public TradingOrder cancelOrder(EngineContext ctx, String user, long triggerPrice, long orderId) {
        SymbolMarket symbolMarket = ctx.getSymbolMarket();
        OrderBook book = symbolMarket.getOrderBook();
        OrderBucket bucket = book.locate(triggerPrice, orderId)
                .orElseThrow(() -> new EngineException(ErrorCode.ORDER_NOT_FOUND,
                        "Order not found: id=" + orderId + ", trigger=" + triggerPrice));
        TradingOrder order = book.find(bucket, triggerPrice, orderId).orElseThrow();
        if (!order.getUser().equals(user)) {
            throw new EngineException(ErrorCode.UNAUTHORIZED, "Order " + orderId + " is not owned by " + user);
        }
        book.remove(bucket, triggerPrice, orderId);
        releaseOrder(ctx, order, EngineEventType.ORDER_CANCELED, "user");
        log.info("[OrderEngine] 주문 취소: orderId={}, user={}, bucket={}", orderId, user, bucket.getTag());
        return order;
    }

    /**
     * 관리자 강제 취소: 가격 레벨 뒤에서부터 작업 예산만큼 취소
     *
     * @return 취소된 주문 수
     */
    public int forceCancel(EngineContext ctx, OrderBucket bucket, long triggerPrice, int maxOps) {
        OrderBook book = ctx.getSymbolMarket().getOrderBook();
        List<TradingOrder> level = book.popLevel(bucket, triggerPrice);
        int index = level.size() - 1;
        int canceled = 0;
        while (index >= 0 && canceled < maxOps) {
            releaseOrder(ctx, level.get(index--), EngineEventType.ORDER_CANCELED, "manager");
            canceled++;
        }
        book.requeue(bucket, triggerPrice, new ArrayList<>(level.subList(0, index + 1)));
        log.info("[OrderEngine] 관리자 주문 취소: bucket={}, trigger={}, canceled={}, remaining={}",
                bucket.getTag(), triggerPrice, canceled, index + 1);
        return canceled;
    }

    private void releaseOrder(EngineContext ctx, TradingOrder order, EngineEventType type, String reason) {
        SymbolMarket symbolMarket = ctx.getSymbolMarket();
        symbolMarket.getInfo().subOrderSize(order.getSide(), order.getSize());
        if (order.getLinkedPositionId() != null) {
            symbolMarket.getPositions().get(order.getLinkedPositionId())
                    .ifPresent(position -> position.unlinkOrder(order.getOrderId()));
        }
        OrderRefunds.refund(ctx, order);
        ctx.emit(ctx.event(type)
                .user(order.getUser())
                .orderId(order.getOrderId())
                .positionId(order.getLinkedPositionId())
                .detail(reason)
                .amount("size", order.getSize())
                .amount("trigger_price", order.getTriggerPrice())
                .amount("collateral", order.getCollateralAmount()));
    }

    // ============================================
    // 매칭
    // ============================================

    /**
     * 가격 레벨 하나를 매칭
     *
     * @param maxOps 처리할 최대 주문 수
     */
    public MatchResult match(EngineContext ctx, OrderBucket bucket, long triggerPrice, int maxOps) {
        MatchResult result = new MatchResult();
        matchLevel(ctx, bucket, triggerPrice, maxOps, result);
        return result;
    }

    /**
     * 발동된 모든 가격 레벨을 가격 순서로 매칭 (예산 공유)
     */
    public MatchResult matchTriggered(EngineContext ctx, OrderBucket bucket, int maxOps) {
        MatchResult result = new MatchResult();
        List<Long> prices = ctx.getSymbolMarket().getOrderBook()
                .triggeredPrices(bucket, ctx.getTradingPrice().getPrice());
        for (Long price : prices) {
            int budget = maxOps - result.getProcessed();
            if (budget <= 0) {
                break;
            }
            matchLevel(ctx, bucket, price, budget, result);
        }
        return result;
    }

    private void matchLevel(EngineContext ctx, OrderBucket bucket, long triggerPrice, int budget,
                            MatchResult result) {
        SymbolMarket symbolMarket = ctx.getSymbolMarket();
        OrderBook book = symbolMarket.getOrderBook();
        List<TradingOrder> level = book.popLevel(bucket, triggerPrice);
        if (level.isEmpty()) {
            return;
        }
        if (!bucket.isTriggered(ctx.getTradingPrice().getPrice(), triggerPrice)) {
            book.requeue(bucket, triggerPrice, level);
            return;
        }

        List<TradingOrder> blocked = new ArrayList<>();
        int index = level.size() - 1;
        int used = 0;
        while (index >= 0 && used < budget) {
            TradingOrder order = level.get(index--);
            used++;

            FillPlan plan = ledger.planFill(ctx, order);
            if (plan.getBlockCode() == ErrorCode.POSITION_NOT_FOUND
                    || plan.getBlockCode() == ErrorCode.INVALID_REDUCE_ONLY) {
                releaseOrder(ctx, order, EngineEventType.ORDER_RELEASED, plan.getBlocker());
                result.recordRelease(order.getOrderId());
                continue;
            }
            if (plan.isBlocked()) {
                log.warn("[OrderEngine] 체결 불가, 주문 유지: orderId={}, bucket={}, reason={}",
                        order.getOrderId(), bucket.getTag(), plan.getBlocker());
                blocked.add(order);
                result.recordBlocked(order.getOrderId());
                continue;
            }

            symbolMarket.getInfo().subOrderSize(order.getSide(), order.getSize());
            result.recordFill(order.getOrderId(), fill(ctx, order, plan));
        }

        List<TradingOrder> remaining = new ArrayList<>(level.subList(0, index + 1));
        Collections.reverse(blocked);
        remaining.addAll(blocked);
        book.requeue(bucket, triggerPrice, remaining);
        result.addRequeued(remaining.size());

        log.info("[OrderEngine] 매칭 완료: bucket={}, trigger={}, processed={}, requeued={}",
                bucket.getTag(), triggerPrice, used, remaining.size());
    }
}
