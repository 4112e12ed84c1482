// =====================================================
// PerpEngine - 무기한 선물 엔진 진입점
// =====================================================
// 역할: 모든 공개 작업의 경계
//
// 작업마다:
// 1. 엔진 트랜잭션 시작 (락 + 작업 범위 checkpoint)
// 2. 역할 검사 (관리자/크랭커 작업)
// 3. 오라클 검증 후 실행 컨텍스트 구성
//    - 거래 오라클 id = 심볼 설정 oracleId
//    - 담보 오라클 id = 풀의 담보 토큰 오라클
//    - 가격 나이 <= maxStalenessMs
// 4. 하위 엔진 호출 (주문, 원장, 펀딩, 청산)
// 5. 지급 처리: 계정이 있는 사용자는 보관소에 입금, 없으면 결과로 반환
// 6. 커밋 → 이벤트 발행 / 예외 → 전체 복원
//
// 하위 엔진은 Spring에 의존하지 않는 순수 Java 객체
// =====================================================

package dustin.perp.domains.engine;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import dustin.perp.domains.engine.access.AccessControl;
import dustin.perp.domains.engine.access.Role;
import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;
import dustin.perp.domains.engine.event.EngineEvent;
import dustin.perp.domains.engine.event.EngineEventListener;
import dustin.perp.domains.engine.event.EngineEventType;
import dustin.perp.domains.engine.funding.FundingEngine;
import dustin.perp.domains.engine.funding.FundingUpdate;
import dustin.perp.domains.engine.liquidation.LiquidationEngine;
import dustin.perp.domains.engine.liquidation.LiquidationInfo;
import dustin.perp.domains.engine.liquidation.LiquidationResult;
import dustin.perp.domains.engine.liquidation.ReceiptSettler;
import dustin.perp.domains.engine.liquidation.UnsettledReceipt;
import dustin.perp.domains.engine.market.Market;
import dustin.perp.domains.engine.market.MarketConfig;
import dustin.perp.domains.engine.market.MarketConfigPatch;
import dustin.perp.domains.engine.market.MarketInfo;
import dustin.perp.domains.engine.market.MarketRegistry;
import dustin.perp.domains.engine.market.SymbolMarket;
import dustin.perp.domains.engine.math.EngineMath;
import dustin.perp.domains.engine.model.CollateralMode;
import dustin.perp.domains.engine.order.CreateOrderCommand;
import dustin.perp.domains.engine.order.MatchResult;
import dustin.perp.domains.engine.order.OrderBucket;
import dustin.perp.domains.engine.order.OrderEngine;
import dustin.perp.domains.engine.order.OrderResult;
import dustin.perp.domains.engine.order.TradingOrder;
import dustin.perp.domains.engine.port.BidReceipt;
import dustin.perp.domains.engine.port.LiquidityPool;
import dustin.perp.domains.engine.port.Oracle;
import dustin.perp.domains.engine.port.OptionVault;
import dustin.perp.domains.engine.port.UserAccountCustody;
import dustin.perp.domains.engine.position.Position;
import dustin.perp.domains.engine.position.PositionLedger;
import dustin.perp.domains.engine.position.PositionValuation;
import lombok.extern.slf4j.Slf4j;

/**
 * 무기한 선물 리스크/매칭 엔진
 * Perpetual futures risk and matching engine facade
 */
@Slf4j
public class PerpEngine {

    private final Clock clock;
    private final long maxStalenessMs;
    private final AccessControl accessControl;
    private final UserAccountCustody custody;
    private final OptionVault vault;

    private final MarketRegistry registry = new MarketRegistry();
    private final Map<String, LiquidityPool> pools = new LinkedHashMap<>();
    private final EngineTransaction transaction = new EngineTransaction();

    private final PositionLedger ledger;
    private final OrderEngine orderEngine;
    private final FundingEngine fundingEngine;
    private final LiquidationEngine liquidationEngine;

    /**
     * @param custody 사용자 계정 보관소 (없으면 null, 모든 지급을 결과로 반환)
     * @param vault 옵션 볼트 (없으면 null, 옵션 담보 사용 불가)
     */
    public PerpEngine(Clock clock, long maxStalenessMs, AccessControl accessControl,
                      UserAccountCustody custody, OptionVault vault) {
        this.clock = clock;
        this.maxStalenessMs = maxStalenessMs;
        this.accessControl = accessControl;
        this.custody = custody;
        this.vault = vault;

        ReceiptSettler receiptSettler = new ReceiptSettler();
        this.ledger = new PositionLedger(receiptSettler);
        this.orderEngine = new OrderEngine(ledger);
        this.fundingEngine = new FundingEngine();
        this.liquidationEngine = new LiquidationEngine(ledger, receiptSettler);

        transaction.register(registry);
        transaction.register(accessControl);
        registerIfTransactional(custody);
        registerIfTransactional(vault);
    }

    private void registerIfTransactional(Object collaborator) {
        if (collaborator instanceof TransactionalState) {
            transaction.register((TransactionalState) collaborator);
        }
    }

    /**
     * LP 토큰별 유동성 풀 등록 (마켓 생성 전에 필요)
     */
    public void registerPool(LiquidityPool pool) {
        transaction.read(() -> {
            pools.put(pool.getLpToken(), pool);
            registerIfTransactional(pool);
            return null;
        });
        log.info("[PerpEngine] 유동성 풀 등록: lpToken={}", pool.getLpToken());
    }

    public void addListener(EngineEventListener listener) {
        transaction.addListener(listener);
    }

    /**
     * 엔진 락 안에서 외부 협력자 변경 (풀 유동성, 볼트, 계정 입출금)
     *
     * 엔진 작업과 겹치지 않도록 직렬화만 하며 checkpoint/이벤트는 없음
     */
    public <T> T runExclusive(Supplier<T> action) {
        return transaction.read(action);
    }

    // ============================================
    // 관리자 작업
    // ============================================

    public EngineResult<Market> createMarket(String caller, String lpToken, String quoteToken, long protocolFeeShareBp) {
        return execute("createMarket", TransactionScope.market(lpToken), (events, payouts) -> {
            accessControl.requireAny(caller, Role.ADMIN);
            if (!pools.containsKey(lpToken)) {
                throw new EngineException(ErrorCode.INVALID_ARGUMENT, "No liquidity pool registered for " + lpToken);
            }
            checkFeeShare(protocolFeeShareBp);
            Market market = registry.createMarket(lpToken, quoteToken, protocolFeeShareBp);
            EngineContext ctx = context(caller, market, null, null, events, payouts);
            ctx.emit(ctx.event(EngineEventType.MARKET_CREATED)
                    .user(caller)
                    .detail(quoteToken)
                    .amount("market_index", market.getMarketIndex())
                    .amount("protocol_fee_share_bp", protocolFeeShareBp));
            log.info("[PerpEngine] 마켓 생성: lpToken={}, quoteToken={}", lpToken, quoteToken);
            return market;
        });
    }

    public EngineResult<MarketInfo> addSymbol(String caller, String lpToken, String baseToken, int sizeDecimal,
                                              MarketConfig config) {
        return execute("addSymbol", TransactionScope.market(lpToken), (events, payouts) -> {
            accessControl.requireAny(caller, Role.ADMIN);
            Market market = registry.market(lpToken);
            if (market.hasSymbol(baseToken)) {
                throw new EngineException(ErrorCode.SYMBOL_ALREADY_EXISTS, "Symbol already exists: " + lpToken + "/" + baseToken);
            }
            if (sizeDecimal < 0) {
                throw new EngineException(ErrorCode.INVALID_ARGUMENT, "sizeDecimal must not be negative");
            }
            config.validate();
            long now = clock.millis();
            MarketInfo info = MarketInfo.builder()
                    .active(true)
                    .sizeDecimal(sizeDecimal)
                    .lastFundingTs(FundingEngine.alignedTime(now, config.getFundingIntervalMs()))
                    .build();
            SymbolMarket symbolMarket = new SymbolMarket(baseToken, info, config.copy());
            market.addSymbol(symbolMarket);
            EngineContext ctx = context(caller, market, symbolMarket, null, events, payouts);
            ctx.emit(ctx.event(EngineEventType.SYMBOL_ADDED)
                    .user(caller)
                    .detail(config.getOracleId())
                    .amount("size_decimal", (long) sizeDecimal)
                    .amount("max_leverage_mbp", config.getMaxLeverageMbp()));
            log.info("[PerpEngine] 심볼 추가: market={}, symbol={}, config={}", lpToken, baseToken, config);
            return info.copy();
        });
    }

    public EngineResult<MarketConfig> updateSymbolConfig(String caller, String lpToken, String baseToken,
                                                         MarketConfigPatch patch) {
        return execute("updateSymbolConfig", TransactionScope.symbol(lpToken, baseToken), (events, payouts) -> {
            accessControl.requireAny(caller, Role.ADMIN);
            Market market = registry.market(lpToken);
            SymbolMarket symbolMarket = market.symbol(baseToken);
            MarketConfig updated = patch.applyTo(symbolMarket.getConfig());
            updated.validate();
            symbolMarket.setConfig(updated);
            EngineContext ctx = context(caller, market, symbolMarket, null, events, payouts);
            ctx.emit(ctx.event(EngineEventType.MARKET_CONFIG_UPDATED).user(caller).detail(patch.toString()));
            log.info("[PerpEngine] 심볼 설정 변경: market={}, symbol={}, patch={}", lpToken, baseToken, patch);
            return updated.copy();
        });
    }

    public EngineResult<Boolean> setMarketActive(String caller, String lpToken, boolean active) {
        return execute("setMarketActive", TransactionScope.market(lpToken), (events, payouts) -> {
            accessControl.requireAny(caller, Role.ADMIN);
            Market market = registry.market(lpToken);
            market.setActive(active);
            EngineContext ctx = context(caller, market, null, null, events, payouts);
            ctx.emit(ctx.event(active ? EngineEventType.MARKET_RESUMED : EngineEventType.MARKET_SUSPENDED).user(caller));
            log.info("[PerpEngine] 마켓 상태 변경: market={}, active={}", lpToken, active);
            return active;
        });
    }

    public EngineResult<Boolean> setSymbolActive(String caller, String lpToken, String baseToken, boolean active) {
        return execute("setSymbolActive", TransactionScope.symbol(lpToken, baseToken), (events, payouts) -> {
            accessControl.requireAny(caller, Role.ADMIN);
            Market market = registry.market(lpToken);
            SymbolMarket symbolMarket = market.symbol(baseToken);
            symbolMarket.getInfo().setActive(active);
            EngineContext ctx = context(caller, market, symbolMarket, null, events, payouts);
            ctx.emit(ctx.event(active ? EngineEventType.SYMBOL_RESUMED : EngineEventType.SYMBOL_SUSPENDED).user(caller));
            log.info("[PerpEngine] 심볼 상태 변경: market={}, symbol={}, active={}", lpToken, baseToken, active);
            return active;
        });
    }

    public EngineResult<Long> updateProtocolFeeShare(String caller, String lpToken, long protocolFeeShareBp) {
        return execute("updateProtocolFeeShare", TransactionScope.market(lpToken), (events, payouts) -> {
            accessControl.requireAny(caller, Role.ADMIN);
            checkFeeShare(protocolFeeShareBp);
            Market market = registry.market(lpToken);
            long before = market.getProtocolFeeShareBp();
            market.setProtocolFeeShareBp(protocolFeeShareBp);
            EngineContext ctx = context(caller, market, null, null, events, payouts);
            ctx.emit(ctx.event(EngineEventType.PROTOCOL_FEE_SHARE_UPDATED)
                    .user(caller)
                    .amount("share_bp_before", before)
                    .amount("share_bp_after", protocolFeeShareBp));
            return protocolFeeShareBp;
        });
    }

    /**
     * 프로토콜 수수료 전액 인출 (호출자에게 지급)
     */
    public EngineResult<Long> claimProtocolFee(String caller, String lpToken, String token) {
        return execute("claimProtocolFee", TransactionScope.market(lpToken), (events, payouts) -> {
            accessControl.requireAny(caller, Role.ADMIN);
            Market market = registry.market(lpToken);
            long amount = market.takeProtocolFee(token);
            payouts.credit(caller, token, amount);
            EngineContext ctx = context(caller, market, null, null, events, payouts);
            ctx.emit(ctx.event(EngineEventType.PROTOCOL_FEE_CLAIMED)
                    .user(caller)
                    .detail(token)
                    .amount("amount", amount));
            log.info("[PerpEngine] 프로토콜 수수료 인출: market={}, token={}, amount={}", lpToken, token, amount);
            return amount;
        });
    }

    /**
     * 빈 심볼 제거 (포지션/대기 주문이 없어야 함)
     */
    public EngineResult<Boolean> removeSymbol(String caller, String lpToken, String baseToken) {
        return execute("removeSymbol", TransactionScope.market(lpToken), (events, payouts) -> {
            accessControl.requireAny(caller, Role.ADMIN);
            Market market = registry.market(lpToken);
            SymbolMarket symbolMarket = market.symbol(baseToken);
            if (!symbolMarket.getPositions().isEmpty() || !symbolMarket.getOrderBook().isEmpty()) {
                throw new EngineException(ErrorCode.INVALID_PROCESS,
                        "Symbol " + baseToken + " still has positions or resting orders");
            }
            EngineContext ctx = context(caller, market, symbolMarket, null, events, payouts);
            market.removeSymbol(baseToken);
            ctx.emit(ctx.event(EngineEventType.SYMBOL_REMOVED).user(caller));
            log.info("[PerpEngine] 심볼 제거: market={}, symbol={}", lpToken, baseToken);
            return true;
        });
    }

    public EngineResult<Boolean> grantRole(String caller, String user, Role role) {
        return execute("grantRole", TransactionScope.none(), (events, payouts) -> {
            accessControl.requireAny(caller, Role.ADMIN);
            accessControl.grant(user, role);
            events.add(EngineEvent.builder()
                    .type(EngineEventType.ROLE_GRANTED)
                    .timestampMs(clock.millis())
                    .user(user)
                    .detail(role.name())
                    .build());
            return true;
        });
    }

    public EngineResult<Boolean> revokeRole(String caller, String user, Role role) {
        return execute("revokeRole", TransactionScope.none(), (events, payouts) -> {
            accessControl.requireAny(caller, Role.ADMIN);
            accessControl.revoke(user, role);
            events.add(EngineEvent.builder()
                    .type(EngineEventType.ROLE_REVOKED)
                    .timestampMs(clock.millis())
                    .user(user)
                    .detail(role.name())
                    .build());
            return true;
        });
    }

    private static void checkFeeShare(long protocolFeeShareBp) {
        if (protocolFeeShareBp < 0 || protocolFeeShareBp > EngineMath.BP_SCALE) {
            throw new EngineException(ErrorCode.INVALID_ARGUMENT, "Protocol fee share must be within [0, 10000] bp");
        }
    }

    // ============================================
    // 주문
    // ============================================

    /**
     * 주문 생성
     *
     * @param fromAccount true면 토큰 담보를 호출자 계정에서 인출
     */
    public EngineResult<OrderResult> createOrder(String caller, String lpToken, String baseToken, PriceFeeds feeds,
                                                 CreateOrderCommand command, boolean fromAccount) {
        return execute("createOrder", TransactionScope.symbol(lpToken, baseToken), (events, payouts) -> {
            if (!caller.equals(command.getUser())) {
                throw new EngineException(ErrorCode.UNAUTHORIZED, "Caller " + caller + " cannot place orders for " + command.getUser());
            }
            requireCollateralFeeds(feeds);
            Market market = registry.market(lpToken);
            SymbolMarket symbolMarket = market.symbol(baseToken);
            if (command.getCollateralMode() == CollateralMode.OPTION) {
                requireVault();
            }
            EngineContext ctx = context(caller, market, symbolMarket, feeds, events, payouts);
            if (fromAccount && command.getCollateralMode() == CollateralMode.TOKEN && command.getCollateralAmount() > 0) {
                requireCustody().withdraw(caller, ctx.getCollateralToken(), command.getCollateralAmount());
            }
            return orderEngine.createOrder(ctx, command);
        });
    }

    public EngineResult<TradingOrder> cancelOrder(String caller, String lpToken, String baseToken,
                                                  long triggerPrice, long orderId) {
        return execute("cancelOrder", TransactionScope.symbol(lpToken, baseToken), (events, payouts) -> {
            Market market = registry.market(lpToken);
            SymbolMarket symbolMarket = market.symbol(baseToken);
            EngineContext ctx = context(caller, market, symbolMarket, null, events, payouts);
            return orderEngine.cancelOrder(ctx, caller, triggerPrice, orderId).copy();
        });
    }

    /**
     * 관리자 강제 취소 (가격 레벨, 작업 예산)
     */
    public EngineResult<Integer> forceCancelOrders(String caller, String lpToken, String baseToken,
                                                   OrderBucket bucket, long triggerPrice, int maxOps) {
        return execute("forceCancelOrders", TransactionScope.symbol(lpToken, baseToken), (events, payouts) -> {
            accessControl.requireAny(caller, Role.ADMIN);
            checkBudget(maxOps);
            Market market = registry.market(lpToken);
            SymbolMarket symbolMarket = market.symbol(baseToken);
            EngineContext ctx = context(caller, market, symbolMarket, null, events, payouts);
            return orderEngine.forceCancel(ctx, bucket, triggerPrice, maxOps);
        });
    }

    /**
     * 가격 레벨 매칭 (크랭커/관리자)
     */
    public EngineResult<MatchResult> matchOrders(String caller, String lpToken, String baseToken, PriceFeeds feeds,
                                                 OrderBucket bucket, long triggerPrice, int maxOps) {
        return execute("matchOrders", TransactionScope.symbol(lpToken, baseToken), (events, payouts) -> {
            accessControl.requireAny(caller, Role.CRANKER, Role.ADMIN);
            checkBudget(maxOps);
            requireCollateralFeeds(feeds);
            Market market = registry.market(lpToken);
            SymbolMarket symbolMarket = market.symbol(baseToken);
            EngineContext ctx = context(caller, market, symbolMarket, feeds, events, payouts);
            return orderEngine.match(ctx, bucket, triggerPrice, maxOps);
        });
    }

    /**
     * 버킷의 발동된 가격 레벨 전체 매칭 (크랭커/관리자)
     */
    public EngineResult<MatchResult> matchTriggeredOrders(String caller, String lpToken, String baseToken,
                                                          PriceFeeds feeds, OrderBucket bucket, int maxOps) {
        return execute("matchTriggeredOrders", TransactionScope.symbol(lpToken, baseToken), (events, payouts) -> {
            accessControl.requireAny(caller, Role.CRANKER, Role.ADMIN);
            checkBudget(maxOps);
            requireCollateralFeeds(feeds);
            Market market = registry.market(lpToken);
            SymbolMarket symbolMarket = market.symbol(baseToken);
            EngineContext ctx = context(caller, market, symbolMarket, feeds, events, payouts);
            return orderEngine.matchTriggered(ctx, bucket, maxOps);
        });
    }

    // ============================================
    // 포지션 담보
    // ============================================

    public EngineResult<Long> increaseCollateral(String caller, String lpToken, String baseToken, PriceFeeds feeds,
                                                 long positionId, long amount, List<BidReceipt> receipts,
                                                 boolean fromAccount) {
        return execute("increaseCollateral", TransactionScope.symbol(lpToken, baseToken), (events, payouts) -> {
            requireCollateralFeeds(feeds);
            Market market = registry.market(lpToken);
            SymbolMarket symbolMarket = market.symbol(baseToken);
            EngineContext ctx = context(caller, market, symbolMarket, feeds, events, payouts);
            if (fromAccount && amount > 0) {
                requireCustody().withdraw(caller, ctx.getCollateralToken(), amount);
            }
            ledger.increaseCollateral(ctx, positionId, caller, amount, receipts);
            return amount;
        });
    }

    public EngineResult<Long> releaseCollateral(String caller, String lpToken, String baseToken, PriceFeeds feeds,
                                                long positionId, long amount) {
        return execute("releaseCollateral", TransactionScope.symbol(lpToken, baseToken), (events, payouts) -> {
            requireCollateralFeeds(feeds);
            Market market = registry.market(lpToken);
            SymbolMarket symbolMarket = market.symbol(baseToken);
            EngineContext ctx = context(caller, market, symbolMarket, feeds, events, payouts);
            return ledger.releaseCollateral(ctx, positionId, caller, amount);
        });
    }

    // ============================================
    // 유지보수 (펀딩, 청산, receipt 정산)
    // ============================================

    public EngineResult<FundingUpdate> updateFunding(String caller, String lpToken, String baseToken, Oracle tradingOracle) {
        return execute("updateFunding", TransactionScope.symbol(lpToken, baseToken), (events, payouts) -> {
            Market market = registry.market(lpToken);
            SymbolMarket symbolMarket = market.symbol(baseToken);
            EngineContext ctx = context(caller, market, symbolMarket, PriceFeeds.tradingOnly(tradingOracle), events, payouts);
            return fundingEngine.updateFunding(ctx);
        });
    }

    public EngineResult<LiquidationResult> liquidate(String caller, String lpToken, String baseToken, PriceFeeds feeds,
                                                     long positionId) {
        return execute("liquidate", TransactionScope.symbol(lpToken, baseToken), (events, payouts) -> {
            requireCollateralFeeds(feeds);
            Market market = registry.market(lpToken);
            SymbolMarket symbolMarket = market.symbol(baseToken);
            EngineContext ctx = context(caller, market, symbolMarket, feeds, events, payouts);
            return liquidationEngine.liquidate(ctx, positionId, caller);
        });
    }

    /**
     * 청산 대상 조회 (상태 변경 없음)
     */
    public List<LiquidationInfo> getLiquidationInfo(String lpToken, String baseToken, PriceFeeds feeds, boolean includeAll) {
        return transaction.read(() -> {
            requireCollateralFeeds(feeds);
            Market market = registry.market(lpToken);
            SymbolMarket symbolMarket = market.symbol(baseToken);
            EngineContext ctx = context(null, market, symbolMarket, feeds, new ArrayList<>(), new Payouts());
            return liquidationEngine.getLiquidationInfo(ctx, includeAll);
        });
    }

    public EngineResult<Integer> settleUnsettledReceipts(String caller, String lpToken, int maxOps) {
        return execute("settleUnsettledReceipts", TransactionScope.market(lpToken), (events, payouts) -> {
            accessControl.requireAny(caller, Role.CRANKER, Role.ADMIN);
            checkBudget(maxOps);
            requireVault();
            Market market = registry.market(lpToken);
            EngineContext ctx = context(caller, market, null, null, events, payouts);
            return liquidationEngine.settleUnsettledReceipts(ctx, maxOps);
        });
    }

    // ============================================
    // 조회
    // ============================================

    /**
     * 포지션 평가 (현재 오라클 가격 기준, 상태 변경 없음)
     */
    public PositionValuation evaluatePosition(String lpToken, String baseToken, PriceFeeds feeds, long positionId) {
        return transaction.read(() -> {
            requireCollateralFeeds(feeds);
            Market market = registry.market(lpToken);
            SymbolMarket symbolMarket = market.symbol(baseToken);
            EngineContext ctx = context(null, market, symbolMarket, feeds, new ArrayList<>(), new Payouts());
            Position position = symbolMarket.getPositions().get(positionId)
                    .orElseThrow(() -> new EngineException(ErrorCode.POSITION_NOT_FOUND, "Position not found: " + positionId));
            return ledger.evaluate(ctx, position);
        });
    }

    public Optional<Position> position(String lpToken, String baseToken, long positionId) {
        return transaction.read(() -> registry.market(lpToken).symbol(baseToken)
                .getPositions().get(positionId).map(Position::copy));
    }

    public List<Position> positions(String lpToken, String baseToken, String user) {
        return transaction.read(() -> {
            SymbolMarket symbolMarket = registry.market(lpToken).symbol(baseToken);
            List<Position> source = user == null ? symbolMarket.getPositions().all() : symbolMarket.getPositions().ofUser(user);
            return source.stream().map(Position::copy).collect(Collectors.toList());
        });
    }

    public List<TradingOrder> orders(String lpToken, String baseToken, String user) {
        return transaction.read(() -> {
            SymbolMarket symbolMarket = registry.market(lpToken).symbol(baseToken);
            List<TradingOrder> source = user == null
                    ? symbolMarket.getOrderBook().allOrders()
                    : symbolMarket.getOrderBook().ordersOf(user);
            return source.stream().map(TradingOrder::copy).collect(Collectors.toList());
        });
    }

    public List<TradingOrder> orders(String lpToken, String baseToken, OrderBucket bucket) {
        return transaction.read(() -> registry.market(lpToken).symbol(baseToken).getOrderBook().orders(bucket)
                .stream().map(TradingOrder::copy).collect(Collectors.toList()));
    }

    public MarketInfo symbolInfo(String lpToken, String baseToken) {
        return transaction.read(() -> registry.market(lpToken).symbol(baseToken).getInfo().copy());
    }

    public MarketConfig symbolConfig(String lpToken, String baseToken) {
        return transaction.read(() -> registry.market(lpToken).symbol(baseToken).getConfig().copy());
    }

    public List<String> marketTokens() {
        return transaction.read(() -> registry.markets().stream().map(Market::getLpToken).collect(Collectors.toList()));
    }

    public List<String> symbols(String lpToken) {
        return transaction.read(() -> registry.market(lpToken).symbolMarkets().stream()
                .map(SymbolMarket::getBaseToken).collect(Collectors.toList()));
    }

    public Market marketSnapshot(String lpToken) {
        return transaction.read(() -> registry.market(lpToken).copy());
    }

    public List<UnsettledReceipt> unsettledReceipts(String lpToken) {
        return transaction.read(() -> registry.market(lpToken).getUnsettledReceipts().stream()
                .map(UnsettledReceipt::copy).collect(Collectors.toList()));
    }

    public LiquidityPool pool(String lpToken) {
        LiquidityPool pool = pools.get(lpToken);
        if (pool == null) {
            throw new EngineException(ErrorCode.MARKET_NOT_FOUND, "No liquidity pool registered for " + lpToken);
        }
        return pool;
    }

    public AccessControl getAccessControl() {
        return accessControl;
    }

    // ============================================
    // 내부
    // ============================================

    @FunctionalInterface
    private interface Operation<T> {
        T run(List<EngineEvent> events, Payouts payouts);
    }

    private <T> EngineResult<T> execute(String operation, TransactionScope scope, Operation<T> work) {
        return transaction.execute(operation, scope, events -> {
            Payouts payouts = new Payouts();
            T value = work.run(events, payouts);
            deliverPayouts(payouts);
            return new EngineResult<>(value, payouts, events);
        });
    }

    /**
     * 계정이 있는 사용자의 토큰 지급분은 보관소로 입금
     */
    private void deliverPayouts(Payouts payouts) {
        if (custody == null) {
            return;
        }
        for (String user : payouts.users()) {
            if (!custody.hasAccount(user)) {
                continue;
            }
            payouts.drainTokens(user).forEach((token, amount) -> custody.deposit(user, token, amount));
        }
    }

    private EngineContext context(String caller, Market market, SymbolMarket symbolMarket, PriceFeeds feeds,
                                  List<EngineEvent> events, Payouts payouts) {
        LiquidityPool pool = pool(market.getLpToken());
        long now = clock.millis();
        EngineContext.EngineContextBuilder builder = EngineContext.builder()
                .nowMs(now)
                .caller(caller)
                .pool(pool)
                .vault(vault)
                .payouts(payouts)
                .events(events)
                .market(market)
                .symbolMarket(symbolMarket);
        if (feeds == null) {
            return builder.build();
        }

        if (symbolMarket != null && feeds.getTradingOracle() != null) {
            Oracle oracle = feeds.getTradingOracle();
            if (!oracle.getId().equals(symbolMarket.getConfig().getOracleId())) {
                throw new EngineException(ErrorCode.ORACLE_MISMATCH,
                        "Oracle " + oracle.getId() + " is not bound to " + symbolMarket.getBaseToken());
            }
            builder.tradingPrice(oracle.price(now, maxStalenessMs));
        }

        if (feeds.hasCollateral()) {
            String token = feeds.getCollateralToken();
            if (!pool.hasToken(token)) {
                throw new EngineException(ErrorCode.COLLATERAL_TOKEN_MISMATCH,
                        "Token is not a pool collateral: " + token);
            }
            Oracle oracle = feeds.getCollateralOracle();
            if (!oracle.getId().equals(pool.tokenOracleId(token))) {
                throw new EngineException(ErrorCode.ORACLE_MISMATCH,
                        "Oracle " + oracle.getId() + " is not bound to collateral " + token);
            }
            builder.collateralToken(token)
                    .collateralPrice(oracle.price(now, maxStalenessMs))
                    .collateralDecimal(pool.tokenDecimal(token))
                    .borrowRate(pool.cumulativeBorrowRate(token, now));
        }
        return builder.build();
    }

    private static void requireCollateralFeeds(PriceFeeds feeds) {
        if (feeds == null || feeds.getTradingOracle() == null || !feeds.hasCollateral()) {
            throw new EngineException(ErrorCode.INVALID_ARGUMENT, "Trading and collateral oracles are required");
        }
    }

    private static void checkBudget(int maxOps) {
        if (maxOps <= 0) {
            throw new EngineException(ErrorCode.INVALID_ARGUMENT, "Operation budget must be positive");
        }
    }

    private UserAccountCustody requireCustody() {
        if (custody == null) {
            throw new EngineException(ErrorCode.INVALID_PROCESS, "No account custody configured");
        }
        return custody;
    }

    private void requireVault() {
        if (vault == null) {
            throw new EngineException(ErrorCode.INVALID_PROCESS, "No option vault configured");
        }
    }
}
