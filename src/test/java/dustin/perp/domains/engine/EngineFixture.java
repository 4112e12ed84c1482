package dustin.perp.domains.engine;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import dustin.perp.domains.account.UserAccountBook;
import dustin.perp.domains.engine.access.AccessControl;
import dustin.perp.domains.engine.access.Role;
import dustin.perp.domains.engine.market.MarketConfig;
import dustin.perp.domains.engine.market.MarketInfo;
import dustin.perp.domains.engine.model.Side;
import dustin.perp.domains.engine.order.CreateOrderCommand;
import dustin.perp.domains.engine.order.OrderResult;
import dustin.perp.domains.oracle.ManualOracle;
import dustin.perp.domains.pool.InMemoryLiquidityPool;
import dustin.perp.domains.vault.InMemoryOptionVault;

/**
 * 엔진 테스트 공용 구성
 * Shared engine setup for engine-level tests
 *
 * 구성:
 * - 시각: T0 (1시간 경계), 수동으로 이동
 * - 풀 PLP: USDC (6 decimals, $1), 유동성 10,000,000 USDC
 * - 심볼 BTC (9 decimals, 오라클 8 decimals, $10,000)
 * - 역할: admin (ADMIN), keeper (CRANKER)
 * - 기본 수수료: 0.1% 고정 (노출 한도 0), 프로토콜 몫 10%
 */
public class EngineFixture {

    public static final String LP = "PLP";
    public static final String BTC = "BTC";
    public static final String USDC = "USDC";
    public static final String ADMIN = "admin";
    public static final String KEEPER = "keeper";

    public static final long T0 = 1_699_999_200_000L;
    public static final long HOUR = 3_600_000L;
    public static final long ONE_BTC = 1_000_000_000L;
    public static final long MAX_STALENESS_MS = 60_000L;
    public static final long POOL_LIQUIDITY = usdc(10_000_000L);

    public final MutableClock clock = new MutableClock(T0);
    public final AccessControl accessControl = new AccessControl(List.of(ADMIN));
    public final UserAccountBook accounts = new UserAccountBook();
    public final InMemoryOptionVault vault = new InMemoryOptionVault();
    public final InMemoryLiquidityPool pool = new InMemoryLiquidityPool(LP);
    public final ManualOracle btcOracle = new ManualOracle("BTC/USD", 8);
    public final ManualOracle usdcOracle = new ManualOracle("USDC/USD", 8);
    public final PerpEngine engine;

    private long btcPrice;

    public EngineFixture() {
        this(defaultConfig().build(), 0L);
    }

    public EngineFixture(MarketConfig config, long borrowRatePerInterval) {
        accessControl.grant(KEEPER, Role.CRANKER);
        engine = new PerpEngine(clock, MAX_STALENESS_MS, accessControl, accounts, vault);

        pool.addToken(USDC, 6, usdcOracle.getId(), borrowRatePerInterval, HOUR, T0);
        pool.provideLiquidity(USDC, POOL_LIQUIDITY);
        pool.updateTokenPrice(USDC, price(1L), 8);
        setBtcPrice(10_000L);

        engine.registerPool(pool);
        engine.createMarket(ADMIN, LP, USDC, 1_000L);
        engine.addSymbol(ADMIN, LP, BTC, 9, config);
    }

    /**
     * 100x, 최소/lot 0.001 BTC, 0.1% 고정 수수료, 시간당 펀딩, 유지증거금 1.5% (옵션 3%), OI 1,000 BTC
     */
    public static MarketConfig.MarketConfigBuilder defaultConfig() {
        return MarketConfig.builder()
                .oracleId("BTC/USD")
                .maxLeverageMbp(1_000_000_000L)
                .optionCollateralMaxLeverageMbp(500_000_000L)
                .minSize(1_000_000L)
                .lotSize(1_000_000L)
                .baseTradingFeeMbp(10_000L)
                .maxTradingFeeMbp(100_000L)
                .allocatedExposureMbp(0L)
                .basicFundingRate(10_000_000L)
                .fundingIntervalMs(HOUR)
                .maintenanceMarginBp(150L)
                .optionMaintenanceMarginBp(300L)
                .maxOpenInterest(1_000L * ONE_BTC);
    }

    public static long usdc(long units) {
        return units * 1_000_000L;
    }

    public static long price(long dollars) {
        return dollars * 100_000_000L;
    }

    public PriceFeeds feeds() {
        return PriceFeeds.builder()
                .tradingOracle(btcOracle)
                .collateralOracle(usdcOracle)
                .collateralToken(USDC)
                .build();
    }

    /**
     * BTC 가격 변경 (USDC 가격도 현재 시각으로 갱신)
     */
    public void setBtcPrice(long dollars) {
        btcPrice = price(dollars);
        btcOracle.update(btcPrice, clock.millis());
        usdcOracle.update(price(1L), clock.millis());
    }

    /**
     * 시각 이동 후 오라클 가격을 같은 값으로 다시 게시
     */
    public void advance(long millis) {
        clock.advance(millis);
        btcOracle.update(btcPrice, clock.millis());
        usdcOracle.update(price(1L), clock.millis());
    }

    public EngineResult<OrderResult> placeOrder(CreateOrderCommand command) {
        return engine.createOrder(command.getUser(), LP, BTC, feeds(), command, false);
    }

    /**
     * 토큰 담보 limit 주문
     */
    public EngineResult<OrderResult> limitOrder(String user, Side side, long size, long triggerDollars,
                                                long collateralUsdc) {
        return placeOrder(CreateOrderCommand.builder()
                .user(user)
                .side(side)
                .size(size)
                .triggerPrice(price(triggerDollars))
                .collateralAmount(usdc(collateralUsdc))
                .build());
    }

    /**
     * 현재 가격에서 즉시 체결되는 신규 포지션, 포지션 id 반환
     */
    public long openPosition(String user, Side side, long size, long collateralUsdc) {
        long trigger = btcPrice / 100_000_000L;
        return limitOrder(user, side, size, trigger, collateralUsdc).getValue().getFill().getPositionId();
    }

    /**
     * 포지션을 줄이는 reduce-only 주문 (현재 가격에서 즉시 체결)
     */
    public EngineResult<OrderResult> reduce(String user, long positionId, Side side, long size) {
        return placeOrder(CreateOrderCommand.builder()
                .user(user)
                .side(side)
                .reduceOnly(true)
                .size(size)
                .triggerPrice(btcPrice)
                .linkedPositionId(positionId)
                .build());
    }

    public MarketInfo info() {
        return engine.symbolInfo(LP, BTC);
    }

    /**
     * 테스트용 수동 시계
     */
    public static final class MutableClock extends Clock {

        private long millis;

        public MutableClock(long millis) {
            this.millis = millis;
        }

        public void advance(long delta) {
            millis += delta;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }

        @Override
        public long millis() {
            return millis;
        }
    }
}
