package dustin.perp.domains.engine;

import static dustin.perp.domains.engine.EngineFixture.ADMIN;
import static dustin.perp.domains.engine.EngineFixture.BTC;
import static dustin.perp.domains.engine.EngineFixture.KEEPER;
import static dustin.perp.domains.engine.EngineFixture.LP;
import static dustin.perp.domains.engine.EngineFixture.ONE_BTC;
import static dustin.perp.domains.engine.EngineFixture.USDC;
import static dustin.perp.domains.engine.EngineFixture.price;
import static dustin.perp.domains.engine.EngineFixture.usdc;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dustin.perp.domains.engine.access.Role;
import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;
import dustin.perp.domains.engine.event.EngineEvent;
import dustin.perp.domains.engine.event.EngineEventType;
import dustin.perp.domains.engine.market.MarketConfig;
import dustin.perp.domains.engine.market.MarketConfigPatch;
import dustin.perp.domains.engine.market.MarketInfo;
import dustin.perp.domains.engine.model.Side;
import dustin.perp.domains.engine.order.CreateOrderCommand;
import dustin.perp.domains.engine.order.OrderBucket;
import dustin.perp.domains.pool.InMemoryLiquidityPool;

/**
 * 엔진 진입점 테스트
 * PerpEngine transactions and administration
 *
 * 테스트 항목:
 * 1. 실패한 작업은 계정/풀/카운터/이벤트까지 전부 복원
 * 2. 성공한 작업의 이벤트만 리스너에 순서대로 전달 (엔진 잠금 밖)
 * 3. 마켓/심볼 관리, 프로토콜 수수료, 역할
 */
class PerpEngineTest {

    private EngineFixture fixture;
    private List<EngineEvent> received;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        received = new ArrayList<>();
        fixture.engine.addListener(received::add);
    }

    private static void assertCode(Runnable action, ErrorCode code) {
        assertThatThrownBy(action::run)
                .isInstanceOf(EngineException.class)
                .hasFieldOrPropertyWithValue("code", code);
    }

    // ============================================
    // 트랜잭션
    // ============================================

    @Test
    @DisplayName("검증 실패 시 이미 인출한 계정 잔고와 카운터가 복원되고 이벤트는 발행되지 않음")
    void failedOperationRollsBack() {
        // given
        fixture.accounts.openAccount("alice");
        fixture.accounts.deposit("alice", USDC, usdc(100L));
        long liquidity = fixture.pool.tokenState(USDC).getLiquidityAmount();

        // when: 계정에서 50 USDC 인출 후 레버리지 검증 실패
        CreateOrderCommand command = CreateOrderCommand.builder()
                .user("alice")
                .side(Side.LONG)
                .size(100L * ONE_BTC)
                .triggerPrice(price(10_000L))
                .collateralAmount(usdc(50L))
                .build();
        assertCode(() -> fixture.engine.createOrder("alice", LP, BTC, fixture.feeds(), command, true),
                ErrorCode.LEVERAGE_EXCEEDED);

        // then
        assertThat(fixture.accounts.balanceOf("alice", USDC)).isEqualTo(usdc(100L));
        assertThat(fixture.info().getNextOrderId()).isZero();
        assertThat(fixture.pool.tokenState(USDC).getLiquidityAmount()).isEqualTo(liquidity);
        assertThat(received).isEmpty();
    }

    @Test
    @DisplayName("계정 잔고가 부족하면 거부")
    void insufficientAccountBalance() {
        fixture.accounts.openAccount("alice");
        fixture.accounts.deposit("alice", USDC, usdc(10L));

        assertCode(() -> fixture.engine.createOrder("alice", LP, BTC, fixture.feeds(), CreateOrderCommand.builder()
                .user("alice")
                .side(Side.LONG)
                .size(ONE_BTC)
                .triggerPrice(price(10_000L))
                .collateralAmount(usdc(2_000L))
                .build(), true), ErrorCode.INSUFFICIENT_BALANCE);
        assertThat(fixture.accounts.balanceOf("alice", USDC)).isEqualTo(usdc(10L));
    }

    @Test
    @DisplayName("성공한 작업의 이벤트는 커밋 후 발생 순서대로 전달")
    void eventsDeliveredAfterCommit() {
        // when
        fixture.openPosition("alice", Side.LONG, ONE_BTC, 2_000L);

        // then
        assertThat(received).extracting(EngineEvent::getType).containsExactly(
                EngineEventType.ORDER_CREATED, EngineEventType.POSITION_OPENED, EngineEventType.ORDER_FILLED);
        assertThat(received).allSatisfy(event -> {
            assertThat(event.getMarket()).isEqualTo(LP);
            assertThat(event.getSymbol()).isEqualTo(BTC);
            assertThat(event.getUser()).isEqualTo("alice");
        });
    }

    @Test
    @DisplayName("리스너 예외는 엔진 상태에 영향을 주지 않음")
    void listenerFailureIsIsolated() {
        fixture.engine.addListener(event -> {
            throw new IllegalStateException("listener down");
        });

        long positionId = fixture.openPosition("alice", Side.LONG, ONE_BTC, 2_000L);

        assertThat(fixture.engine.position(LP, BTC, positionId)).isPresent();
        assertThat(received).hasSize(3);
    }

    @Test
    @DisplayName("리스너는 엔진 잠금 밖에서 호출되어 다른 스레드의 조회가 막히지 않음")
    void listenersRunOutsideEngineLock() {
        // given: 이벤트마다 다른 스레드에서 엔진 조회
        List<Long> observedLongSizes = new ArrayList<>();
        fixture.engine.addListener(event -> {
            try {
                MarketInfo info = CompletableFuture.supplyAsync(() -> fixture.engine.symbolInfo(LP, BTC))
                        .get(5, TimeUnit.SECONDS);
                observedLongSizes.add(info.getUserLongPositionSize());
            } catch (InterruptedException | ExecutionException | TimeoutException e) {
                throw new IllegalStateException("engine read blocked", e);
            }
        });

        // when
        fixture.openPosition("alice", Side.LONG, ONE_BTC, 2_000L);

        // then: 모든 이벤트에서 커밋된 상태 조회 성공
        assertThat(observedLongSizes).hasSize(3).containsOnly(ONE_BTC);
        assertThat(received).hasSize(3);
    }

    @Test
    @DisplayName("한 마켓의 실패는 그 마켓만 복원하고 다른 마켓 상태는 그대로")
    void failureInOneMarketLeavesOtherMarket() {
        // given: 두 번째 마켓 PLP2
        InMemoryLiquidityPool second = new InMemoryLiquidityPool("PLP2");
        second.addToken(USDC, 6, fixture.usdcOracle.getId(), 0L, EngineFixture.HOUR, EngineFixture.T0);
        second.provideLiquidity(USDC, EngineFixture.POOL_LIQUIDITY);
        second.updateTokenPrice(USDC, price(1L), 8);
        fixture.engine.registerPool(second);
        fixture.engine.createMarket(ADMIN, "PLP2", USDC, 1_000L);
        fixture.engine.addSymbol(ADMIN, "PLP2", BTC, 9, EngineFixture.defaultConfig().build());

        long alicePosition = fixture.openPosition("alice", Side.LONG, ONE_BTC, 2_000L);
        fixture.engine.createOrder("bob", "PLP2", BTC, fixture.feeds(), CreateOrderCommand.builder()
                .user("bob")
                .side(Side.SHORT)
                .size(ONE_BTC)
                .triggerPrice(price(10_000L))
                .collateralAmount(usdc(2_000L))
                .build(), false);
        long secondLiquidity = second.tokenState(USDC).getLiquidityAmount();
        received.clear();

        // when: PLP2에서 레버리지 초과 주문
        assertCode(() -> fixture.engine.createOrder("bob", "PLP2", BTC, fixture.feeds(), CreateOrderCommand.builder()
                .user("bob")
                .side(Side.SHORT)
                .size(100L * ONE_BTC)
                .triggerPrice(price(10_000L))
                .collateralAmount(usdc(50L))
                .build(), false), ErrorCode.LEVERAGE_EXCEEDED);

        // then
        assertThat(fixture.engine.position(LP, BTC, alicePosition)).isPresent();
        assertThat(fixture.info().getUserLongPositionSize()).isEqualTo(ONE_BTC);
        assertThat(fixture.pool.tokenState(USDC).getReservedAmount()).isEqualTo(usdc(10_000L));

        MarketInfo secondInfo = fixture.engine.symbolInfo("PLP2", BTC);
        assertThat(secondInfo.getUserShortPositionSize()).isEqualTo(ONE_BTC);
        assertThat(secondInfo.getNextOrderId()).isEqualTo(1L);
        assertThat(second.tokenState(USDC).getLiquidityAmount()).isEqualTo(secondLiquidity);
        assertThat(fixture.engine.positions("PLP2", BTC, "bob")).hasSize(1);
        assertThat(received).isEmpty();
    }

    @Test
    @DisplayName("조회 결과는 복사본이라 수정해도 엔진 상태에 영향 없음")
    void queriesReturnCopies() {
        long positionId = fixture.openPosition("alice", Side.LONG, ONE_BTC, 2_000L);

        fixture.engine.position(LP, BTC, positionId).orElseThrow().setSize(1L);
        fixture.info().setUserLongPositionSize(0L);

        assertThat(fixture.engine.position(LP, BTC, positionId).orElseThrow().getSize()).isEqualTo(ONE_BTC);
        assertThat(fixture.info().getUserLongPositionSize()).isEqualTo(ONE_BTC);
    }

    // ============================================
    // 마켓 관리
    // ============================================

    @Test
    @DisplayName("마켓/심볼 중복 생성, 없는 마켓/심볼, 잘못된 설정은 거부")
    void registryValidation() {
        assertCode(() -> fixture.engine.createMarket(ADMIN, LP, USDC, 1_000L), ErrorCode.MARKET_ALREADY_EXISTS);
        assertCode(() -> fixture.engine.createMarket(ADMIN, "NOPOOL", USDC, 1_000L), ErrorCode.INVALID_ARGUMENT);
        assertCode(() -> fixture.engine.addSymbol(ADMIN, LP, BTC, 9, EngineFixture.defaultConfig().build()),
                ErrorCode.SYMBOL_ALREADY_EXISTS);
        assertCode(() -> fixture.engine.addSymbol(ADMIN, LP, "ETH", 9,
                EngineFixture.defaultConfig().oracleId("ETH/USD").lotSize(0L).build()), ErrorCode.INVALID_ARGUMENT);
        assertCode(() -> fixture.engine.addSymbol(ADMIN, "NOPE", "ETH", 9, EngineFixture.defaultConfig().build()),
                ErrorCode.MARKET_NOT_FOUND);
        assertCode(() -> fixture.engine.symbolInfo(LP, "DOGE"), ErrorCode.SYMBOL_NOT_FOUND);
        assertCode(() -> fixture.engine.addSymbol("alice", LP, "ETH", 9, EngineFixture.defaultConfig().build()),
                ErrorCode.UNAUTHORIZED);

        assertThat(fixture.engine.marketTokens()).containsExactly(LP);
        assertThat(fixture.engine.symbols(LP)).containsExactly(BTC);
    }

    @Test
    @DisplayName("설정 변경은 지정한 필드만 바꾸고, 검증 실패 시 기존 설정 유지")
    void configPatch() {
        // when
        MarketConfig updated = fixture.engine.updateSymbolConfig(ADMIN, LP, BTC,
                MarketConfigPatch.builder().maxLeverageMbp(200_000_000L).build()).getValue();

        // then
        assertThat(updated.getMaxLeverageMbp()).isEqualTo(200_000_000L);
        assertThat(updated.getLotSize()).isEqualTo(1_000_000L);
        assertThat(updated.getMaintenanceMarginBp()).isEqualTo(150L);

        assertCode(() -> fixture.engine.updateSymbolConfig(ADMIN, LP, BTC,
                MarketConfigPatch.builder().maintenanceMarginBp(0L).build()), ErrorCode.INVALID_ARGUMENT);
        assertThat(fixture.engine.symbolConfig(LP, BTC).getMaintenanceMarginBp()).isEqualTo(150L);
        assertThat(fixture.engine.symbolConfig(LP, BTC).getMaxLeverageMbp()).isEqualTo(200_000_000L);
    }

    @Test
    @DisplayName("포지션이나 대기 주문이 남은 심볼은 제거 불가")
    void removeSymbolRequiresEmptyBook() {
        // given
        long orderId = fixture.limitOrder("alice", Side.LONG, ONE_BTC, 9_000L, 2_000L).getValue().getOrderId();

        // when & then
        assertCode(() -> fixture.engine.removeSymbol(ADMIN, LP, BTC), ErrorCode.INVALID_PROCESS);

        fixture.engine.cancelOrder("alice", LP, BTC, price(9_000L), orderId);
        assertThat(fixture.engine.removeSymbol(ADMIN, LP, BTC).getValue()).isTrue();
        assertThat(fixture.engine.symbols(LP)).isEmpty();
    }

    @Test
    @DisplayName("프로토콜 수수료 몫 변경과 인출")
    void protocolFee() {
        // given: 수수료 10 USDC 중 10%
        fixture.openPosition("alice", Side.LONG, ONE_BTC, 2_000L);
        assertCode(() -> fixture.engine.claimProtocolFee("alice", LP, USDC), ErrorCode.UNAUTHORIZED);

        // when
        EngineResult<Long> claimed = fixture.engine.claimProtocolFee(ADMIN, LP, USDC);

        // then
        assertThat(claimed.getValue()).isEqualTo(usdc(1L));
        assertThat(claimed.getPayouts().tokenAmount(ADMIN, USDC)).isEqualTo(usdc(1L));
        assertThat(fixture.engine.marketSnapshot(LP).protocolFee(USDC)).isZero();

        // when: 몫을 50%로 변경
        fixture.engine.updateProtocolFeeShare(ADMIN, LP, 5_000L);
        fixture.openPosition("bob", Side.LONG, ONE_BTC, 2_000L);

        // then
        assertThat(fixture.engine.marketSnapshot(LP).protocolFee(USDC)).isEqualTo(usdc(5L));
        assertCode(() -> fixture.engine.updateProtocolFeeShare(ADMIN, LP, 10_001L), ErrorCode.INVALID_ARGUMENT);
    }

    // ============================================
    // 역할
    // ============================================

    @Test
    @DisplayName("관리자만 역할을 부여/회수, 마지막 관리자는 회수 불가")
    void roles() {
        // given
        fixture.limitOrder("bob", Side.LONG, ONE_BTC, 9_500L, 2_000L);
        fixture.setBtcPrice(9_400L);
        assertCode(() -> fixture.engine.grantRole("alice", "alice", Role.CRANKER), ErrorCode.UNAUTHORIZED);

        // when
        fixture.engine.grantRole(ADMIN, "alice", Role.CRANKER);

        // then
        assertThat(fixture.engine.matchTriggeredOrders("alice", LP, BTC, fixture.feeds(),
                OrderBucket.TOKEN_LIMIT_BUY, 10).getValue().filledCount()).isEqualTo(1);

        fixture.engine.revokeRole(ADMIN, KEEPER, Role.CRANKER);
        assertThat(fixture.engine.getAccessControl().hasRole(KEEPER, Role.CRANKER)).isFalse();
        assertCode(() -> fixture.engine.revokeRole(ADMIN, ADMIN, Role.ADMIN), ErrorCode.INVALID_PROCESS);

        fixture.engine.grantRole(ADMIN, "carol", Role.ADMIN);
        fixture.engine.revokeRole("carol", ADMIN, Role.ADMIN);
        assertThat(fixture.engine.getAccessControl().members(Role.ADMIN)).containsExactly("carol");
    }

    @Test
    @DisplayName("작업 예산은 1 이상")
    void budgetMustBePositive() {
        assertCode(() -> fixture.engine.matchTriggeredOrders(KEEPER, LP, BTC, fixture.feeds(),
                OrderBucket.TOKEN_LIMIT_BUY, 0), ErrorCode.INVALID_ARGUMENT);
        assertCode(() -> fixture.engine.settleUnsettledReceipts(KEEPER, LP, 0), ErrorCode.INVALID_ARGUMENT);
    }
}
