package dustin.perp.domains.engine.position;

import static dustin.perp.domains.engine.EngineFixture.ADMIN;
import static dustin.perp.domains.engine.EngineFixture.BTC;
import static dustin.perp.domains.engine.EngineFixture.HOUR;
import static dustin.perp.domains.engine.EngineFixture.KEEPER;
import static dustin.perp.domains.engine.EngineFixture.LP;
import static dustin.perp.domains.engine.EngineFixture.ONE_BTC;
import static dustin.perp.domains.engine.EngineFixture.USDC;
import static dustin.perp.domains.engine.EngineFixture.price;
import static dustin.perp.domains.engine.EngineFixture.usdc;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dustin.perp.domains.engine.EngineFixture;
import dustin.perp.domains.engine.EngineResult;
import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;
import dustin.perp.domains.engine.event.EngineEvent;
import dustin.perp.domains.engine.event.EngineEventType;
import dustin.perp.domains.engine.market.MarketConfigPatch;
import dustin.perp.domains.engine.math.SignedAmount;
import dustin.perp.domains.engine.model.Side;
import dustin.perp.domains.engine.order.CreateOrderCommand;
import dustin.perp.domains.engine.order.MatchResult;
import dustin.perp.domains.engine.order.OrderBucket;
import dustin.perp.domains.engine.order.OrderResult;

/**
 * 포지션 원장 테스트
 * Position ledger: open, increase, reduce, flip, close, costs, collateral
 *
 * 기본 시나리오: $10,000 에서 1 BTC 롱, 담보 2,000 USDC, 수수료 0.1% (10 USDC)
 */
class PositionLedgerTest {

    private static CreateOrderCommand.CreateOrderCommandBuilder linked(String user, Side side, long size,
                                                                      long triggerDollars, long positionId) {
        return CreateOrderCommand.builder()
                .user(user)
                .side(side)
                .size(size)
                .triggerPrice(price(triggerDollars))
                .linkedPositionId(positionId);
    }

    // ============================================
    // 생성 / 종료
    // ============================================

    @Test
    @DisplayName("계정 담보로 열고 같은 가격에 닫으면 수수료 두 번만 빠지고 준비금은 모두 해제")
    void openAndCloseThroughAccount() {
        // given
        EngineFixture fixture = new EngineFixture();
        fixture.accounts.openAccount("alice");
        fixture.accounts.deposit("alice", USDC, usdc(5_000L));

        // when: 계정에서 2,000 USDC 인출해 주문
        EngineResult<OrderResult> open = fixture.engine.createOrder("alice", LP, BTC, fixture.feeds(),
                CreateOrderCommand.builder()
                        .user("alice")
                        .side(Side.LONG)
                        .size(ONE_BTC)
                        .triggerPrice(price(10_000L))
                        .collateralAmount(usdc(2_000L))
                        .build(), true);
        long positionId = open.getValue().getFill().getPositionId();

        // then
        assertThat(fixture.accounts.balanceOf("alice", USDC)).isEqualTo(usdc(3_000L));
        assertThat(fixture.pool.tokenState(USDC).getReservedAmount()).isEqualTo(usdc(10_000L));

        // when: 같은 가격에서 종료
        EngineResult<OrderResult> close = fixture.reduce("alice", positionId, Side.SHORT, ONE_BTC);

        // then: 1,990 - 10 = 1,980 USDC 가 계정으로 반환
        assertThat(close.getValue().getFill().getAction()).isEqualTo(FillOutcome.Action.CLOSED);
        assertThat(close.getPayouts().tokenAmount("alice", USDC)).isZero();
        assertThat(fixture.accounts.balanceOf("alice", USDC)).isEqualTo(usdc(4_980L));
        assertThat(fixture.engine.position(LP, BTC, positionId)).isEmpty();
        assertThat(fixture.pool.tokenState(USDC).getReservedAmount()).isZero();
        assertThat(fixture.pool.collectedFees(USDC)).isEqualTo(usdc(18L));
        assertThat(fixture.engine.marketSnapshot(LP).protocolFee(USDC)).isEqualTo(usdc(2L));
        assertThat(fixture.info().getUserLongPositionSize()).isZero();
    }

    @Test
    @DisplayName("이익은 해제되는 준비금으로 상한 ($10,000 → $30,000 에서 이익 10,000 USDC)")
    void profitCappedByReserve() {
        // given
        EngineFixture fixture = new EngineFixture();
        long positionId = fixture.openPosition("alice", Side.LONG, ONE_BTC, 2_000L);
        long liquidityBefore = fixture.pool.tokenState(USDC).getLiquidityAmount();

        // when
        fixture.setBtcPrice(30_000L);
        EngineResult<OrderResult> close = fixture.reduce("alice", positionId, Side.SHORT, ONE_BTC);

        // then: 1,990 + 10,000 - 30 (종료 수수료)
        FillOutcome fill = close.getValue().getFill();
        assertThat(fill.getRealizedPnl()).isEqualTo(SignedAmount.positive(usdc(10_000L)));
        assertThat(fill.getFeeAmount()).isEqualTo(usdc(30L));
        assertThat(close.getPayouts().tokenAmount("alice", USDC)).isEqualTo(usdc(11_960L));
        assertThat(fixture.pool.tokenState(USDC).getLiquidityAmount())
                .isEqualTo(liquidityBefore - usdc(10_000L) + usdc(27L));
    }

    // ============================================
    // 감소 / 증가 / 방향 전환
    // ============================================

    @Test
    @DisplayName("부분 감소: 손실은 담보에서 차감, 준비금은 비율대로 해제")
    void partialReduceWithLoss() {
        // given: 2 BTC 롱, 담보 4,000 → 3,980
        EngineFixture fixture = new EngineFixture();
        long positionId = fixture.openPosition("alice", Side.LONG, 2L * ONE_BTC, 4_000L);
        long liquidityBefore = fixture.pool.tokenState(USDC).getLiquidityAmount();

        // when: $9,000 에서 1 BTC 감소
        fixture.setBtcPrice(9_000L);
        FillOutcome fill = fixture.reduce("alice", positionId, Side.SHORT, ONE_BTC).getValue().getFill();

        // then: 3,980 - 1,000 (손실) - 9 (수수료)
        Position position = fixture.engine.position(LP, BTC, positionId).orElseThrow();
        assertThat(fill.getAction()).isEqualTo(FillOutcome.Action.REDUCED);
        assertThat(fill.getRealizedPnl()).isEqualTo(SignedAmount.negative(usdc(1_000L)));
        assertThat(position.getSize()).isEqualTo(ONE_BTC);
        assertThat(position.getCollateralAmount()).isEqualTo(usdc(2_971L));
        assertThat(position.getReserveAmount()).isEqualTo(usdc(10_000L));
        assertThat(position.getEntryPrice()).isEqualTo(price(10_000L));
        assertThat(position.getRealizedPnl()).isEqualTo(SignedAmount.negative(usdc(1_000L)));
        assertThat(fixture.pool.tokenState(USDC).getLiquidityAmount())
                .isEqualTo(liquidityBefore + usdc(1_000L) + 8_100_000L);
        assertThat(fixture.info().getUserLongPositionSize()).isEqualTo(ONE_BTC);
    }

    @Test
    @DisplayName("같은 방향 연결 주문은 수량 증가와 가중 평균 진입가")
    void increaseAveragesEntry() {
        // given
        EngineFixture fixture = new EngineFixture();
        long positionId = fixture.openPosition("alice", Side.LONG, ONE_BTC, 2_000L);

        // when: $11,000 에서 1 BTC 추가, 담보 1,000
        fixture.setBtcPrice(11_000L);
        FillOutcome fill = fixture.placeOrder(linked("alice", Side.LONG, ONE_BTC, 11_000L, positionId)
                .collateralAmount(usdc(1_000L))
                .build()).getValue().getFill();

        // then
        Position position = fixture.engine.position(LP, BTC, positionId).orElseThrow();
        assertThat(fill.getAction()).isEqualTo(FillOutcome.Action.INCREASED);
        assertThat(fill.getFeeAmount()).isEqualTo(usdc(11L));
        assertThat(position.getSize()).isEqualTo(2L * ONE_BTC);
        assertThat(position.getEntryPrice()).isEqualTo(price(10_500L));
        assertThat(position.getCollateralAmount()).isEqualTo(usdc(2_979L));
        assertThat(position.getReserveAmount()).isEqualTo(usdc(21_000L));
        assertThat(position.getRealizedTradingFee()).isEqualTo(usdc(21L));
    }

    @Test
    @DisplayName("반대 방향 초과 주문은 포지션을 닫고 초과분으로 방향 전환 (수수료는 주문 전체)")
    void oversizedOppositeOrderFlips() {
        // given
        EngineFixture fixture = new EngineFixture();
        long positionId = fixture.openPosition("alice", Side.LONG, ONE_BTC, 2_000L);

        // when: 3 BTC 숏, 담보 1,000
        EngineResult<OrderResult> result = fixture.placeOrder(linked("alice", Side.SHORT, 3L * ONE_BTC, 10_000L, positionId)
                .collateralAmount(usdc(1_000L))
                .build());

        // then: 1,990 + 1,000 - 30
        Position position = fixture.engine.position(LP, BTC, positionId).orElseThrow();
        assertThat(result.getValue().getFill().getAction()).isEqualTo(FillOutcome.Action.FLIPPED);
        assertThat(position.getSide()).isEqualTo(Side.SHORT);
        assertThat(position.getSize()).isEqualTo(2L * ONE_BTC);
        assertThat(position.getCollateralAmount()).isEqualTo(usdc(2_960L));
        assertThat(position.getReserveAmount()).isEqualTo(usdc(20_000L));
        assertThat(fixture.info().getUserLongPositionSize()).isZero();
        assertThat(fixture.info().getUserShortPositionSize()).isEqualTo(2L * ONE_BTC);
        assertThat(fixture.pool.tokenState(USDC).getReservedAmount()).isEqualTo(usdc(20_000L));
        assertThat(result.getEvents()).extracting(EngineEvent::getType).contains(EngineEventType.POSITION_FLIPPED);
    }

    @Test
    @DisplayName("reduce-only 주문은 수량이 같아도 방향 전환 없이 종료")
    void reduceOnlyNeverFlips() {
        EngineFixture fixture = new EngineFixture();
        long positionId = fixture.openPosition("alice", Side.LONG, ONE_BTC, 2_000L);

        FillOutcome fill = fixture.reduce("alice", positionId, Side.SHORT, ONE_BTC).getValue().getFill();

        assertThat(fill.getAction()).isEqualTo(FillOutcome.Action.CLOSED);
        assertThat(fixture.info().getUserShortPositionSize()).isZero();
    }

    // ============================================
    // 비용 실현
    // ============================================

    @Test
    @DisplayName("담보 추가 시 경과한 차입 비용이 먼저 실현 (1시간, 0.1% * 준비금 10,000 = 10 USDC)")
    void borrowFeeRealizedOnCollateralChange() {
        // given
        EngineFixture fixture = new EngineFixture(EngineFixture.defaultConfig().build(), 1_000_000L);
        long positionId = fixture.openPosition("alice", Side.LONG, ONE_BTC, 2_000L);
        fixture.advance(HOUR);

        // when
        EngineResult<Long> result = fixture.engine.increaseCollateral("alice", LP, BTC, fixture.feeds(),
                positionId, usdc(100L), List.of(), false);

        // then: 1,990 - 10 + 100
        Position position = fixture.engine.position(LP, BTC, positionId).orElseThrow();
        assertThat(position.getCollateralAmount()).isEqualTo(usdc(2_080L));
        assertThat(position.getRealizedBorrowFee()).isEqualTo(usdc(10L));
        assertThat(position.getLastBorrowRate()).isEqualTo(1_000_000L);
        assertThat(result.getEvents()).extracting(EngineEvent::getType)
                .containsExactly(EngineEventType.COSTS_REALIZED, EngineEventType.COLLATERAL_INCREASED);
    }

    @Test
    @DisplayName("평가: 미실현 차입 비용과 종료 수수료가 비용에 포함, 상태는 변하지 않음")
    void evaluationIncludesAccruedCosts() {
        EngineFixture fixture = new EngineFixture(EngineFixture.defaultConfig().build(), 1_000_000L);
        long positionId = fixture.openPosition("alice", Side.LONG, ONE_BTC, 2_000L);
        fixture.advance(HOUR);
        fixture.setBtcPrice(10_500L);

        PositionValuation valuation = fixture.engine.evaluatePosition(LP, BTC, fixture.feeds(), positionId);

        // 명목 $10,500, 이익 $500, 비용 = 차입 $10 + 종료 수수료 $10.5
        assertThat(valuation.getNotionalUsd()).isEqualTo(10_500L * 1_000_000_000L);
        assertThat(valuation.getPnlUsd()).isEqualTo(SignedAmount.positive(500L * 1_000_000_000L));
        assertThat(valuation.getBorrowFee()).isEqualTo(usdc(10L));
        assertThat(valuation.getCostsUsd()).isEqualTo(20_500_000_000L);
        assertThat(valuation.isLiquidated()).isFalse();
        assertThat(fixture.engine.position(LP, BTC, positionId).orElseThrow().getRealizedBorrowFee()).isZero();
    }

    @Test
    @DisplayName("누적 비용이 담보보다 커도 이익으로 덮이는 종료는 체결되고 매칭은 계속")
    void profitableCloseCoversCostsAboveCollateral() {
        // given: 시간당 0.1% 차입 비용, bob 담보 1,990 / alice 담보 90 (수수료 후)
        EngineFixture fixture = new EngineFixture(EngineFixture.defaultConfig().build(), 1_000_000L);
        long bobPosition = fixture.openPosition("bob", Side.LONG, ONE_BTC, 2_000L);
        long alicePosition = fixture.openPosition("alice", Side.LONG, ONE_BTC, 100L);
        long bobOrder = fixture.placeOrder(linked("bob", Side.SHORT, ONE_BTC, 11_000L, bobPosition)
                .reduceOnly(true)
                .build()).getValue().getOrderId();
        long aliceOrder = fixture.placeOrder(linked("alice", Side.SHORT, ONE_BTC, 11_000L, alicePosition)
                .reduceOnly(true)
                .build()).getValue().getOrderId();

        // 10시간 차입 비용 100 USDC > alice 담보 90 USDC
        fixture.advance(10 * HOUR);
        fixture.setBtcPrice(11_000L);

        // when: LIFO로 alice 먼저 종료
        EngineResult<MatchResult> result = fixture.engine.matchOrders(KEEPER, LP, BTC, fixture.feeds(),
                OrderBucket.TOKEN_LIMIT_SELL, price(11_000L), 10);

        // then: 담보 - 차입 100 + 이익 1,000 - 종료 수수료 11
        assertThat(result.getValue().getFilledOrderIds()).containsExactly(aliceOrder, bobOrder);
        assertThat(result.getValue().getBlockedOrderIds()).isEmpty();
        assertThat(fixture.engine.position(LP, BTC, alicePosition)).isEmpty();
        assertThat(fixture.engine.position(LP, BTC, bobPosition)).isEmpty();
        assertThat(result.getPayouts().tokenAmount("alice", USDC)).isEqualTo(usdc(979L));
        assertThat(result.getPayouts().tokenAmount("bob", USDC)).isEqualTo(usdc(2_879L));
        assertThat(fixture.pool.tokenState(USDC).getReservedAmount()).isZero();
        assertThat(fixture.info().getUserLongPositionSize()).isZero();
    }

    // ============================================
    // 담보 해제
    // ============================================

    @Test
    @DisplayName("담보 해제: 청산 대상이 되는 해제는 거부, 가능한 해제는 지급")
    void releaseCollateral() {
        // given
        EngineFixture fixture = new EngineFixture();
        long positionId = fixture.openPosition("alice", Side.LONG, ONE_BTC, 2_000L);

        // when & then: 40 USDC 남기면 유지증거금 $150 미만
        assertThatThrownBy(() -> fixture.engine.releaseCollateral("alice", LP, BTC, fixture.feeds(),
                positionId, usdc(1_950L)))
                .isInstanceOf(EngineException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.RELEASE_TRIGGERS_LIQUIDATION);
        assertThatThrownBy(() -> fixture.engine.releaseCollateral("bob", LP, BTC, fixture.feeds(),
                positionId, usdc(10L)))
                .isInstanceOf(EngineException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.UNAUTHORIZED);
        assertThatThrownBy(() -> fixture.engine.releaseCollateral("alice", LP, BTC, fixture.feeds(),
                positionId, usdc(5_000L)))
                .isInstanceOf(EngineException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.INSUFFICIENT_COLLATERAL);

        EngineResult<Long> released = fixture.engine.releaseCollateral("alice", LP, BTC, fixture.feeds(),
                positionId, usdc(1_000L));

        assertThat(released.getPayouts().tokenAmount("alice", USDC)).isEqualTo(usdc(1_000L));
        assertThat(fixture.engine.position(LP, BTC, positionId).orElseThrow().getCollateralAmount())
                .isEqualTo(usdc(990L));
    }

    @Test
    @DisplayName("해제 후 레버리지가 한도를 넘으면 거부되고 담보는 그대로")
    void releaseRespectsLeverageCap() {
        // given: 최대 레버리지 5x
        EngineFixture fixture = new EngineFixture();
        long positionId = fixture.openPosition("alice", Side.LONG, ONE_BTC, 2_000L);
        fixture.engine.updateSymbolConfig(ADMIN, LP, BTC,
                MarketConfigPatch.builder().maxLeverageMbp(50_000_000L).build());

        // when & then: 990 USDC 로 $10,000 = 10.1x
        assertThatThrownBy(() -> fixture.engine.releaseCollateral("alice", LP, BTC, fixture.feeds(),
                positionId, usdc(1_000L)))
                .isInstanceOf(EngineException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.LEVERAGE_EXCEEDED);
        assertThat(fixture.engine.position(LP, BTC, positionId).orElseThrow().getCollateralAmount())
                .isEqualTo(usdc(1_990L));
    }
}
