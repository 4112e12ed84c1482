package dustin.perp.domains.engine.liquidation;

import static dustin.perp.domains.engine.EngineFixture.BTC;
import static dustin.perp.domains.engine.EngineFixture.KEEPER;
import static dustin.perp.domains.engine.EngineFixture.LP;
import static dustin.perp.domains.engine.EngineFixture.ONE_BTC;
import static dustin.perp.domains.engine.EngineFixture.POOL_LIQUIDITY;
import static dustin.perp.domains.engine.EngineFixture.T0;
import static dustin.perp.domains.engine.EngineFixture.USDC;
import static dustin.perp.domains.engine.EngineFixture.price;
import static dustin.perp.domains.engine.EngineFixture.usdc;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dustin.perp.domains.engine.EngineFixture;
import dustin.perp.domains.engine.EngineResult;
import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;
import dustin.perp.domains.engine.event.EngineEvent;
import dustin.perp.domains.engine.event.EngineEventType;
import dustin.perp.domains.engine.math.SignedAmount;
import dustin.perp.domains.engine.model.CollateralMode;
import dustin.perp.domains.engine.model.Side;
import dustin.perp.domains.engine.order.CreateOrderCommand;
import dustin.perp.domains.engine.port.BidReceipt;
import dustin.perp.domains.engine.position.Position;

/**
 * 청산 엔진 테스트
 * Liquidation and option receipt escrow
 *
 * 기본 포지션: $10,000 에서 1 BTC 롱, 담보 1,010 USDC (수수료 후 1,000)
 * - $9,200: 남은 담보 $190.8 > 유지증거금 $138 → 유지
 * - $9,010: 남은 담보 $0.99 < 유지증거금 $135.15 → 청산, 청산자 수수료 $90.1
 */
class LiquidationEngineTest {

    private static final long DAY = 86_400_000L;

    private EngineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
    }

    @Test
    @DisplayName("유지증거금 이상인 포지션은 청산 불가, 조회 시 includeAll 일 때만 포함")
    void healthyPositionCannotBeLiquidated() {
        // given
        long positionId = fixture.openPosition("alice", Side.LONG, ONE_BTC, 1_010L);
        fixture.setBtcPrice(9_200L);

        // when & then
        assertThatThrownBy(() -> fixture.engine.liquidate("carol", LP, BTC, fixture.feeds(), positionId))
                .isInstanceOf(EngineException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.POSITION_HEALTHY);
        assertThat(fixture.engine.getLiquidationInfo(LP, BTC, fixture.feeds(), false)).isEmpty();

        List<LiquidationInfo> all = fixture.engine.getLiquidationInfo(LP, BTC, fixture.feeds(), true);
        assertThat(all).hasSize(1);
        assertThat(all.get(0).isLiquidated()).isFalse();
        assertThat(all.get(0).getPositionId()).isEqualTo(positionId);
    }

    @Test
    @DisplayName("청산: 청산자는 명목가치 1%, 나머지 담보는 풀로, 준비금과 연결 주문 해제")
    void liquidateTokenCollateral() {
        // given: 포지션 + 연결된 stop loss
        long positionId = fixture.openPosition("alice", Side.LONG, ONE_BTC, 1_010L);
        fixture.placeOrder(CreateOrderCommand.builder()
                .user("alice")
                .side(Side.SHORT)
                .stopOrder(true)
                .reduceOnly(true)
                .size(ONE_BTC)
                .triggerPrice(price(9_000L))
                .linkedPositionId(positionId)
                .build());
        fixture.setBtcPrice(9_010L);
        assertThat(fixture.engine.getLiquidationInfo(LP, BTC, fixture.feeds(), false))
                .extracting(LiquidationInfo::getPositionId)
                .containsExactly(positionId);

        // when: 누구나 청산 가능
        EngineResult<LiquidationResult> result = fixture.engine.liquidate("carol", LP, BTC, fixture.feeds(), positionId);

        // then
        LiquidationResult liquidation = result.getValue();
        assertThat(liquidation.getLiquidatorFee()).isEqualTo(90_100_000L);
        assertThat(liquidation.getToPool()).isEqualTo(909_900_000L);
        assertThat(liquidation.getValuation().isLiquidated()).isTrue();
        assertThat(result.getPayouts().tokenAmount("carol", USDC)).isEqualTo(90_100_000L);
        assertThat(result.getPayouts().tokenAmount("alice", USDC)).isZero();

        assertThat(fixture.pool.tokenState(USDC).getLiquidityAmount())
                .isEqualTo(POOL_LIQUIDITY + 9_000_000L + 909_900_000L);
        assertThat(fixture.pool.tokenState(USDC).getReservedAmount()).isZero();
        assertThat(fixture.info().getUserLongPositionSize()).isZero();
        assertThat(fixture.info().getUserShortOrderSize()).isZero();
        assertThat(fixture.engine.orders(LP, BTC, "alice")).isEmpty();
        assertThat(result.getEvents()).extracting(EngineEvent::getType)
                .containsExactly(EngineEventType.ORDER_RELEASED, EngineEventType.POSITION_LIQUIDATED);

        assertThatThrownBy(() -> fixture.engine.liquidate("carol", LP, BTC, fixture.feeds(), positionId))
                .isInstanceOf(EngineException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.POSITION_NOT_FOUND);
    }

    @Test
    @DisplayName("옵션 담보 청산: 미만기 receipt는 보관, 만기 후 청산자 → 풀 순서로 정산")
    void optionCollateralEscrowedUntilExpiry() {
        // given: 1,010 USDC 가치의 receipt 로 1 BTC 롱
        fixture.vault.createVault(1L, USDC, T0 + DAY, 1_000_000_000L);
        BidReceipt receipt = fixture.vault.issueReceipt(1L, 1_010_000_000L);
        long positionId = fixture.placeOrder(CreateOrderCommand.builder()
                .user("alice")
                .side(Side.LONG)
                .size(ONE_BTC)
                .triggerPrice(price(10_000L))
                .collateralMode(CollateralMode.OPTION)
                .vaultIndex(1L)
                .receipts(List.of(receipt))
                .build()).getValue().getFill().getPositionId();

        Position position = fixture.engine.position(LP, BTC, positionId).orElseThrow();
        assertThat(position.getPendingCost()).isEqualTo(SignedAmount.positive(usdc(10L)));
        assertThat(position.getCollateralAmount()).isZero();

        // when: $9,010 에서 청산
        fixture.setBtcPrice(9_010L);
        EngineResult<LiquidationResult> result = fixture.engine.liquidate("carol", LP, BTC, fixture.feeds(), positionId);

        // then: 아직 지급 없음, 보관 기록 생성
        assertThat(result.getValue().getLiquidatorFee()).isEqualTo(90_100_000L);
        assertThat(result.getValue().getToPool()).isEqualTo(919_900_000L);
        assertThat(result.getPayouts().tokenAmount("carol", USDC)).isZero();

        List<UnsettledReceipt> escrows = fixture.engine.unsettledReceipts(LP);
        assertThat(escrows).hasSize(1);
        assertThat(escrows.get(0).getLiquidator()).isEqualTo("carol");
        assertThat(escrows.get(0).getOwedToLiquidator()).isEqualTo(90_100_000L);
        assertThat(escrows.get(0).getOwedToPool()).isEqualTo(919_900_000L);
        assertThat(escrows.get(0).getReceipts()).containsExactly(receipt);

        // 만기 전 정산은 아무것도 하지 않음
        assertThat(fixture.engine.settleUnsettledReceipts(KEEPER, LP, 10).getValue()).isZero();
        assertThatThrownBy(() -> fixture.engine.settleUnsettledReceipts("carol", LP, 10))
                .isInstanceOf(EngineException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.UNAUTHORIZED);

        // when: 만기 후 정산
        long liquidityBefore = fixture.pool.tokenState(USDC).getLiquidityAmount();
        fixture.advance(DAY);
        EngineResult<Integer> settled = fixture.engine.settleUnsettledReceipts(KEEPER, LP, 10);

        // then
        assertThat(settled.getValue()).isEqualTo(1);
        assertThat(settled.getPayouts().tokenAmount("carol", USDC)).isEqualTo(90_100_000L);
        assertThat(settled.getPayouts().tokenAmount("alice", USDC)).isZero();
        assertThat(fixture.pool.tokenState(USDC).getLiquidityAmount()).isEqualTo(liquidityBefore + 919_900_000L);
        assertThat(fixture.engine.unsettledReceipts(LP)).isEmpty();
        assertThat(fixture.vault.liveReceipts()).doesNotContainKey(receipt.getReceiptId());
        assertThat(settled.getEvents()).extracting(EngineEvent::getType)
                .containsExactly(EngineEventType.RECEIPT_SETTLED);
    }

    @Test
    @DisplayName("옵션 담보 포지션을 정상 종료하면 미만기 receipt는 소유자에게 반환")
    void optionPositionCloseReturnsReceipts() {
        // given
        fixture.vault.createVault(1L, USDC, T0 + DAY, 1_000_000_000L);
        BidReceipt receipt = fixture.vault.issueReceipt(1L, 2_000_000_000L);
        long positionId = fixture.placeOrder(CreateOrderCommand.builder()
                .user("alice")
                .side(Side.LONG)
                .size(ONE_BTC)
                .triggerPrice(price(10_000L))
                .collateralMode(CollateralMode.OPTION)
                .vaultIndex(1L)
                .receipts(List.of(receipt))
                .build()).getValue().getFill().getPositionId();

        // when: 같은 가격에서 종료, 미정산 비용 = 수수료 20 USDC → 풀로 보관
        EngineResult<?> close = fixture.placeOrder(CreateOrderCommand.builder()
                .user("alice")
                .side(Side.SHORT)
                .reduceOnly(true)
                .size(ONE_BTC)
                .triggerPrice(price(10_000L))
                .collateralMode(CollateralMode.OPTION)
                .vaultIndex(1L)
                .linkedPositionId(positionId)
                .build());

        // then: 갚을 비용이 남아 있으므로 receipt는 보관 (청산자 없음)
        assertThat(fixture.engine.position(LP, BTC, positionId)).isEmpty();
        List<UnsettledReceipt> escrows = fixture.engine.unsettledReceipts(LP);
        assertThat(escrows).hasSize(1);
        assertThat(escrows.get(0).getLiquidator()).isNull();
        assertThat(escrows.get(0).getOwedToPool()).isEqualTo(usdc(20L));
        assertThat(close.getPayouts().receiptsOf("alice")).isEmpty();
    }
}
