package dustin.perp.domains.engine.funding;

import static dustin.perp.domains.engine.EngineFixture.BTC;
import static dustin.perp.domains.engine.EngineFixture.HOUR;
import static dustin.perp.domains.engine.EngineFixture.LP;
import static dustin.perp.domains.engine.EngineFixture.ONE_BTC;
import static dustin.perp.domains.engine.EngineFixture.T0;
import static dustin.perp.domains.engine.EngineFixture.usdc;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dustin.perp.domains.engine.EngineFixture;
import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;
import dustin.perp.domains.engine.math.SignedAmount;
import dustin.perp.domains.engine.model.Side;
import dustin.perp.domains.engine.position.PositionValuation;
import dustin.perp.domains.oracle.ManualOracle;

/**
 * 펀딩 엔진 테스트
 * Funding index updates
 *
 * 수수료 0 설정으로 TVL을 $10,000,000 로 고정
 * increment = 1e7 * exposureUsd / tvlUsd * intervals
 */
class FundingEngineTest {

    private EngineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture(EngineFixture.defaultConfig()
                .baseTradingFeeMbp(0L)
                .maxTradingFeeMbp(0L)
                .build(), 0L);
    }

    private FundingUpdate update() {
        return fixture.engine.updateFunding(EngineFixture.KEEPER, LP, BTC, fixture.btcOracle).getValue();
    }

    @Test
    @DisplayName("구간 경계를 지나지 않았으면 아무것도 하지 않음")
    void noopWithinInterval() {
        FundingUpdate result = update();

        assertThat(result.isUpdated()).isFalse();
        assertThat(result.getCurrentIndex()).isEqualTo(SignedAmount.ZERO);
        assertThat(fixture.info().getLastFundingTs()).isEqualTo(T0);
    }

    @Test
    @DisplayName("롱 우세면 인덱스 증가, 같은 시각 재호출은 무시")
    void longSkewRaisesIndex() {
        // given: 1 BTC 롱 ($10,000 노출)
        fixture.openPosition("alice", Side.LONG, ONE_BTC, 2_000L);
        fixture.advance(HOUR);

        // when
        FundingUpdate result = update();

        // then: 1e7 * 1e13 / 1e16 = 10,000
        assertThat(result.isUpdated()).isTrue();
        assertThat(result.getIntervals()).isEqualTo(1L);
        assertThat(result.getExposureUsd()).isEqualTo(10_000L * 1_000_000_000L);
        assertThat(result.getIncrement()).isEqualTo(SignedAmount.positive(10_000L));
        assertThat(result.getCurrentIndex()).isEqualTo(SignedAmount.positive(10_000L));
        assertThat(fixture.info().getLastFundingTs()).isEqualTo(T0 + HOUR);

        FundingUpdate again = update();
        assertThat(again.isUpdated()).isFalse();
        assertThat(fixture.info().getCumulativeFundingIndex()).isEqualTo(SignedAmount.positive(10_000L));
    }

    @Test
    @DisplayName("숏 우세로 바뀌면 인덱스가 0을 지나 음수로, 놓친 구간은 한 번에 누적")
    void shortSkewCrossesZero() {
        // given
        long alice = fixture.openPosition("alice", Side.LONG, ONE_BTC, 2_000L);
        fixture.advance(HOUR);
        update();
        long bob = fixture.openPosition("bob", Side.SHORT, 3L * ONE_BTC, 6_000L);

        // when: 2시간 경과, 순 노출 2 BTC 숏
        fixture.advance(2 * HOUR);
        FundingUpdate result = update();

        // then: 2 * 20,000 감소
        assertThat(result.getIntervals()).isEqualTo(2L);
        assertThat(result.getIncrement()).isEqualTo(SignedAmount.negative(40_000L));
        assertThat(result.getPreviousIndex()).isEqualTo(SignedAmount.positive(10_000L));
        assertThat(result.getCurrentIndex()).isEqualTo(SignedAmount.negative(30_000L));
        assertThat(fixture.info().getPreviousCumulativeFundingIndex()).isEqualTo(SignedAmount.positive(10_000L));

        // 롱은 받고 (인덱스 -30,000 * $10,000), 숏은 냄 (-40,000 * $30,000)
        PositionValuation aliceValue = fixture.engine.evaluatePosition(LP, BTC, fixture.feeds(), alice);
        PositionValuation bobValue = fixture.engine.evaluatePosition(LP, BTC, fixture.feeds(), bob);
        assertThat(aliceValue.getFundingUsd()).isEqualTo(SignedAmount.negative(300_000_000L));
        assertThat(bobValue.getFundingUsd()).isEqualTo(SignedAmount.positive(1_200_000_000L));
    }

    @Test
    @DisplayName("받을 펀딩은 다음 포지션 변경 시 담보로 실현")
    void receivedFundingRealizedIntoCollateral() {
        // given
        long alice = fixture.openPosition("alice", Side.LONG, ONE_BTC, 2_000L);
        fixture.advance(HOUR);
        update();
        fixture.openPosition("bob", Side.SHORT, 3L * ONE_BTC, 6_000L);
        fixture.advance(2 * HOUR);
        update();

        // when
        fixture.engine.increaseCollateral("alice", LP, BTC, fixture.feeds(), alice, usdc(100L), List.of(), false);

        // then: 2,000 + 0.3 (펀딩) + 100
        assertThat(fixture.engine.position(LP, BTC, alice).orElseThrow().getCollateralAmount())
                .isEqualTo(2_100_300_000L);
        assertThat(fixture.engine.position(LP, BTC, alice).orElseThrow().getLastFundingIndex())
                .isEqualTo(SignedAmount.negative(30_000L));
    }

    @Test
    @DisplayName("심볼에 묶이지 않은 오라클이나 오래된 가격은 거부")
    void rejectsWrongOrStaleOracle() {
        ManualOracle other = new ManualOracle("ETH/USD", 8);
        other.update(200_000_000_000L, T0);

        assertThatThrownBy(() -> fixture.engine.updateFunding(EngineFixture.KEEPER, LP, BTC, other))
                .isInstanceOf(EngineException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.ORACLE_MISMATCH);

        fixture.clock.advance(HOUR);
        assertThatThrownBy(this::update)
                .isInstanceOf(EngineException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.ORACLE_STALE);
        assertThat(fixture.info().getLastFundingTs()).isEqualTo(T0);
    }
}
