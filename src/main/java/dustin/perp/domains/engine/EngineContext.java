package dustin.perp.domains.engine;

import java.util.List;

import dustin.perp.domains.engine.event.EngineEvent;
import dustin.perp.domains.engine.event.EngineEventType;
import dustin.perp.domains.engine.market.Market;
import dustin.perp.domains.engine.market.SymbolMarket;
import dustin.perp.domains.engine.port.LiquidityPool;
import dustin.perp.domains.engine.port.OptionVault;
import dustin.perp.domains.engine.port.OraclePrice;
import lombok.Builder;
import lombok.Getter;

/**
 * 작업 단위 실행 컨텍스트
 * Per-operation execution context
 *
 * 역할:
 * - 검증된 오라클 가격 (거래 심볼, 담보 토큰)
 * - 협력 객체 (풀, 옵션 볼트)
 * - 지급 목록, 이벤트 버퍼 (커밋 후 발행)
 */
@Getter
@Builder
public class EngineContext {

    private final long nowMs;
    private final String caller;
    private final LiquidityPool pool;
    private final OptionVault vault;
    private final Payouts payouts;
    private final List<EngineEvent> events;

    private final Market market;
    private final SymbolMarket symbolMarket;

    private final OraclePrice tradingPrice;
    private final String collateralToken;
    private final OraclePrice collateralPrice;
    private final int collateralDecimal;
    private final long borrowRate;

    public EngineEvent.EngineEventBuilder event(EngineEventType type) {
        return EngineEvent.builder()
                .type(type)
                .timestampMs(nowMs)
                .market(market == null ? null : market.getLpToken())
                .symbol(symbolMarket == null ? null : symbolMarket.getBaseToken());
    }

    public void emit(EngineEvent.EngineEventBuilder builder) {
        events.add(builder.build());
    }

    public int sizeDecimal() {
        return symbolMarket.getInfo().getSizeDecimal();
    }
}
