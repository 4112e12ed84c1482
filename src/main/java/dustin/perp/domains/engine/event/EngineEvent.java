package dustin.perp.domains.engine.event;

import java.util.Map;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/**
 * 엔진 이벤트
 * Engine event record
 *
 * 역할:
 * - 상태 변경마다 하나씩 생성 (커밋 후에만 리스너에 전달)
 * - amounts: 이름이 붙은 수치 (예: collateral_before, collateral_after, fee)
 *
 * 예시:
 * ORDER_FILLED {market=LP, symbol=BTC, user=alice, orderId=3, positionId=1,
 *               amounts={size=1000, fill_price=10000000000, fee_mbp=10180}}
 */
@Getter
@Builder
@ToString
public class EngineEvent {

    private final EngineEventType type;
    private final long timestampMs;
    private final String market;
    private final String symbol;
    private final String user;
    private final Long orderId;
    private final Long positionId;
    private final String detail;

    @Singular
    private final Map<String, Long> amounts;
}
