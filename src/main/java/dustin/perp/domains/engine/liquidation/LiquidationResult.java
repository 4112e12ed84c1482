package dustin.perp.domains.engine.liquidation;

import dustin.perp.domains.engine.position.PositionValuation;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 청산 결과
 * Liquidation result
 */
@Getter
@Builder
@ToString
public class LiquidationResult {

    private final long positionId;
    private final String user;
    private final String liquidator;
    private final String collateralToken;

    /**
     * 청산자에게 즉시 지급된 수량 (옵션 담보는 receipt 행사분만)
     */
    private final long liquidatorFee;
    private final long toPool;
    private final PositionValuation valuation;
}
