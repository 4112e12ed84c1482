package dustin.perp.domains.engine.liquidation;

import dustin.perp.domains.engine.math.SignedAmount;
import dustin.perp.domains.engine.model.Side;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 청산 조회 항목
 * Liquidation scan entry for one position
 */
@Getter
@Builder
@ToString
public class LiquidationInfo {

    private final String symbol;
    private final long positionId;
    private final String user;
    private final Side side;
    private final long size;
    private final String collateralToken;
    private final boolean liquidated;
    private final SignedAmount remainingUsd;
    private final long maintenanceMarginUsd;
}
