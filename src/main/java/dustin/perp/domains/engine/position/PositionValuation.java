package dustin.perp.domains.engine.position;

import dustin.perp.domains.engine.math.SignedAmount;
import dustin.perp.domains.engine.model.Side;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 포지션 평가 결과 (USD, 9 decimals)
 * Mark-to-oracle valuation of a position
 *
 * remainingUsd = collateralUsd + pnlUsd - costsUsd - fundingUsd
 * liquidated   = remainingUsd < maintenanceMarginUsd
 */
@Getter
@Builder
@ToString
public class PositionValuation {

    private final long positionId;
    private final String user;
    private final Side side;
    private final long size;
    private final String collateralToken;

    private final long notionalUsd;
    private final long collateralUsd;
    private final SignedAmount pnlUsd;
    private final long borrowFee;
    private final long closeFeeMbp;
    private final long costsUsd;
    private final SignedAmount fundingUsd;
    private final SignedAmount remainingUsd;
    private final long maintenanceMarginUsd;
    private final boolean liquidated;
}
