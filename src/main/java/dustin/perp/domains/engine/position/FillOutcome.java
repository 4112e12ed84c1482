package dustin.perp.domains.engine.position;

import dustin.perp.domains.engine.math.SignedAmount;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 체결 결과
 * Result of applying one filled order to the ledger
 */
@Getter
@Builder
@ToString
public class FillOutcome {

    public enum Action {
        OPENED,
        INCREASED,
        REDUCED,
        FLIPPED,
        CLOSED
    }

    private final Action action;
    private final long positionId;
    private final long filledSize;
    private final long fillPrice;
    private final long feeMbp;
    private final long feeAmount;
    @Builder.Default
    private final SignedAmount realizedPnl = SignedAmount.ZERO;

    public boolean isPositionClosed() {
        return action == Action.CLOSED;
    }
}
