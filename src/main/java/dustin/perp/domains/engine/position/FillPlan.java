package dustin.perp.domains.engine.position;

import dustin.perp.domains.engine.error.ErrorCode;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * 체결 계획
 * Result of validating a fill before any state changes
 *
 * 같은 상태에서 planFill → applyFill 순으로만 사용
 */
@Getter
public class FillPlan {

    private final long feeMbp;
    private final long fee;
    private ErrorCode blockCode;
    private String blocker;

    @Getter(AccessLevel.NONE)
    Position position;
    @Getter(AccessLevel.NONE)
    PositionLedger.AccruedCosts costs = PositionLedger.AccruedCosts.NONE;
    @Getter(AccessLevel.NONE)
    PositionLedger.ReducePlan reduce;

    FillPlan(long feeMbp, long fee) {
        this.feeMbp = feeMbp;
        this.fee = fee;
    }

    FillPlan block(ErrorCode code, String reason) {
        this.blockCode = code;
        this.blocker = reason;
        return this;
    }

    public boolean isBlocked() {
        return blocker != null;
    }
}
