package dustin.perp.domains.engine.funding;

import dustin.perp.domains.engine.math.SignedAmount;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 펀딩 갱신 결과
 * Funding update result (updated=false when no interval has elapsed)
 */
@Getter
@Builder
@ToString
public class FundingUpdate {

    private final String symbol;
    private final boolean updated;
    private final long intervals;
    private final long exposureUsd;
    private final SignedAmount increment;
    private final SignedAmount previousIndex;
    private final SignedAmount currentIndex;
    private final long lastFundingTs;
}
