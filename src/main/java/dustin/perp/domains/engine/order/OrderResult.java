package dustin.perp.domains.engine.order;

import dustin.perp.domains.engine.position.FillOutcome;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 주문 생성 결과
 * Result of order creation: resting in the book or filled immediately
 */
@Getter
@Builder
@ToString
public class OrderResult {

    private final long orderId;
    private final OrderBucket bucket;
    private final long triggerPrice;
    private final long leverageMbp;
    private final boolean filled;

    /**
     * 즉시 체결된 경우만 존재
     */
    private final FillOutcome fill;
}
