package dustin.perp.domains.engine.position;

import java.util.Objects;

/**
 * 포지션에 연결된 대기 주문 참조 (주문 id, 발동 가격)
 * Reference from a position to one of its resting linked orders
 */
public final class LinkedOrderRef {

    private final long orderId;
    private final long triggerPrice;

    public LinkedOrderRef(long orderId, long triggerPrice) {
        this.orderId = orderId;
        this.triggerPrice = triggerPrice;
    }

    public long getOrderId() {
        return orderId;
    }

    public long getTriggerPrice() {
        return triggerPrice;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LinkedOrderRef that = (LinkedOrderRef) o;
        return orderId == that.orderId && triggerPrice == that.triggerPrice;
    }

    @Override
    public int hashCode() {
        return Objects.hash(orderId, triggerPrice);
    }
}
