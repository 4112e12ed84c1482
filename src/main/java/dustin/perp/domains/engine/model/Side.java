package dustin.perp.domains.engine.model;

/**
 * 포지션/주문 방향
 * Position or order direction (buy = LONG, sell = SHORT)
 */
public enum Side {
    LONG,
    SHORT;

    public Side opposite() {
        return this == LONG ? SHORT : LONG;
    }

    public boolean isLong() {
        return this == LONG;
    }

    public static Side of(boolean isLong) {
        return isLong ? LONG : SHORT;
    }
}
