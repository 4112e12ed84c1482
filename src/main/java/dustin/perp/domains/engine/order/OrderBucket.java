package dustin.perp.domains.engine.order;

import dustin.perp.domains.engine.model.CollateralMode;
import dustin.perp.domains.engine.model.Side;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 주문 버킷 (8종)
 * Order bucket = {token, option collateral} x {limit, stop} x {buy, sell}
 *
 * 발동 조건:
 * - limit buy : oracle <= trigger
 * - limit sell: oracle >= trigger
 * - stop buy  : oracle >= trigger
 * - stop sell : oracle <= trigger
 */
@Getter
@RequiredArgsConstructor
public enum OrderBucket {
    TOKEN_LIMIT_BUY(CollateralMode.TOKEN, false, Side.LONG, "token_limit_buy"),
    TOKEN_LIMIT_SELL(CollateralMode.TOKEN, false, Side.SHORT, "token_limit_sell"),
    TOKEN_STOP_BUY(CollateralMode.TOKEN, true, Side.LONG, "token_stop_buy"),
    TOKEN_STOP_SELL(CollateralMode.TOKEN, true, Side.SHORT, "token_stop_sell"),
    OPTION_LIMIT_BUY(CollateralMode.OPTION, false, Side.LONG, "option_limit_buy"),
    OPTION_LIMIT_SELL(CollateralMode.OPTION, false, Side.SHORT, "option_limit_sell"),
    OPTION_STOP_BUY(CollateralMode.OPTION, true, Side.LONG, "option_stop_buy"),
    OPTION_STOP_SELL(CollateralMode.OPTION, true, Side.SHORT, "option_stop_sell");

    private final CollateralMode collateralMode;
    private final boolean stop;
    private final Side side;
    private final String tag;

    public static OrderBucket of(CollateralMode collateralMode, boolean stop, Side side) {
        for (OrderBucket bucket : values()) {
            if (bucket.collateralMode == collateralMode && bucket.stop == stop && bucket.side == side) {
                return bucket;
            }
        }
        throw new IllegalStateException("No bucket for " + collateralMode + "/" + stop + "/" + side);
    }

    public static OrderBucket fromTag(String tag) {
        for (OrderBucket bucket : values()) {
            if (bucket.tag.equalsIgnoreCase(tag) || bucket.name().equalsIgnoreCase(tag)) {
                return bucket;
            }
        }
        throw new IllegalArgumentException("Unknown order bucket: " + tag);
    }

    /**
     * 현재 오라클 가격에서 발동되는지 여부
     */
    public boolean isTriggered(long oraclePrice, long triggerPrice) {
        boolean buy = side == Side.LONG;
        if (!stop) {
            return buy ? oraclePrice <= triggerPrice : oraclePrice >= triggerPrice;
        }
        return buy ? oraclePrice >= triggerPrice : oraclePrice <= triggerPrice;
    }

    /**
     * 발동된 가격대가 oracle 이상 쪽에 있는지 (limit buy, stop sell)
     */
    boolean triggersAtOrAbove() {
        return (side == Side.LONG) != stop;
    }
}
