package dustin.perp.domains.engine.order;

import dustin.perp.domains.engine.EngineContext;

/**
 * 주문 담보 환불
 * Returns the collateral held by an order to its owner
 */
public final class OrderRefunds {

    private OrderRefunds() {
    }

    public static void refund(EngineContext ctx, TradingOrder order) {
        if (order.isOptionCollateral()) {
            ctx.getPayouts().returnReceipts(order.getUser(), order.getReceipts());
        } else {
            ctx.getPayouts().credit(order.getUser(), order.getCollateralToken(), order.getCollateralAmount());
        }
    }
}
