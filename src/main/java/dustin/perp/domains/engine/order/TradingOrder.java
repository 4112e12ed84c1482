package dustin.perp.domains.engine.order;

import java.util.ArrayList;
import java.util.List;

import dustin.perp.domains.engine.model.CollateralMode;
import dustin.perp.domains.engine.model.Side;
import dustin.perp.domains.engine.port.BidReceipt;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 조건부 주문 (지정가/스탑)
 * Trading order resting in an order bucket
 *
 * 역할:
 * - 담보를 보관한 채로 발동 가격을 기다림
 * - linkedPositionId가 있으면 해당 포지션에 병합되어 체결됨
 *
 * 담보:
 * - TOKEN: collateralToken / collateralAmount
 * - OPTION: collateralToken = bid 토큰, vaultIndex / receipts
 */
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TradingOrder {

    private long orderId;
    private String user;
    private Side side;
    private boolean stopOrder;
    private boolean reduceOnly;
    private long size;
    private long triggerPrice;

    private CollateralMode collateralMode;
    private String collateralToken;
    private long collateralAmount;
    private Long vaultIndex;
    @Builder.Default
    private List<BidReceipt> receipts = new ArrayList<>();

    private long leverageMbp;
    private Long linkedPositionId;
    private long oraclePriceWhenPlacing;
    private long createdAtMs;

    public OrderBucket bucket() {
        return OrderBucket.of(collateralMode, stopOrder, side);
    }

    public boolean isOptionCollateral() {
        return collateralMode == CollateralMode.OPTION;
    }

    public TradingOrder copy() {
        return toBuilder().receipts(new ArrayList<>(receipts)).build();
    }
}
