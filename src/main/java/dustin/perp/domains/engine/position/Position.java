package dustin.perp.domains.engine.position;

import java.util.ArrayList;
import java.util.List;

import dustin.perp.domains.engine.math.SignedAmount;
import dustin.perp.domains.engine.model.CollateralMode;
import dustin.perp.domains.engine.model.Side;
import dustin.perp.domains.engine.port.BidReceipt;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 포지션
 * Open leveraged position
 *
 * 역할:
 * - 방향/수량/평균 진입가/담보/준비금 보관
 * - 차입 이자율, 펀딩 인덱스 스냅샷 (마지막 정산 시점 기준)
 * - 실현 누계 (수수료, 차입, 펀딩, 손익)
 *
 * 옵션 담보:
 * - 담보 가치 = 볼트 receipt 내재가치
 * - 토큰에서 차감할 수 없는 비용은 pendingCost에 누적 (양수 = 사용자가 갚을 금액)
 */
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private long positionId;
    private String user;
    private Side side;
    private long size;

    private CollateralMode collateralMode;
    private String collateralToken;
    private long collateralAmount;
    private Long vaultIndex;
    @Builder.Default
    private List<BidReceipt> receipts = new ArrayList<>();
    @Builder.Default
    private SignedAmount pendingCost = SignedAmount.ZERO;

    private long entryPrice;
    private int priceDecimal;
    private long reserveAmount;

    private long lastBorrowRate;
    @Builder.Default
    private SignedAmount lastFundingIndex = SignedAmount.ZERO;

    private long realizedTradingFee;
    private long realizedBorrowFee;
    @Builder.Default
    private SignedAmount realizedFundingFee = SignedAmount.ZERO;
    @Builder.Default
    private SignedAmount realizedPnl = SignedAmount.ZERO;

    @Builder.Default
    private List<LinkedOrderRef> linkedOrders = new ArrayList<>();

    private long createdAtMs;
    private long updatedAtMs;

    public boolean isOptionCollateral() {
        return collateralMode == CollateralMode.OPTION;
    }

    public void linkOrder(long orderId, long triggerPrice) {
        linkedOrders.add(new LinkedOrderRef(orderId, triggerPrice));
    }

    public void unlinkOrder(long orderId) {
        linkedOrders.removeIf(ref -> ref.getOrderId() == orderId);
    }

    public Position copy() {
        return toBuilder()
                .receipts(new ArrayList<>(receipts))
                .linkedOrders(new ArrayList<>(linkedOrders))
                .build();
    }
}
