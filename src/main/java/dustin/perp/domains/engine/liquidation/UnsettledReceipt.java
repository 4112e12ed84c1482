package dustin.perp.domains.engine.liquidation;

import java.util.ArrayList;
import java.util.List;

import dustin.perp.domains.engine.port.BidReceipt;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 미정산 receipt 보관 기록
 * Escrow of option receipts that could not be exercised yet
 *
 * 역할:
 * - 옵션 담보 포지션 종료/청산 시 아직 만기되지 않은 receipt와 미지급 금액을 보관
 * - 만기 후 정산 시 청산자 → 풀 → 포지션 소유자 순서로 분배
 */
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UnsettledReceipt {

    private long escrowId;
    private String symbol;
    private long positionId;
    private String user;
    private String liquidator;
    private String bidToken;
    private long vaultIndex;
    @Builder.Default
    private List<BidReceipt> receipts = new ArrayList<>();
    private long owedToLiquidator;
    private long owedToPool;
    private long createdAtMs;

    public UnsettledReceipt copy() {
        return toBuilder().receipts(new ArrayList<>(receipts)).build();
    }
}
