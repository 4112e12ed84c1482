package dustin.perp.domains.engine.order;

import java.util.ArrayList;
import java.util.List;

import dustin.perp.domains.engine.model.CollateralMode;
import dustin.perp.domains.engine.model.Side;
import dustin.perp.domains.engine.port.BidReceipt;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 주문 생성 요청
 * Create order command
 *
 * 예시:
 * <pre>
 * CreateOrderCommand.builder()
 *     .user("alice").side(Side.LONG).stopOrder(false)
 *     .size(1_000_000_000L).triggerPrice(10_000_000_000L)
 *     .collateralMode(CollateralMode.TOKEN).collateralAmount(20_000_000L)
 *     .build();
 * </pre>
 */
@Getter
@Builder
@ToString
public class CreateOrderCommand {

    private final String user;
    private final Side side;
    private final boolean stopOrder;
    private final boolean reduceOnly;
    private final long size;
    private final long triggerPrice;

    @Builder.Default
    private final CollateralMode collateralMode = CollateralMode.TOKEN;
    private final long collateralAmount;
    private final Long vaultIndex;
    @Builder.Default
    private final List<BidReceipt> receipts = new ArrayList<>();

    private final Long linkedPositionId;
}
