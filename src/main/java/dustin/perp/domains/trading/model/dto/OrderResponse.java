package dustin.perp.domains.trading.model.dto;

import java.util.List;
import java.util.stream.Collectors;

import dustin.perp.domains.engine.order.TradingOrder;
import dustin.perp.domains.engine.port.BidReceipt;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 대기 주문 응답 DTO
 * Resting Order Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "대기 주문 정보")
public class OrderResponse {

    @Schema(description = "주문 ID", example = "3")
    private Long orderId;

    @Schema(description = "주문자", example = "alice")
    private String user;

    @Schema(description = "주문 버킷", example = "TOKEN_LIMIT_BUY")
    private String bucket;

    @Schema(description = "방향", example = "LONG")
    private String side;

    private boolean stopOrder;
    private boolean reduceOnly;
    private Long size;
    private Long triggerPrice;

    @Schema(description = "담보 방식", example = "TOKEN")
    private String collateralMode;
    private String collateralToken;
    private Long collateralAmount;
    private Long vaultIndex;
    private List<String> receiptIds;

    @Schema(description = "주문 시점 레버리지 (mbp, 1x = 10000000)")
    private Long leverageMbp;
    private Long linkedPositionId;
    private Long createdAtMs;

    public static OrderResponse from(TradingOrder order) {
        return OrderResponse.builder()
                .orderId(order.getOrderId())
                .user(order.getUser())
                .bucket(order.bucket().name())
                .side(order.getSide().name())
                .stopOrder(order.isStopOrder())
                .reduceOnly(order.isReduceOnly())
                .size(order.getSize())
                .triggerPrice(order.getTriggerPrice())
                .collateralMode(order.getCollateralMode().name())
                .collateralToken(order.getCollateralToken())
                .collateralAmount(order.getCollateralAmount())
                .vaultIndex(order.getVaultIndex())
                .receiptIds(order.getReceipts().stream().map(BidReceipt::getReceiptId).collect(Collectors.toList()))
                .leverageMbp(order.getLeverageMbp())
                .linkedPositionId(order.getLinkedPositionId())
                .createdAtMs(order.getCreatedAtMs())
                .build();
    }
}
