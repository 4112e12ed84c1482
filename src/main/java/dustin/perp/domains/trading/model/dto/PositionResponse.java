package dustin.perp.domains.trading.model.dto;

import java.util.List;
import java.util.stream.Collectors;

import dustin.perp.domains.engine.port.BidReceipt;
import dustin.perp.domains.engine.position.LinkedOrderRef;
import dustin.perp.domains.engine.position.Position;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 포지션 응답 DTO
 * Position Response DTO
 *
 * 부호가 있는 값 (pendingCost, realizedFundingFee, realizedPnl)은 문자열 정수
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "포지션 정보")
public class PositionResponse {

    private Long positionId;
    private String user;
    private String side;
    private Long size;
    private String collateralMode;
    private String collateralToken;
    private Long collateralAmount;
    private Long vaultIndex;
    private List<String> receiptIds;
    @Schema(description = "옵션 담보 미정산 비용 (양수 = 사용자가 갚을 금액)")
    private String pendingCost;
    private Long entryPrice;
    private Long reserveAmount;
    private Long realizedTradingFee;
    private Long realizedBorrowFee;
    private String realizedFundingFee;
    private String realizedPnl;
    private List<Long> linkedOrderIds;
    private Long createdAtMs;
    private Long updatedAtMs;

    public static PositionResponse from(Position position) {
        return PositionResponse.builder()
                .positionId(position.getPositionId())
                .user(position.getUser())
                .side(position.getSide().name())
                .size(position.getSize())
                .collateralMode(position.getCollateralMode().name())
                .collateralToken(position.getCollateralToken())
                .collateralAmount(position.getCollateralAmount())
                .vaultIndex(position.getVaultIndex())
                .receiptIds(position.getReceipts().stream().map(BidReceipt::getReceiptId).collect(Collectors.toList()))
                .pendingCost(position.getPendingCost().toString())
                .entryPrice(position.getEntryPrice())
                .reserveAmount(position.getReserveAmount())
                .realizedTradingFee(position.getRealizedTradingFee())
                .realizedBorrowFee(position.getRealizedBorrowFee())
                .realizedFundingFee(position.getRealizedFundingFee().toString())
                .realizedPnl(position.getRealizedPnl().toString())
                .linkedOrderIds(position.getLinkedOrders().stream().map(LinkedOrderRef::getOrderId).collect(Collectors.toList()))
                .createdAtMs(position.getCreatedAtMs())
                .updatedAtMs(position.getUpdatedAtMs())
                .build();
    }
}
