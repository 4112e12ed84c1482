package dustin.perp.domains.maintenance.model.dto;

import dustin.perp.domains.engine.liquidation.LiquidationInfo;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 청산 대상 조회 DTO
 * Liquidation Info Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "포지션 청산 상태")
public class LiquidationInfoResponse {

    private String symbol;
    private Long positionId;
    private String user;
    private String side;
    private Long size;
    private String collateralToken;
    private boolean liquidatable;
    private String remainingUsd;
    private Long maintenanceMarginUsd;

    public static LiquidationInfoResponse from(LiquidationInfo info) {
        return LiquidationInfoResponse.builder()
                .symbol(info.getSymbol())
                .positionId(info.getPositionId())
                .user(info.getUser())
                .side(info.getSide().name())
                .size(info.getSize())
                .collateralToken(info.getCollateralToken())
                .liquidatable(info.isLiquidated())
                .remainingUsd(info.getRemainingUsd().toString())
                .maintenanceMarginUsd(info.getMaintenanceMarginUsd())
                .build();
    }
}
