package dustin.perp.domains.trading.model.dto;

import dustin.perp.domains.engine.position.PositionValuation;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 포지션 평가 응답 DTO
 * Position Valuation Response DTO
 *
 * USD 값은 9자리 고정소수점 정수
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "현재 오라클 가격 기준 포지션 평가")
public class PositionValuationResponse {

    private Long positionId;
    private String user;
    private String side;
    private Long size;
    private String collateralToken;
    private Long notionalUsd;
    private Long collateralUsd;
    @Schema(description = "미실현 손익 (USD)")
    private String pnlUsd;
    @Schema(description = "미실현 대출 수수료 (담보 토큰)")
    private Long borrowFee;
    private Long closeFeeMbp;
    private Long costsUsd;
    @Schema(description = "미실현 펀딩 (양수 = 지불)")
    private String fundingUsd;
    @Schema(description = "담보 + 손익 - 비용 - 펀딩")
    private String remainingUsd;
    private Long maintenanceMarginUsd;
    @Schema(description = "청산 가능 여부")
    private boolean liquidatable;

    public static PositionValuationResponse from(PositionValuation valuation) {
        return PositionValuationResponse.builder()
                .positionId(valuation.getPositionId())
                .user(valuation.getUser())
                .side(valuation.getSide().name())
                .size(valuation.getSize())
                .collateralToken(valuation.getCollateralToken())
                .notionalUsd(valuation.getNotionalUsd())
                .collateralUsd(valuation.getCollateralUsd())
                .pnlUsd(valuation.getPnlUsd().toString())
                .borrowFee(valuation.getBorrowFee())
                .closeFeeMbp(valuation.getCloseFeeMbp())
                .costsUsd(valuation.getCostsUsd())
                .fundingUsd(valuation.getFundingUsd().toString())
                .remainingUsd(valuation.getRemainingUsd().toString())
                .maintenanceMarginUsd(valuation.getMaintenanceMarginUsd())
                .liquidatable(valuation.isLiquidated())
                .build();
    }
}
