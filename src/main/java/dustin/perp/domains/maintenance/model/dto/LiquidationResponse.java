package dustin.perp.domains.maintenance.model.dto;

import dustin.perp.domains.engine.EngineResult;
import dustin.perp.domains.engine.liquidation.LiquidationResult;
import dustin.perp.domains.trading.model.dto.PositionValuationResponse;
import dustin.perp.shared.dto.PayoutResponse;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 청산 결과 DTO
 * Liquidation Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "청산 결과")
public class LiquidationResponse {

    private Long positionId;
    private String user;
    private String liquidator;
    private String collateralToken;
    @Schema(description = "청산자 수수료 (담보 토큰, 명목가치의 1%, 담보 한도)")
    private Long liquidatorFee;
    @Schema(description = "풀로 귀속된 담보")
    private Long toPool;
    @Schema(description = "청산 직전 평가")
    private PositionValuationResponse valuation;
    private PayoutResponse payouts;

    public static LiquidationResponse from(EngineResult<LiquidationResult> result) {
        LiquidationResult liquidation = result.getValue();
        return LiquidationResponse.builder()
                .positionId(liquidation.getPositionId())
                .user(liquidation.getUser())
                .liquidator(liquidation.getLiquidator())
                .collateralToken(liquidation.getCollateralToken())
                .liquidatorFee(liquidation.getLiquidatorFee())
                .toPool(liquidation.getToPool())
                .valuation(PositionValuationResponse.from(liquidation.getValuation()))
                .payouts(PayoutResponse.from(result.getPayouts()))
                .build();
    }
}
