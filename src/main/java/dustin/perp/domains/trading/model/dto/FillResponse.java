package dustin.perp.domains.trading.model.dto;

import dustin.perp.domains.engine.position.FillOutcome;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 체결 결과 DTO
 * Fill Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "주문 체결 결과")
public class FillResponse {

    @Schema(description = "포지션 처리: OPENED, INCREASED, REDUCED, FLIPPED, CLOSED", example = "OPENED")
    private String action;
    private Long positionId;
    private Long filledSize;
    private Long fillPrice;
    @Schema(description = "적용된 거래 수수료율 (mbp)")
    private Long feeMbp;
    @Schema(description = "담보 토큰 기준 거래 수수료")
    private Long feeAmount;
    @Schema(description = "실현 손익 (USD, 9자리, 부호 포함)", example = "-1500000000")
    private String realizedPnl;

    public static FillResponse from(FillOutcome fill) {
        if (fill == null) {
            return null;
        }
        return FillResponse.builder()
                .action(fill.getAction().name())
                .positionId(fill.getPositionId())
                .filledSize(fill.getFilledSize())
                .fillPrice(fill.getFillPrice())
                .feeMbp(fill.getFeeMbp())
                .feeAmount(fill.getFeeAmount())
                .realizedPnl(fill.getRealizedPnl().toString())
                .build();
    }
}
