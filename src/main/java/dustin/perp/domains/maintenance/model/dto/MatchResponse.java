package dustin.perp.domains.maintenance.model.dto;

import java.util.List;
import java.util.stream.Collectors;

import dustin.perp.domains.engine.EngineResult;
import dustin.perp.domains.engine.order.MatchResult;
import dustin.perp.domains.trading.model.dto.FillResponse;
import dustin.perp.shared.dto.PayoutResponse;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 매칭 결과 DTO
 * Match Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "가격 레벨 매칭 결과")
public class MatchResponse {

    @Schema(description = "처리한 주문 수 (작업 예산 소모량)")
    private int processed;
    @Schema(description = "다시 대기열로 돌아간 주문 수")
    private int requeued;
    private List<Long> filledOrderIds;
    @Schema(description = "연결 포지션이 사라져 담보가 반환된 주문")
    private List<Long> releasedOrderIds;
    @Schema(description = "체결 조건(한도, 담보)을 못 맞춰 재대기한 주문")
    private List<Long> blockedOrderIds;
    private List<FillResponse> fills;
    private PayoutResponse payouts;

    public static MatchResponse from(EngineResult<MatchResult> result) {
        MatchResult match = result.getValue();
        return MatchResponse.builder()
                .processed(match.getProcessed())
                .requeued(match.getRequeued())
                .filledOrderIds(match.getFilledOrderIds())
                .releasedOrderIds(match.getReleasedOrderIds())
                .blockedOrderIds(match.getBlockedOrderIds())
                .fills(match.getFills().stream().map(FillResponse::from).collect(Collectors.toList()))
                .payouts(PayoutResponse.from(result.getPayouts()))
                .build();
    }
}
