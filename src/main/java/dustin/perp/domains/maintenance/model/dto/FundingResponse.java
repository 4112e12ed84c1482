package dustin.perp.domains.maintenance.model.dto;

import dustin.perp.domains.engine.funding.FundingUpdate;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 펀딩 갱신 결과 DTO
 * Funding Update Response DTO
 *
 * updated=false면 아직 다음 구간 전이라 아무것도 바뀌지 않음
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "펀딩 인덱스 갱신 결과")
public class FundingResponse {

    private String symbol;
    private boolean updated;
    @Schema(description = "지난 펀딩 구간 수")
    private Long intervals;
    @Schema(description = "롱/숏 불균형 노출 (USD)")
    private Long exposureUsd;
    @Schema(description = "인덱스 증가분 (양수 = 롱이 지불)")
    private String increment;
    private String previousIndex;
    private String currentIndex;
    private Long lastFundingTs;

    public static FundingResponse from(FundingUpdate update) {
        return FundingResponse.builder()
                .symbol(update.getSymbol())
                .updated(update.isUpdated())
                .intervals(update.getIntervals())
                .exposureUsd(update.getExposureUsd())
                .increment(String.valueOf(update.getIncrement()))
                .previousIndex(String.valueOf(update.getPreviousIndex()))
                .currentIndex(String.valueOf(update.getCurrentIndex()))
                .lastFundingTs(update.getLastFundingTs())
                .build();
    }
}
