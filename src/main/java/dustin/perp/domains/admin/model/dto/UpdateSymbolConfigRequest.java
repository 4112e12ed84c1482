package dustin.perp.domains.admin.model.dto;

import dustin.perp.domains.engine.market.MarketConfigPatch;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 심볼 설정 부분 변경 요청 DTO
 * Update Symbol Config Request DTO
 *
 * null인 항목은 기존 값 유지
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "심볼 설정 부분 변경 (null = 유지)")
public class UpdateSymbolConfigRequest {

    private String oracleId;
    private Long maxLeverageMbp;
    private Long optionCollateralMaxLeverageMbp;
    private Long minSize;
    private Long lotSize;
    private Long baseTradingFeeMbp;
    private Long maxTradingFeeMbp;
    private Long allocatedExposureMbp;
    private Long basicFundingRate;
    private Long fundingIntervalMs;
    private Long maintenanceMarginBp;
    private Long optionMaintenanceMarginBp;
    private Long maxOpenInterest;

    public MarketConfigPatch toPatch() {
        return MarketConfigPatch.builder()
                .oracleId(oracleId)
                .maxLeverageMbp(maxLeverageMbp)
                .optionCollateralMaxLeverageMbp(optionCollateralMaxLeverageMbp)
                .minSize(minSize)
                .lotSize(lotSize)
                .baseTradingFeeMbp(baseTradingFeeMbp)
                .maxTradingFeeMbp(maxTradingFeeMbp)
                .allocatedExposureMbp(allocatedExposureMbp)
                .basicFundingRate(basicFundingRate)
                .fundingIntervalMs(fundingIntervalMs)
                .maintenanceMarginBp(maintenanceMarginBp)
                .optionMaintenanceMarginBp(optionMaintenanceMarginBp)
                .maxOpenInterest(maxOpenInterest)
                .build();
    }
}
