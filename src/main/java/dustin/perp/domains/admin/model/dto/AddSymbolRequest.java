package dustin.perp.domains.admin.model.dto;

import dustin.perp.domains.engine.market.MarketConfig;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 심볼 추가 요청 DTO
 * Add Symbol Request DTO
 *
 * 스케일: 레버리지/수수료 mbp (1x = 10000000), 유지증거금 bp, 펀딩 이자율 1e9
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "심볼 추가 요청")
public class AddSymbolRequest {

    @NotBlank
    @Schema(description = "기초 자산", example = "BTC", required = true)
    private String baseToken;

    @PositiveOrZero
    @Schema(description = "수량 decimal", example = "6")
    private int sizeDecimal;

    @NotBlank
    @Schema(description = "거래 오라클 id", example = "BTC/USD", required = true)
    private String oracleId;

    @PositiveOrZero
    @Builder.Default
    @Schema(description = "오라클 가격 decimal", example = "8")
    private int oracleDecimal = 8;

    @Schema(example = "500000000")
    private long maxLeverageMbp;
    @Schema(example = "100000000")
    private long optionCollateralMaxLeverageMbp;
    @Schema(example = "1000")
    private long minSize;
    @Schema(example = "1000")
    private long lotSize;
    @Schema(example = "10000")
    private long baseTradingFeeMbp;
    @Schema(example = "100000")
    private long maxTradingFeeMbp;
    @Schema(example = "1000000")
    private long allocatedExposureMbp;
    @Schema(example = "100000")
    private long basicFundingRate;
    @Schema(example = "3600000")
    private long fundingIntervalMs;
    @Schema(example = "100")
    private long maintenanceMarginBp;
    @Schema(example = "500")
    private long optionMaintenanceMarginBp;
    @Schema(example = "1000000000000")
    private long maxOpenInterest;

    public MarketConfig toConfig() {
        return MarketConfig.builder()
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
