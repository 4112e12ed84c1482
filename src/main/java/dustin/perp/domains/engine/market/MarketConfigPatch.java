package dustin.perp.domains.engine.market;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 심볼 설정 부분 변경 (null 필드는 유지)
 * Partial update of a symbol market configuration
 */
@Getter
@Builder
@ToString
public class MarketConfigPatch {

    private final String oracleId;
    private final Long maxLeverageMbp;
    private final Long optionCollateralMaxLeverageMbp;
    private final Long minSize;
    private final Long lotSize;
    private final Long baseTradingFeeMbp;
    private final Long maxTradingFeeMbp;
    private final Long allocatedExposureMbp;
    private final Long basicFundingRate;
    private final Long fundingIntervalMs;
    private final Long maintenanceMarginBp;
    private final Long optionMaintenanceMarginBp;
    private final Long maxOpenInterest;

    /**
     * 변경을 적용한 새 설정 (원본은 변경하지 않음)
     */
    public MarketConfig applyTo(MarketConfig current) {
        MarketConfig.MarketConfigBuilder builder = current.toBuilder();
        if (oracleId != null) {
            builder.oracleId(oracleId);
        }
        if (maxLeverageMbp != null) {
            builder.maxLeverageMbp(maxLeverageMbp);
        }
        if (optionCollateralMaxLeverageMbp != null) {
            builder.optionCollateralMaxLeverageMbp(optionCollateralMaxLeverageMbp);
        }
        if (minSize != null) {
            builder.minSize(minSize);
        }
        if (lotSize != null) {
            builder.lotSize(lotSize);
        }
        if (baseTradingFeeMbp != null) {
            builder.baseTradingFeeMbp(baseTradingFeeMbp);
        }
        if (maxTradingFeeMbp != null) {
            builder.maxTradingFeeMbp(maxTradingFeeMbp);
        }
        if (allocatedExposureMbp != null) {
            builder.allocatedExposureMbp(allocatedExposureMbp);
        }
        if (basicFundingRate != null) {
            builder.basicFundingRate(basicFundingRate);
        }
        if (fundingIntervalMs != null) {
            builder.fundingIntervalMs(fundingIntervalMs);
        }
        if (maintenanceMarginBp != null) {
            builder.maintenanceMarginBp(maintenanceMarginBp);
        }
        if (optionMaintenanceMarginBp != null) {
            builder.optionMaintenanceMarginBp(optionMaintenanceMarginBp);
        }
        if (maxOpenInterest != null) {
            builder.maxOpenInterest(maxOpenInterest);
        }
        return builder.build();
    }
}
