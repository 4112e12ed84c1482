package dustin.perp.domains.engine.market;

import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;
import dustin.perp.domains.engine.fee.FeeCurve;
import dustin.perp.domains.engine.math.EngineMath;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * 심볼 마켓 설정
 * Symbol market configuration
 *
 * 관리자가 변경하기 전까지 불변
 *
 * 스케일:
 * - 레버리지: mbp (1x = 10,000,000)
 * - 수수료: mbp
 * - 유지증거금률: bp
 * - 기본 펀딩 이자율: 1e9 스케일 (구간당)
 */
@Getter
@Setter
@ToString
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MarketConfig {

    private String oracleId;

    private long maxLeverageMbp;
    private long optionCollateralMaxLeverageMbp;

    private long minSize;
    private long lotSize;

    private long baseTradingFeeMbp;
    private long maxTradingFeeMbp;
    private long allocatedExposureMbp;

    private long basicFundingRate;
    private long fundingIntervalMs;

    private long maintenanceMarginBp;
    private long optionMaintenanceMarginBp;

    private long maxOpenInterest;

    public FeeCurve feeCurve() {
        return new FeeCurve(baseTradingFeeMbp, maxTradingFeeMbp, allocatedExposureMbp);
    }

    public long maxLeverageMbp(boolean optionCollateral) {
        return optionCollateral ? optionCollateralMaxLeverageMbp : maxLeverageMbp;
    }

    public long maintenanceMarginBp(boolean optionCollateral) {
        return optionCollateral ? optionMaintenanceMarginBp : maintenanceMarginBp;
    }

    /**
     * 설정 값 검증
     *
     * @throws EngineException INVALID_ARGUMENT
     */
    public void validate() {
        if (oracleId == null || oracleId.isBlank()) {
            throw invalid("oracleId is required");
        }
        if (lotSize <= 0 || minSize <= 0) {
            throw invalid("minSize and lotSize must be positive");
        }
        if (maxLeverageMbp <= 0 || optionCollateralMaxLeverageMbp <= 0) {
            throw invalid("leverage caps must be positive");
        }
        if (baseTradingFeeMbp < 0 || maxTradingFeeMbp < baseTradingFeeMbp || maxTradingFeeMbp > EngineMath.MBP_SCALE) {
            throw invalid("fee curve must satisfy 0 <= base <= max <= 100%");
        }
        if (allocatedExposureMbp < 0) {
            throw invalid("allocatedExposureMbp must not be negative");
        }
        if (fundingIntervalMs <= 0 || basicFundingRate < 0) {
            throw invalid("funding interval must be positive and rate non-negative");
        }
        if (maintenanceMarginBp <= 0 || maintenanceMarginBp > EngineMath.BP_SCALE
                || optionMaintenanceMarginBp <= 0 || optionMaintenanceMarginBp > EngineMath.BP_SCALE) {
            throw invalid("maintenance margin must be within (0, 10000] bp");
        }
        if (maxOpenInterest <= 0) {
            throw invalid("maxOpenInterest must be positive");
        }
    }

    private static EngineException invalid(String message) {
        return new EngineException(ErrorCode.INVALID_ARGUMENT, "Invalid market config: " + message);
    }

    public MarketConfig copy() {
        return toBuilder().build();
    }
}
