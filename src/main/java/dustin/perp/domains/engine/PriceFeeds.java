package dustin.perp.domains.engine;

import dustin.perp.domains.engine.port.Oracle;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 작업에 사용할 오라클 묶음
 * Oracles presented by the caller for one operation
 *
 * - tradingOracle: 심볼 설정의 oracleId와 일치해야 함
 * - collateralOracle: 풀의 담보 토큰 오라클과 일치해야 함 (담보를 다루지 않는 작업은 생략)
 */
@Getter
@Builder
@ToString
public class PriceFeeds {

    private final Oracle tradingOracle;
    private final Oracle collateralOracle;
    private final String collateralToken;

    public static PriceFeeds tradingOnly(Oracle tradingOracle) {
        return PriceFeeds.builder().tradingOracle(tradingOracle).build();
    }

    public boolean hasCollateral() {
        return collateralOracle != null && collateralToken != null;
    }
}
