package dustin.perp.domains.oracle;

import org.springframework.stereotype.Component;

import dustin.perp.domains.engine.PerpEngine;
import dustin.perp.domains.engine.PriceFeeds;
import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;
import dustin.perp.domains.engine.port.LiquidityPool;
import dustin.perp.domains.engine.port.Oracle;
import lombok.RequiredArgsConstructor;

/**
 * 가격 피드 조회
 * Resolves the oracle pair an engine call needs
 *
 * - 거래 오라클: 심볼 설정의 oracleId
 * - 담보 오라클: 풀에 등록된 담보 토큰의 oracleId
 */
@Component
@RequiredArgsConstructor
public class PriceFeedResolver {

    private final PerpEngine perpEngine;
    private final OracleRegistry oracleRegistry;

    public PriceFeeds resolve(String lpToken, String baseToken, String collateralToken) {
        LiquidityPool pool = perpEngine.pool(lpToken);
        if (collateralToken == null || !pool.hasToken(collateralToken)) {
            throw new EngineException(ErrorCode.COLLATERAL_TOKEN_MISMATCH,
                    "Token is not a pool collateral: " + collateralToken);
        }
        return PriceFeeds.builder()
                .tradingOracle(tradingOracle(lpToken, baseToken))
                .collateralOracle(oracleRegistry.get(pool.tokenOracleId(collateralToken)))
                .collateralToken(collateralToken)
                .build();
    }

    public Oracle tradingOracle(String lpToken, String baseToken) {
        return oracleRegistry.get(perpEngine.symbolConfig(lpToken, baseToken).getOracleId());
    }
}
