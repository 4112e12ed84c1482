package dustin.perp.domains.engine.market;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import dustin.perp.domains.engine.TransactionScope;
import dustin.perp.domains.engine.TransactionalState;
import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;

/**
 * 마켓 레지스트리
 * Registry of markets keyed by LP token
 *
 * checkpoint는 마켓 목록의 참조와 작업 범위의 마켓만 보관
 * (다른 마켓 객체는 변경되지 않으므로 그대로 재사용)
 */
public class MarketRegistry implements TransactionalState {

    private LinkedHashMap<String, Market> markets = new LinkedHashMap<>();
    private long nextMarketIndex;

    public Market createMarket(String lpToken, String quoteToken, long protocolFeeShareBp) {
        if (markets.containsKey(lpToken)) {
            throw new EngineException(ErrorCode.MARKET_ALREADY_EXISTS, "Market already exists: " + lpToken);
        }
        Market market = new Market(nextMarketIndex++, lpToken, quoteToken, protocolFeeShareBp);
        markets.put(lpToken, market);
        return market;
    }

    public Market market(String lpToken) {
        Market market = markets.get(lpToken);
        if (market == null) {
            throw new EngineException(ErrorCode.MARKET_NOT_FOUND, "Market not found: " + lpToken);
        }
        return market;
    }

    public boolean hasMarket(String lpToken) {
        return markets.containsKey(lpToken);
    }

    public List<Market> markets() {
        return new ArrayList<>(markets.values());
    }

    @Override
    public Runnable checkpoint(TransactionScope scope) {
        LinkedHashMap<String, Market> saved = new LinkedHashMap<>(markets);
        long savedIndex = nextMarketIndex;
        Market touched = scope.getLpToken() == null ? null : markets.get(scope.getLpToken());
        Market savedMarket = touched == null ? null : touched.checkpointCopy(scope.getBaseToken());
        return () -> {
            if (savedMarket != null) {
                saved.put(savedMarket.getLpToken(), savedMarket);
            }
            markets = saved;
            nextMarketIndex = savedIndex;
        };
    }
}
