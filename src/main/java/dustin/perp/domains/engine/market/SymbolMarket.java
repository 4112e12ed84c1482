package dustin.perp.domains.engine.market;

import dustin.perp.domains.engine.order.OrderBook;
import dustin.perp.domains.engine.position.PositionStore;
import lombok.Getter;
import lombok.Setter;

/**
 * 심볼 마켓
 * Symbol market = info + config + order book + positions
 *
 * 예시: LP 풀 "PLP" 위의 "BTC" 무기한 선물
 */
@Getter
public class SymbolMarket {

    private final String baseToken;
    private final MarketInfo info;
    @Setter
    private MarketConfig config;
    private final OrderBook orderBook;
    private final PositionStore positions;

    public SymbolMarket(String baseToken, MarketInfo info, MarketConfig config) {
        this(baseToken, info, config, new OrderBook(), new PositionStore());
    }

    private SymbolMarket(String baseToken, MarketInfo info, MarketConfig config,
                         OrderBook orderBook, PositionStore positions) {
        this.baseToken = baseToken;
        this.info = info;
        this.config = config;
        this.orderBook = orderBook;
        this.positions = positions;
    }

    public SymbolMarket copy() {
        return new SymbolMarket(baseToken, info.copy(), config.copy(), orderBook.copy(), positions.copy());
    }
}
