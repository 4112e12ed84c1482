package dustin.perp.domains.engine.market;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;
import dustin.perp.domains.engine.liquidation.UnsettledReceipt;
import dustin.perp.domains.engine.math.EngineMath;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * 마켓 (LP 토큰 + 기준 통화 단위)
 * Market keyed by (LP token, quote token)
 *
 * 역할:
 * - 심볼 마켓 목록 (추가 순서 유지)
 * - 활성 플래그, 프로토콜 수수료 비율(bp), 프로토콜 수수료 금고
 * - 옵션 담보 미정산 receipt 보관 목록
 */
@Getter
public class Market {

    private final long marketIndex;
    private final String lpToken;
    private final String quoteToken;
    @Setter
    private boolean active;
    @Setter
    private long protocolFeeShareBp;
    @Getter(AccessLevel.NONE)
    private final LinkedHashMap<String, SymbolMarket> symbols;
    @Getter(AccessLevel.NONE)
    private final LinkedHashMap<String, Long> protocolFees;
    private final List<UnsettledReceipt> unsettledReceipts;
    @Getter(AccessLevel.NONE)
    private long nextEscrowId;

    public Market(long marketIndex, String lpToken, String quoteToken, long protocolFeeShareBp) {
        this.marketIndex = marketIndex;
        this.lpToken = lpToken;
        this.quoteToken = quoteToken;
        this.active = true;
        this.protocolFeeShareBp = protocolFeeShareBp;
        this.symbols = new LinkedHashMap<>();
        this.protocolFees = new LinkedHashMap<>();
        this.unsettledReceipts = new ArrayList<>();
        this.nextEscrowId = 0;
    }

    public SymbolMarket symbol(String baseToken) {
        SymbolMarket symbolMarket = symbols.get(baseToken);
        if (symbolMarket == null) {
            throw new EngineException(ErrorCode.SYMBOL_NOT_FOUND, "Symbol not found: " + lpToken + "/" + baseToken);
        }
        return symbolMarket;
    }

    public boolean hasSymbol(String baseToken) {
        return symbols.containsKey(baseToken);
    }

    public void addSymbol(SymbolMarket symbolMarket) {
        symbols.put(symbolMarket.getBaseToken(), symbolMarket);
    }

    public void removeSymbol(String baseToken) {
        symbols.remove(baseToken);
    }

    public List<SymbolMarket> symbolMarkets() {
        return new ArrayList<>(symbols.values());
    }

    /**
     * 프로토콜 몫 적립
     */
    public void accrueProtocolFee(String token, long amount) {
        if (amount == 0) {
            return;
        }
        protocolFees.merge(token, amount, EngineMath::addExact);
    }

    /**
     * 프로토콜 수수료 전액 인출
     *
     * @return 인출된 금액
     */
    public long takeProtocolFee(String token) {
        Long amount = protocolFees.remove(token);
        return amount == null ? 0L : amount;
    }

    public long protocolFee(String token) {
        return protocolFees.getOrDefault(token, 0L);
    }

    public Map<String, Long> getProtocolFees() {
        return new LinkedHashMap<>(protocolFees);
    }

    public long takeNextEscrowId() {
        return nextEscrowId++;
    }

    public Market copy() {
        Market copy = metadataCopy();
        symbols.forEach((symbol, market) -> copy.symbols.put(symbol, market.copy()));
        return copy;
    }

    /**
     * 트랜잭션 checkpoint용 복사: 마켓 상태 + 지정 심볼만 깊은 복사, 나머지 심볼은 참조 공유
     *
     * @param baseToken 깊은 복사할 심볼 (null이면 심볼 목록만 보관)
     */
    public Market checkpointCopy(String baseToken) {
        Market copy = metadataCopy();
        symbols.forEach((symbol, market) -> copy.symbols.put(symbol,
                symbol.equals(baseToken) ? market.copy() : market));
        return copy;
    }

    private Market metadataCopy() {
        Market copy = new Market(marketIndex, lpToken, quoteToken, protocolFeeShareBp);
        copy.active = active;
        copy.nextEscrowId = nextEscrowId;
        copy.protocolFees.putAll(protocolFees);
        unsettledReceipts.forEach(receipt -> copy.unsettledReceipts.add(receipt.copy()));
        return copy;
    }
}
