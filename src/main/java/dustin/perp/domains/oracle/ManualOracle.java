package dustin.perp.domains.oracle;

import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;
import dustin.perp.domains.engine.port.Oracle;
import dustin.perp.domains.engine.port.OraclePrice;

/**
 * 수동 가격 오라클
 * Oracle whose price is pushed by an operator
 *
 * 가격이 한 번도 갱신되지 않았거나 maxStalenessMs보다 오래되면 ORACLE_STALE
 */
public class ManualOracle implements Oracle {

    private final String id;
    private final int decimal;
    private volatile OraclePrice latest;

    public ManualOracle(String id, int decimal) {
        this.id = id;
        this.decimal = decimal;
    }

    @Override
    public String getId() {
        return id;
    }

    public int getDecimal() {
        return decimal;
    }

    /**
     * 가격 갱신
     */
    public void update(long price, long publishedAtMs) {
        if (price <= 0) {
            throw new EngineException(ErrorCode.ORACLE_INVALID_PRICE, "Oracle price must be positive: " + id);
        }
        this.latest = new OraclePrice(price, decimal, publishedAtMs);
    }

    @Override
    public OraclePrice price(long nowMs, long maxStalenessMs) {
        OraclePrice current = latest;
        if (current == null) {
            throw new EngineException(ErrorCode.ORACLE_STALE, "Oracle has no price yet: " + id);
        }
        if (nowMs - current.getPublishedAtMs() > maxStalenessMs) {
            throw new EngineException(ErrorCode.ORACLE_STALE,
                    "Oracle price of " + id + " is older than " + maxStalenessMs + " ms");
        }
        return current;
    }

    /**
     * 마지막 가격 (신선도 검사 없음, 없으면 null)
     */
    public OraclePrice latest() {
        return latest;
    }
}
