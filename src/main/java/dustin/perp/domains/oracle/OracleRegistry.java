package dustin.perp.domains.oracle;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;
import lombok.extern.slf4j.Slf4j;

/**
 * 오라클 레지스트리
 * Oracle registry keyed by oracle id
 */
@Slf4j
public class OracleRegistry {

    private final ConcurrentHashMap<String, ManualOracle> oracles = new ConcurrentHashMap<>();

    public ManualOracle register(String oracleId, int decimal) {
        ManualOracle oracle = oracles.computeIfAbsent(oracleId, id -> new ManualOracle(id, decimal));
        if (oracle.getDecimal() != decimal) {
            throw new EngineException(ErrorCode.INVALID_ARGUMENT,
                    "Oracle " + oracleId + " already registered with decimal " + oracle.getDecimal());
        }
        return oracle;
    }

    public ManualOracle get(String oracleId) {
        ManualOracle oracle = oracles.get(oracleId);
        if (oracle == null) {
            throw new EngineException(ErrorCode.ORACLE_MISMATCH, "Oracle not registered: " + oracleId);
        }
        return oracle;
    }

    public void push(String oracleId, long price, long publishedAtMs) {
        get(oracleId).update(price, publishedAtMs);
        log.debug("[OracleRegistry] 가격 갱신: oracleId={}, price={}, publishedAt={}", oracleId, price, publishedAtMs);
    }

    public List<ManualOracle> all() {
        return new ArrayList<>(oracles.values());
    }
}
