package dustin.perp.domains.engine;

import lombok.Getter;
import lombok.ToString;

/**
 * 트랜잭션 범위
 * Part of the engine state an operation may change
 *
 * - lpToken == null: 마켓/풀 상태를 변경하지 않음 (역할 변경 등)
 * - baseToken == null: 마켓 자체 상태와 심볼 목록만 변경 (심볼 내부는 그대로)
 */
@Getter
@ToString
public final class TransactionScope {

    private static final TransactionScope NONE = new TransactionScope(null, null);

    private final String lpToken;
    private final String baseToken;

    private TransactionScope(String lpToken, String baseToken) {
        this.lpToken = lpToken;
        this.baseToken = baseToken;
    }

    public static TransactionScope none() {
        return NONE;
    }

    public static TransactionScope market(String lpToken) {
        return new TransactionScope(lpToken, null);
    }

    public static TransactionScope symbol(String lpToken, String baseToken) {
        return new TransactionScope(lpToken, baseToken);
    }

    public boolean coversMarket(String lpToken) {
        return this.lpToken != null && this.lpToken.equals(lpToken);
    }

    public boolean coversSymbol(String lpToken, String baseToken) {
        return coversMarket(lpToken) && this.baseToken != null && this.baseToken.equals(baseToken);
    }
}
