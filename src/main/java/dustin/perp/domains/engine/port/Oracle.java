package dustin.perp.domains.engine.port;

/**
 * 가격 오라클
 * Price oracle collaborator
 *
 * 엔진은 오라클 식별자를 마켓 설정/풀 토큰 설정과 대조한 뒤 가격을 사용함
 */
public interface Oracle {

    /**
     * 오라클 식별자
     */
    String getId();

    /**
     * 현재 가격 조회
     *
     * @param nowMs 현재 시각 (ms)
     * @param maxStalenessMs 허용되는 최대 가격 나이 (ms)
     * @return 가격과 소수점 자리수
     * @throws dustin.perp.domains.engine.error.EngineException ORACLE_STALE, ORACLE_INVALID_PRICE
     */
    OraclePrice price(long nowMs, long maxStalenessMs);
}
