package dustin.perp.domains.engine.port;

import java.util.List;

/**
 * 유동성 풀
 * Liquidity pool collaborator
 *
 * 역할:
 * - 토큰별 유동성/TVL/준비금(reserve) 상태 제공
 * - 포지션 이익 지급(requestCollateral), 손실/비용 수취(putCollateral)
 * - 누적 차입 이자율 인덱스 제공
 *
 * 모든 변경은 엔진 트랜잭션 내부에서만 호출됨
 */
public interface LiquidityPool {

    String getLpToken();

    boolean isActive();

    boolean hasToken(String token);

    /**
     * 등록된 담보 토큰 목록 (등록 순서)
     */
    List<String> tokens();

    boolean isTokenActive(String token);

    int tokenDecimal(String token);

    /**
     * 토큰 가격 오라클 식별자 (담보 오라클 검증용)
     */
    String tokenOracleId(String token);

    TokenPoolState tokenState(String token);

    /**
     * 풀 전체 TVL (USD, 9 decimals)
     */
    long tvlUsd();

    /**
     * 누적 차입 이자율 인덱스 (1e9 스케일), 필요 시 경과 구간만큼 누적 후 반환
     */
    long cumulativeBorrowRate(String token, long nowMs);

    /**
     * 준비금 증감
     *
     * @throws dustin.perp.domains.engine.error.EngineException 준비금이 유동성을 넘는 경우 INSUFFICIENT_RESERVE
     */
    void updateReserveAmount(String token, boolean increase, long amount);

    /**
     * 실현 손실, 차입 비용, 펀딩 지불 등을 풀로 입금
     */
    void putCollateral(String token, long amount);

    /**
     * 실현 이익, 펀딩 수취 등을 풀에서 인출
     *
     * @throws dustin.perp.domains.engine.error.EngineException 유동성 부족 시 INSUFFICIENT_LIQUIDITY
     */
    void requestCollateral(String token, long amount);

    /**
     * 체결 수수료 수입 기록 (프로토콜 몫 제외한 금액)
     */
    void orderFilled(String token, long tradingFee);
}
