package dustin.perp.domains.engine.port;

/**
 * 토큰별 풀 상태 스냅샷
 * Per-token pool state: [liquidity, tvl component, reserved]
 */
public final class TokenPoolState {

    private final long liquidityAmount;
    private final long tvlUsd;
    private final long reservedAmount;

    public TokenPoolState(long liquidityAmount, long tvlUsd, long reservedAmount) {
        this.liquidityAmount = liquidityAmount;
        this.tvlUsd = tvlUsd;
        this.reservedAmount = reservedAmount;
    }

    public long getLiquidityAmount() {
        return liquidityAmount;
    }

    public long getTvlUsd() {
        return tvlUsd;
    }

    public long getReservedAmount() {
        return reservedAmount;
    }

    /**
     * 아직 준비금으로 묶이지 않은 유동성
     */
    public long freeLiquidity() {
        return Math.max(0L, liquidityAmount - reservedAmount);
    }
}
