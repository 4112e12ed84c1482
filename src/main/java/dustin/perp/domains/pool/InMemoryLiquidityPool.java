// =====================================================
// InMemoryLiquidityPool - 메모리 기반 유동성 풀
// =====================================================
// 역할: LP 토큰 하나에 속한 담보 토큰별 유동성/준비금/차입 이자율 관리
//
// 자료구조:
// 1. LinkedHashMap<String, TokenPool>
//    - 토큰 → 유동성, 준비금, 가격(TVL 계산용), 차입 이자율 인덱스
//
// 차입 이자율:
// - 구간(borrowIntervalMs)마다 borrowRatePerInterval(1e9 스케일)만큼 누적
// - 조회 시 경과한 구간만큼 누적 후 반환
//
// 불변식:
// - reservedAmount <= liquidityAmount
// - tvlUsd = Σ 토큰 유동성 USD 가치 (마지막 갱신 가격 기준)
// =====================================================

package dustin.perp.domains.pool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import dustin.perp.domains.engine.TransactionScope;
import dustin.perp.domains.engine.TransactionalState;
import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;
import dustin.perp.domains.engine.math.EngineMath;
import dustin.perp.domains.engine.port.LiquidityPool;
import dustin.perp.domains.engine.port.TokenPoolState;
import lombok.extern.slf4j.Slf4j;

/**
 * 메모리 기반 유동성 풀
 * In-memory liquidity pool
 */
@Slf4j
public class InMemoryLiquidityPool implements LiquidityPool, TransactionalState {

    private final String lpToken;
    private boolean active = true;
    private LinkedHashMap<String, TokenPool> tokens = new LinkedHashMap<>();

    public InMemoryLiquidityPool(String lpToken) {
        this.lpToken = lpToken;
    }

    // ============================================
    // 관리
    // ============================================

    public synchronized void addToken(String token, int decimal, String oracleId, long borrowRatePerInterval,
                                      long borrowIntervalMs, long nowMs) {
        if (tokens.containsKey(token)) {
            throw new EngineException(ErrorCode.INVALID_ARGUMENT, "Token already in pool: " + token);
        }
        if (borrowIntervalMs <= 0 || borrowRatePerInterval < 0) {
            throw new EngineException(ErrorCode.INVALID_ARGUMENT, "Borrow interval must be positive and rate non-negative");
        }
        TokenPool pool = new TokenPool();
        pool.token = token;
        pool.decimal = decimal;
        pool.oracleId = oracleId;
        pool.active = true;
        pool.borrowRatePerInterval = borrowRatePerInterval;
        pool.borrowIntervalMs = borrowIntervalMs;
        pool.lastBorrowTs = nowMs / borrowIntervalMs * borrowIntervalMs;
        tokens.put(token, pool);
        log.info("[InMemoryLiquidityPool] 토큰 추가: lpToken={}, token={}, decimal={}, oracleId={}",
                lpToken, token, decimal, oracleId);
    }

    /**
     * LP 유동성 공급
     */
    public synchronized void provideLiquidity(String token, long amount) {
        TokenPool pool = token(token);
        pool.liquidityAmount = EngineMath.addExact(pool.liquidityAmount, amount);
    }

    /**
     * TVL 계산용 토큰 가격 갱신
     */
    public synchronized void updateTokenPrice(String token, long price, int priceDecimal) {
        TokenPool pool = token(token);
        pool.price = price;
        pool.priceDecimal = priceDecimal;
    }

    public synchronized void setActive(boolean active) {
        this.active = active;
    }

    public synchronized void setTokenActive(String token, boolean active) {
        token(token).active = active;
    }

    public synchronized long collectedFees(String token) {
        return token(token).collectedFees;
    }

    // ============================================
    // LiquidityPool
    // ============================================

    @Override
    public String getLpToken() {
        return lpToken;
    }

    @Override
    public synchronized List<String> tokens() {
        return new ArrayList<>(tokens.keySet());
    }

    @Override
    public synchronized boolean isActive() {
        return active;
    }

    @Override
    public synchronized boolean hasToken(String token) {
        return tokens.containsKey(token);
    }

    @Override
    public synchronized boolean isTokenActive(String token) {
        TokenPool pool = tokens.get(token);
        return pool != null && pool.active;
    }

    @Override
    public synchronized int tokenDecimal(String token) {
        return token(token).decimal;
    }

    @Override
    public synchronized String tokenOracleId(String token) {
        return token(token).oracleId;
    }

    @Override
    public synchronized TokenPoolState tokenState(String token) {
        TokenPool pool = token(token);
        return new TokenPoolState(pool.liquidityAmount, pool.tvlUsd(), pool.reservedAmount);
    }

    @Override
    public synchronized long tvlUsd() {
        long total = 0;
        for (TokenPool pool : tokens.values()) {
            total = EngineMath.saturatingAdd(total, pool.tvlUsd());
        }
        return total;
    }

    @Override
    public synchronized long cumulativeBorrowRate(String token, long nowMs) {
        TokenPool pool = token(token);
        long intervals = (nowMs - pool.lastBorrowTs) / pool.borrowIntervalMs;
        if (intervals > 0) {
            pool.cumulativeBorrowRate = EngineMath.addExact(pool.cumulativeBorrowRate,
                    EngineMath.mulDiv(pool.borrowRatePerInterval, intervals, 1L));
            pool.lastBorrowTs += intervals * pool.borrowIntervalMs;
        }
        return pool.cumulativeBorrowRate;
    }

    @Override
    public synchronized void updateReserveAmount(String token, boolean increase, long amount) {
        TokenPool pool = token(token);
        if (increase) {
            long reserved = EngineMath.addExact(pool.reservedAmount, amount);
            if (reserved > pool.liquidityAmount) {
                throw new EngineException(ErrorCode.INSUFFICIENT_RESERVE,
                        "Reserve " + reserved + " exceeds liquidity " + pool.liquidityAmount + " of " + token);
            }
            pool.reservedAmount = reserved;
        } else {
            pool.reservedAmount = EngineMath.subExact(pool.reservedAmount, amount);
        }
    }

    @Override
    public synchronized void putCollateral(String token, long amount) {
        TokenPool pool = token(token);
        pool.liquidityAmount = EngineMath.addExact(pool.liquidityAmount, amount);
    }

    @Override
    public synchronized void requestCollateral(String token, long amount) {
        TokenPool pool = token(token);
        if (amount > pool.liquidityAmount) {
            throw new EngineException(ErrorCode.INSUFFICIENT_LIQUIDITY,
                    "Requested " + amount + " exceeds liquidity " + pool.liquidityAmount + " of " + token);
        }
        pool.liquidityAmount -= amount;
    }

    @Override
    public synchronized void orderFilled(String token, long tradingFee) {
        TokenPool pool = token(token);
        pool.liquidityAmount = EngineMath.addExact(pool.liquidityAmount, tradingFee);
        pool.collectedFees = EngineMath.addExact(pool.collectedFees, tradingFee);
    }

    /**
     * 작업 범위가 이 풀의 마켓일 때만 토큰 상태 보관
     */
    @Override
    public synchronized Runnable checkpoint(TransactionScope scope) {
        if (!scope.coversMarket(lpToken)) {
            return () -> { };
        }
        LinkedHashMap<String, TokenPool> saved = new LinkedHashMap<>();
        tokens.forEach((token, pool) -> saved.put(token, pool.copy()));
        boolean savedActive = active;
        return () -> {
            synchronized (this) {
                tokens = saved;
                active = savedActive;
            }
        };
    }

    private TokenPool token(String token) {
        TokenPool pool = tokens.get(token);
        if (pool == null) {
            throw new EngineException(ErrorCode.COLLATERAL_TOKEN_MISMATCH, "Token is not in pool " + lpToken + ": " + token);
        }
        return pool;
    }

    private static final class TokenPool {
        String token;
        int decimal;
        String oracleId;
        boolean active;
        long liquidityAmount;
        long reservedAmount;
        long collectedFees;
        long price;
        int priceDecimal;
        long borrowRatePerInterval;
        long borrowIntervalMs;
        long cumulativeBorrowRate;
        long lastBorrowTs;

        long tvlUsd() {
            if (price == 0) {
                return 0L;
            }
            return EngineMath.amountToUsdSaturating(liquidityAmount, decimal, price, priceDecimal);
        }

        TokenPool copy() {
            TokenPool copy = new TokenPool();
            copy.token = token;
            copy.decimal = decimal;
            copy.oracleId = oracleId;
            copy.active = active;
            copy.liquidityAmount = liquidityAmount;
            copy.reservedAmount = reservedAmount;
            copy.collectedFees = collectedFees;
            copy.price = price;
            copy.priceDecimal = priceDecimal;
            copy.borrowRatePerInterval = borrowRatePerInterval;
            copy.borrowIntervalMs = borrowIntervalMs;
            copy.cumulativeBorrowRate = cumulativeBorrowRate;
            copy.lastBorrowTs = lastBorrowTs;
            return copy;
        }
    }
}
