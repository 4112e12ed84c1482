package dustin.perp.domains.admin.service;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import dustin.perp.domains.admin.model.dto.AddSymbolRequest;
import dustin.perp.domains.admin.model.dto.CollateralTokenRequest;
import dustin.perp.domains.admin.model.dto.CreateMarketRequest;
import dustin.perp.domains.admin.model.dto.MarketResponse;
import dustin.perp.domains.admin.model.dto.OraclePriceRequest;
import dustin.perp.domains.admin.model.dto.SymbolResponse;
import dustin.perp.domains.admin.model.dto.UpdateSymbolConfigRequest;
import dustin.perp.domains.admin.model.dto.VaultRequest;
import dustin.perp.domains.engine.PerpEngine;
import dustin.perp.domains.engine.access.AccessControl;
import dustin.perp.domains.engine.access.Role;
import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;
import dustin.perp.domains.engine.order.OrderBucket;
import dustin.perp.domains.engine.port.BidReceipt;
import dustin.perp.domains.engine.port.LiquidityPool;
import dustin.perp.domains.oracle.ManualOracle;
import dustin.perp.domains.oracle.OracleRegistry;
import dustin.perp.domains.pool.InMemoryLiquidityPool;
import dustin.perp.domains.vault.InMemoryOptionVault;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 마켓 관리 서비스
 * Market Admin Service
 *
 * 역할:
 * - 마켓/심볼 생명주기: 생성, 설정 변경, 중지/재개, 제거
 * - 프로토콜 수수료 비율 변경, 수수료 인출
 * - 역할 부여/회수, 관리자 강제 주문 취소
 * - 외부 협력자 관리: 유동성 풀, 오라클 가격 입력, 옵션 볼트
 *
 * 권한:
 * - 모든 작업은 관리자 전용
 * - 엔진 작업은 엔진이 역할을 검사하고, 엔진 밖 협력자 변경은 여기서 검사
 *
 * 주의사항:
 * - 풀/볼트 변경은 PerpEngine.runExclusive로 엔진 작업과 직렬화
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketAdminService {

    private final PerpEngine perpEngine;
    private final OracleRegistry oracleRegistry;
    private final InMemoryOptionVault optionVault;
    private final Clock engineClock;

    // ============================================
    // 마켓 / 심볼
    // ============================================

    /**
     * 마켓 생성
     * Create Market
     *
     * 처리 과정:
     * 1. 관리자 확인, 중복 마켓 확인
     * 2. 담보 토큰 오라클 등록
     * 3. 유동성 풀 생성 (토큰 추가, 초기 유동성)
     * 4. 엔진에 풀 등록 후 마켓 생성
     */
    public MarketResponse createMarket(String caller, CreateMarketRequest request) {
        requireAdmin(caller);
        if (perpEngine.marketTokens().contains(request.getLpToken())) {
            throw new EngineException(ErrorCode.MARKET_ALREADY_EXISTS, "Market already exists: " + request.getLpToken());
        }

        long now = engineClock.millis();
        InMemoryLiquidityPool pool = new InMemoryLiquidityPool(request.getLpToken());
        for (CollateralTokenRequest token : request.getTokens()) {
            oracleRegistry.register(token.getOracleId(), token.getOracleDecimal());
            pool.addToken(token.getToken(), token.getDecimal(), token.getOracleId(),
                    token.getBorrowRatePerInterval(), token.getBorrowIntervalMs(), now);
            if (token.getInitialLiquidity() > 0) {
                pool.provideLiquidity(token.getToken(), token.getInitialLiquidity());
            }
        }
        perpEngine.registerPool(pool);
        perpEngine.createMarket(caller, request.getLpToken(), request.getQuoteToken(), request.getProtocolFeeShareBp());

        log.info("[MarketAdminService] 마켓 생성 완료: lpToken={}, tokens={}", request.getLpToken(),
                request.getTokens().stream().map(CollateralTokenRequest::getToken).collect(Collectors.toList()));
        return MarketResponse.from(perpEngine.marketSnapshot(request.getLpToken()));
    }

    public SymbolResponse addSymbol(String caller, String lpToken, AddSymbolRequest request) {
        requireAdmin(caller);
        oracleRegistry.register(request.getOracleId(), request.getOracleDecimal());
        perpEngine.addSymbol(caller, lpToken, request.getBaseToken(), request.getSizeDecimal(), request.toConfig());
        return getSymbol(lpToken, request.getBaseToken());
    }

    public SymbolResponse updateSymbolConfig(String caller, String lpToken, String baseToken,
                                             UpdateSymbolConfigRequest request) {
        if (request.getOracleId() != null) {
            // 등록된 오라클만 허용
            oracleRegistry.get(request.getOracleId());
        }
        perpEngine.updateSymbolConfig(caller, lpToken, baseToken, request.toPatch());
        return getSymbol(lpToken, baseToken);
    }

    public MarketResponse setMarketActive(String caller, String lpToken, boolean active) {
        perpEngine.setMarketActive(caller, lpToken, active);
        return MarketResponse.from(perpEngine.marketSnapshot(lpToken));
    }

    public SymbolResponse setSymbolActive(String caller, String lpToken, String baseToken, boolean active) {
        perpEngine.setSymbolActive(caller, lpToken, baseToken, active);
        return getSymbol(lpToken, baseToken);
    }

    public MarketResponse updateProtocolFeeShare(String caller, String lpToken, long protocolFeeShareBp) {
        perpEngine.updateProtocolFeeShare(caller, lpToken, protocolFeeShareBp);
        return MarketResponse.from(perpEngine.marketSnapshot(lpToken));
    }

    /**
     * 프로토콜 수수료 인출 (관리자 계정 또는 응답으로 지급)
     */
    public long claimProtocolFee(String caller, String lpToken, String token) {
        return perpEngine.claimProtocolFee(caller, lpToken, token).getValue();
    }

    public void removeSymbol(String caller, String lpToken, String baseToken) {
        perpEngine.removeSymbol(caller, lpToken, baseToken);
    }

    public int forceCancelOrders(String caller, String lpToken, String baseToken, OrderBucket bucket,
                                 long triggerPrice, int maxOps) {
        int cancelled = perpEngine.forceCancelOrders(caller, lpToken, baseToken, bucket, triggerPrice, maxOps).getValue();
        log.info("[MarketAdminService] 강제 취소 완료: symbol={}/{}, bucket={}, price={}, cancelled={}",
                lpToken, baseToken, bucket, triggerPrice, cancelled);
        return cancelled;
    }

    public List<MarketResponse> getMarkets() {
        return perpEngine.marketTokens().stream()
                .map(perpEngine::marketSnapshot)
                .map(MarketResponse::from)
                .collect(Collectors.toList());
    }

    public SymbolResponse getSymbol(String lpToken, String baseToken) {
        return SymbolResponse.from(baseToken, perpEngine.symbolInfo(lpToken, baseToken),
                perpEngine.symbolConfig(lpToken, baseToken));
    }

    // ============================================
    // 역할
    // ============================================

    public void grantRole(String caller, String user, Role role) {
        perpEngine.grantRole(caller, user, role);
    }

    public void revokeRole(String caller, String user, Role role) {
        perpEngine.revokeRole(caller, user, role);
    }

    // ============================================
    // 외부 협력자 (풀, 오라클, 볼트)
    // ============================================

    public void provideLiquidity(String caller, String lpToken, String token, long amount) {
        requireAdmin(caller);
        if (amount <= 0) {
            throw new EngineException(ErrorCode.INVALID_ARGUMENT, "Liquidity amount must be positive");
        }
        InMemoryLiquidityPool pool = inMemoryPool(lpToken);
        perpEngine.runExclusive(() -> {
            pool.provideLiquidity(token, amount);
            return null;
        });
        log.info("[MarketAdminService] 유동성 공급: lpToken={}, token={}, amount={}", lpToken, token, amount);
    }

    /**
     * 오라클 가격 입력
     * Push Oracle Price
     *
     * 같은 오라클을 쓰는 풀 담보 토큰의 TVL 가격도 함께 갱신
     */
    public void pushOraclePrice(String caller, String oracleId, OraclePriceRequest request) {
        requireAdmin(caller);
        long publishedAt = request.getPublishedAtMs() != null ? request.getPublishedAtMs() : engineClock.millis();
        ManualOracle oracle = oracleRegistry.get(oracleId);
        perpEngine.runExclusive(() -> {
            oracle.update(request.getPrice(), publishedAt);
            for (String lpToken : perpEngine.marketTokens()) {
                LiquidityPool pool = perpEngine.pool(lpToken);
                if (!(pool instanceof InMemoryLiquidityPool)) {
                    continue;
                }
                for (String token : pool.tokens()) {
                    if (oracleId.equals(pool.tokenOracleId(token))) {
                        ((InMemoryLiquidityPool) pool).updateTokenPrice(token, request.getPrice(), oracle.getDecimal());
                    }
                }
            }
            return null;
        });
        log.debug("[MarketAdminService] 오라클 가격 입력: oracleId={}, price={}, publishedAt={}",
                oracleId, request.getPrice(), publishedAt);
    }

    public void createVault(String caller, VaultRequest request) {
        requireAdmin(caller);
        perpEngine.runExclusive(() -> {
            optionVault.createVault(request.getVaultIndex(), request.getBidToken(), request.getExpiryMs(),
                    request.getValuePerShare());
            return null;
        });
    }

    public void updateVaultValue(String caller, long vaultIndex, long valuePerShare) {
        requireAdmin(caller);
        perpEngine.runExclusive(() -> {
            optionVault.updateValuePerShare(vaultIndex, valuePerShare);
            return null;
        });
    }

    /**
     * bid receipt 발급 (볼트 입찰 결과를 대신함)
     */
    public BidReceipt issueReceipt(String caller, long vaultIndex, long shares) {
        requireAdmin(caller);
        return perpEngine.runExclusive(() -> optionVault.issueReceipt(vaultIndex, shares));
    }

    private InMemoryLiquidityPool inMemoryPool(String lpToken) {
        LiquidityPool pool = perpEngine.pool(lpToken);
        if (!(pool instanceof InMemoryLiquidityPool)) {
            throw new EngineException(ErrorCode.INVALID_PROCESS, "Pool " + lpToken + " is not managed by this service");
        }
        return (InMemoryLiquidityPool) pool;
    }

    private void requireAdmin(String caller) {
        AccessControl accessControl = perpEngine.getAccessControl();
        accessControl.requireAny(caller, Role.ADMIN);
    }
}
