package dustin.perp.domains.maintenance.service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import dustin.perp.domains.engine.EngineResult;
import dustin.perp.domains.engine.PerpEngine;
import dustin.perp.domains.engine.PriceFeeds;
import dustin.perp.domains.engine.access.Role;
import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;
import dustin.perp.domains.engine.funding.FundingUpdate;
import dustin.perp.domains.engine.liquidation.LiquidationInfo;
import dustin.perp.domains.engine.liquidation.LiquidationResult;
import dustin.perp.domains.engine.order.MatchResult;
import dustin.perp.domains.engine.order.OrderBucket;
import dustin.perp.domains.engine.order.TradingOrder;
import dustin.perp.domains.engine.port.LiquidityPool;
import dustin.perp.domains.engine.position.Position;
import dustin.perp.domains.maintenance.model.dto.CrankReport;
import dustin.perp.domains.maintenance.model.dto.FundingResponse;
import dustin.perp.domains.maintenance.model.dto.LiquidationInfoResponse;
import dustin.perp.domains.maintenance.model.dto.LiquidationResponse;
import dustin.perp.domains.maintenance.model.dto.MatchResponse;
import dustin.perp.domains.oracle.PriceFeedResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 유지보수 서비스
 * Maintenance Service
 *
 * 역할:
 * - 펀딩 갱신, 청산, 조건부 주문 매칭, 보관 receipt 정산
 * - 전체 마켓/심볼을 순회하는 크랭크 (스케줄러, 수동 실행 공용)
 *
 * 처리 흐름 (크랭크):
 * 1. 펀딩: 모든 심볼 updateFunding (구간 전이면 no-op)
 * 2. 청산: 담보 토큰별 getLiquidationInfo → 대상 포지션 liquidate
 * 3. 매칭: 8개 버킷 × 담보 토큰별 matchTriggeredOrders (작업 예산)
 * 4. receipt 정산: 마켓별 settleUnsettledReceipts
 *
 * 주의사항:
 * - 항목 하나의 실패가 전체 크랭크를 멈추지 않음 (로깅 후 failures 집계)
 * - 엔진 작업은 각각 원자적이므로 실패한 항목은 상태 변경 없음
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MaintenanceService {

    private final PerpEngine perpEngine;
    private final PriceFeedResolver priceFeedResolver;

    // ============================================
    // 단건 작업
    // ============================================

    public FundingResponse updateFunding(String caller, String lpToken, String baseToken) {
        EngineResult<FundingUpdate> result = perpEngine.updateFunding(caller, lpToken, baseToken,
                priceFeedResolver.tradingOracle(lpToken, baseToken));
        return FundingResponse.from(result.getValue());
    }

    public LiquidationResponse liquidate(String caller, String lpToken, String baseToken, long positionId) {
        Position position = perpEngine.position(lpToken, baseToken, positionId)
                .orElseThrow(() -> new EngineException(ErrorCode.POSITION_NOT_FOUND, "Position not found: " + positionId));
        PriceFeeds feeds = priceFeedResolver.resolve(lpToken, baseToken, position.getCollateralToken());
        EngineResult<LiquidationResult> result = perpEngine.liquidate(caller, lpToken, baseToken, feeds, positionId);
        log.info("[MaintenanceService] 청산 완료: symbol={}/{}, positionId={}, liquidator={}, fee={}",
                lpToken, baseToken, positionId, caller, result.getValue().getLiquidatorFee());
        return LiquidationResponse.from(result);
    }

    /**
     * 청산 대상 조회
     *
     * @param collateralToken null이면 풀의 모든 담보 토큰
     */
    public List<LiquidationInfoResponse> getLiquidationInfo(String lpToken, String baseToken, String collateralToken,
                                                            boolean includeAll) {
        List<LiquidationInfoResponse> result = new ArrayList<>();
        for (String token : collateralTokens(lpToken, collateralToken)) {
            PriceFeeds feeds = priceFeedResolver.resolve(lpToken, baseToken, token);
            perpEngine.getLiquidationInfo(lpToken, baseToken, feeds, includeAll).stream()
                    .map(LiquidationInfoResponse::from)
                    .forEach(result::add);
        }
        return result;
    }

    public MatchResponse matchOrders(String caller, String lpToken, String baseToken, OrderBucket bucket,
                                     long triggerPrice, String collateralToken, int maxOps) {
        PriceFeeds feeds = priceFeedResolver.resolve(lpToken, baseToken, collateralToken);
        return MatchResponse.from(perpEngine.matchOrders(caller, lpToken, baseToken, feeds, bucket, triggerPrice, maxOps));
    }

    public MatchResponse matchTriggeredOrders(String caller, String lpToken, String baseToken, OrderBucket bucket,
                                              String collateralToken, int maxOps) {
        PriceFeeds feeds = priceFeedResolver.resolve(lpToken, baseToken, collateralToken);
        return MatchResponse.from(perpEngine.matchTriggeredOrders(caller, lpToken, baseToken, feeds, bucket, maxOps));
    }

    public int settleUnsettledReceipts(String caller, String lpToken, int maxOps) {
        return perpEngine.settleUnsettledReceipts(caller, lpToken, maxOps).getValue();
    }

    // ============================================
    // 전체 순회 (크랭크)
    // ============================================

    /**
     * 모든 심볼 펀딩 갱신
     */
    public CrankReport updateFundingForAllSymbols(String operator) {
        CrankReport report = new CrankReport();
        for (String lpToken : perpEngine.marketTokens()) {
            for (String baseToken : perpEngine.symbols(lpToken)) {
                try {
                    FundingResponse funding = updateFunding(operator, lpToken, baseToken);
                    if (funding.isUpdated()) {
                        report.setFundingUpdated(report.getFundingUpdated() + 1);
                        log.info("[MaintenanceService] 펀딩 갱신: symbol={}/{}, intervals={}, index={}",
                                lpToken, baseToken, funding.getIntervals(), funding.getCurrentIndex());
                    }
                } catch (Exception e) {
                    report.setFailures(report.getFailures() + 1);
                    log.error("[MaintenanceService] 펀딩 갱신 실패: symbol={}/{}, error={}", lpToken, baseToken, e.getMessage());
                }
            }
        }
        return report;
    }

    /**
     * 청산 대상 스캔 후 청산
     */
    public CrankReport liquidateAll(String operator) {
        CrankReport report = new CrankReport();
        for (String lpToken : perpEngine.marketTokens()) {
            for (String baseToken : perpEngine.symbols(lpToken)) {
                for (String token : collateralTokens(lpToken, null)) {
                    List<LiquidationInfo> targets;
                    try {
                        targets = perpEngine.getLiquidationInfo(lpToken, baseToken,
                                priceFeedResolver.resolve(lpToken, baseToken, token), false);
                    } catch (Exception e) {
                        report.setFailures(report.getFailures() + 1);
                        log.error("[MaintenanceService] 청산 대상 조회 실패: symbol={}/{}, token={}, error={}",
                                lpToken, baseToken, token, e.getMessage());
                        continue;
                    }
                    for (LiquidationInfo target : targets) {
                        try {
                            liquidate(operator, lpToken, baseToken, target.getPositionId());
                            report.setLiquidated(report.getLiquidated() + 1);
                        } catch (EngineException e) {
                            // 조회 이후 가격/담보가 바뀌어 건전해진 경우 포함
                            report.setFailures(report.getFailures() + 1);
                            log.warn("[MaintenanceService] 청산 거부: positionId={}, code={}, error={}",
                                    target.getPositionId(), e.getCode(), e.getMessage());
                        }
                    }
                }
            }
        }
        return report;
    }

    /**
     * 발동된 조건부 주문 매칭 (버킷 × 담보 토큰)
     *
     * 매칭은 담보 토큰 하나의 오라클로 실행되므로 버킷에 대기 중인 담보 토큰마다 호출
     */
    public CrankReport matchAllTriggered(String operator, int maxOps) {
        CrankReport report = new CrankReport();
        for (String lpToken : perpEngine.marketTokens()) {
            for (String baseToken : perpEngine.symbols(lpToken)) {
                for (OrderBucket bucket : OrderBucket.values()) {
                    List<String> tokens = perpEngine.orders(lpToken, baseToken, bucket).stream()
                            .map(TradingOrder::getCollateralToken)
                            .distinct()
                            .collect(Collectors.toList());
                    for (String token : tokens) {
                        try {
                            EngineResult<MatchResult> result = perpEngine.matchTriggeredOrders(operator, lpToken, baseToken,
                                    priceFeedResolver.resolve(lpToken, baseToken, token), bucket, maxOps);
                            report.setOrdersFilled(report.getOrdersFilled() + result.getValue().filledCount());
                            report.setOrdersReleased(report.getOrdersReleased() + result.getValue().getReleasedOrderIds().size());
                        } catch (Exception e) {
                            report.setFailures(report.getFailures() + 1);
                            log.error("[MaintenanceService] 주문 매칭 실패: symbol={}/{}, bucket={}, token={}, error={}",
                                    lpToken, baseToken, bucket, token, e.getMessage());
                        }
                    }
                }
            }
        }
        return report;
    }

    public CrankReport settleAllReceipts(String operator, int maxOps) {
        CrankReport report = new CrankReport();
        for (String lpToken : perpEngine.marketTokens()) {
            if (perpEngine.unsettledReceipts(lpToken).isEmpty()) {
                continue;
            }
            try {
                report.setReceiptsSettled(report.getReceiptsSettled() + settleUnsettledReceipts(operator, lpToken, maxOps));
            } catch (Exception e) {
                report.setFailures(report.getFailures() + 1);
                log.error("[MaintenanceService] receipt 정산 실패: market={}, error={}", lpToken, e.getMessage());
            }
        }
        return report;
    }

    public void requireCranker(String caller) {
        perpEngine.getAccessControl().requireAny(caller, Role.CRANKER, Role.ADMIN);
    }

    /**
     * 전체 크랭크 (비동기, 수동 실행용)
     * Full crank on the maintenance executor
     */
    @Async("maintenanceExecutor")
    public CompletableFuture<CrankReport> runFullCrank(String operator, int maxOps) {
        log.info("[MaintenanceService] 전체 크랭크 시작: operator={}, maxOps={}", operator, maxOps);
        CrankReport report = new CrankReport();
        report.merge(updateFundingForAllSymbols(operator));
        report.merge(liquidateAll(operator));
        report.merge(matchAllTriggered(operator, maxOps));
        report.merge(settleAllReceipts(operator, maxOps));
        log.info("[MaintenanceService] 전체 크랭크 완료: report={}", report);
        return CompletableFuture.completedFuture(report);
    }

    private List<String> collateralTokens(String lpToken, String collateralToken) {
        if (collateralToken != null) {
            return List.of(collateralToken);
        }
        LiquidityPool pool = perpEngine.pool(lpToken);
        return pool.tokens();
    }
}
