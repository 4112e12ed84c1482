package dustin.perp.domains.maintenance.controller;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import dustin.perp.domains.engine.order.OrderBucket;
import dustin.perp.domains.maintenance.model.dto.CrankReport;
import dustin.perp.domains.maintenance.model.dto.FundingResponse;
import dustin.perp.domains.maintenance.model.dto.LiquidationInfoResponse;
import dustin.perp.domains.maintenance.model.dto.LiquidationResponse;
import dustin.perp.domains.maintenance.model.dto.MatchResponse;
import dustin.perp.domains.maintenance.service.MaintenanceService;
import dustin.perp.shared.util.EnumParser;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * 유지보수 컨트롤러
 * Maintenance Controller
 *
 * 권한:
 * - 펀딩 갱신, 청산, 청산 대상 조회: 누구나
 * - 매칭, receipt 정산, 전체 크랭크: 크랭커 또는 관리자
 *
 * API 엔드포인트:
 * - POST /api/perp/maintenance/funding - 펀딩 갱신
 * - POST /api/perp/maintenance/liquidations/{positionId} - 청산
 * - GET  /api/perp/maintenance/liquidations - 청산 대상 조회
 * - POST /api/perp/maintenance/match - 가격 레벨 매칭
 * - POST /api/perp/maintenance/match/triggered - 발동된 레벨 전체 매칭
 * - POST /api/perp/maintenance/receipts/settle - 보관 receipt 정산
 * - POST /api/perp/maintenance/crank - 전체 크랭크
 */
@RestController
@RequestMapping("/api/perp/maintenance")
@RequiredArgsConstructor
@Tag(name = "Maintenance", description = "펀딩, 청산, 매칭 크랭크 API")
public class MaintenanceController {

    private final MaintenanceService maintenanceService;

    @Operation(summary = "펀딩 갱신", description = "다음 펀딩 구간 전이면 아무것도 바뀌지 않습니다 (updated=false).")
    @PostMapping("/funding")
    public ResponseEntity<FundingResponse> updateFunding(
            @RequestHeader("X-User-Id") String userId,
            @RequestParam String lpToken,
            @RequestParam String baseToken) {
        return ResponseEntity.ok(maintenanceService.updateFunding(userId, lpToken, baseToken));
    }

    @Operation(summary = "포지션 청산", description = "유지증거금 미달 포지션을 청산하고 청산자 수수료를 받습니다.")
    @PostMapping("/liquidations/{positionId}")
    public ResponseEntity<LiquidationResponse> liquidate(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable Long positionId,
            @RequestParam String lpToken,
            @RequestParam String baseToken) {
        return ResponseEntity.ok(maintenanceService.liquidate(userId, lpToken, baseToken, positionId));
    }

    @Operation(summary = "청산 대상 조회")
    @GetMapping("/liquidations")
    public ResponseEntity<List<LiquidationInfoResponse>> getLiquidationInfo(
            @RequestParam String lpToken,
            @RequestParam String baseToken,
            @Parameter(description = "담보 토큰 (생략 시 전체)") @RequestParam(required = false) String collateralToken,
            @Parameter(description = "true면 건전한 포지션도 포함") @RequestParam(defaultValue = "false") boolean includeAll) {
        return ResponseEntity.ok(maintenanceService.getLiquidationInfo(lpToken, baseToken, collateralToken, includeAll));
    }

    @Operation(summary = "가격 레벨 매칭", description = "버킷의 한 가격 레벨을 LIFO 순서로 처리합니다.")
    @PostMapping("/match")
    public ResponseEntity<MatchResponse> matchOrders(
            @RequestHeader("X-User-Id") String userId,
            @RequestParam String lpToken,
            @RequestParam String baseToken,
            @Parameter(description = "버킷 (예: TOKEN_LIMIT_BUY)") @RequestParam String bucket,
            @RequestParam Long triggerPrice,
            @RequestParam String collateralToken,
            @RequestParam(defaultValue = "50") int maxOps) {
        return ResponseEntity.ok(maintenanceService.matchOrders(userId, lpToken, baseToken,
                EnumParser.parse(OrderBucket.class, bucket, "bucket"), triggerPrice, collateralToken, maxOps));
    }

    @Operation(summary = "발동된 레벨 전체 매칭")
    @PostMapping("/match/triggered")
    public ResponseEntity<MatchResponse> matchTriggeredOrders(
            @RequestHeader("X-User-Id") String userId,
            @RequestParam String lpToken,
            @RequestParam String baseToken,
            @RequestParam String bucket,
            @RequestParam String collateralToken,
            @RequestParam(defaultValue = "50") int maxOps) {
        return ResponseEntity.ok(maintenanceService.matchTriggeredOrders(userId, lpToken, baseToken,
                EnumParser.parse(OrderBucket.class, bucket, "bucket"), collateralToken, maxOps));
    }

    @Operation(summary = "보관 receipt 정산", description = "모든 receipt가 만기된 보관 기록을 정산합니다.")
    @PostMapping("/receipts/settle")
    public ResponseEntity<Integer> settleUnsettledReceipts(
            @RequestHeader("X-User-Id") String userId,
            @RequestParam String lpToken,
            @RequestParam(defaultValue = "50") int maxOps) {
        return ResponseEntity.ok(maintenanceService.settleUnsettledReceipts(userId, lpToken, maxOps));
    }

    @Operation(summary = "전체 크랭크", description = "펀딩, 청산, 매칭, receipt 정산을 순서대로 실행합니다.")
    @PostMapping("/crank")
    public CompletableFuture<ResponseEntity<CrankReport>> runFullCrank(
            @RequestHeader("X-User-Id") String userId,
            @RequestParam(defaultValue = "50") int maxOps) {
        maintenanceService.requireCranker(userId);
        return maintenanceService.runFullCrank(userId, maxOps).thenApply(ResponseEntity::ok);
    }
}
