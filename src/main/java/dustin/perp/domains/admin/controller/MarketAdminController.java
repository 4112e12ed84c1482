package dustin.perp.domains.admin.controller;

import java.util.List;
import java.util.Map;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import dustin.perp.domains.admin.model.dto.AddSymbolRequest;
import dustin.perp.domains.admin.model.dto.CreateMarketRequest;
import dustin.perp.domains.admin.model.dto.MarketResponse;
import dustin.perp.domains.admin.model.dto.OraclePriceRequest;
import dustin.perp.domains.admin.model.dto.SymbolResponse;
import dustin.perp.domains.admin.model.dto.UpdateSymbolConfigRequest;
import dustin.perp.domains.admin.model.dto.VaultRequest;
import dustin.perp.domains.admin.service.MarketAdminService;
import dustin.perp.domains.engine.access.Role;
import dustin.perp.domains.engine.order.OrderBucket;
import dustin.perp.domains.engine.port.BidReceipt;
import dustin.perp.shared.util.EnumParser;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * 마켓 관리 컨트롤러
 * Market Admin Controller
 *
 * 모든 변경 API는 관리자 전용 (X-User-Id가 ADMIN 역할이어야 함)
 *
 * API 엔드포인트:
 * - GET   /api/perp/admin/markets - 마켓 목록
 * - POST  /api/perp/admin/markets - 마켓 생성
 * - PUT   /api/perp/admin/markets/{lpToken}/active - 마켓 중지/재개
 * - PUT   /api/perp/admin/markets/{lpToken}/fee-share - 프로토콜 수수료 비율
 * - POST  /api/perp/admin/markets/{lpToken}/fees/claim - 프로토콜 수수료 인출
 * - POST  /api/perp/admin/markets/{lpToken}/liquidity - 유동성 공급
 * - GET   /api/perp/admin/markets/{lpToken}/symbols/{baseToken} - 심볼 조회
 * - POST  /api/perp/admin/markets/{lpToken}/symbols - 심볼 추가
 * - PATCH /api/perp/admin/markets/{lpToken}/symbols/{baseToken} - 심볼 설정 변경
 * - PUT   /api/perp/admin/markets/{lpToken}/symbols/{baseToken}/active - 심볼 중지/재개
 * - DELETE /api/perp/admin/markets/{lpToken}/symbols/{baseToken} - 빈 심볼 제거
 * - POST  /api/perp/admin/markets/{lpToken}/symbols/{baseToken}/force-cancel - 가격 레벨 강제 취소
 * - POST  /api/perp/admin/roles - 역할 부여 / DELETE 회수
 * - POST  /api/perp/admin/oracles/{oracleId}/price - 오라클 가격 입력
 * - POST  /api/perp/admin/vaults - 옵션 볼트 생성
 * - PUT   /api/perp/admin/vaults/{vaultIndex}/value - share당 가치 갱신
 * - POST  /api/perp/admin/vaults/{vaultIndex}/receipts - bid receipt 발급
 */
@RestController
@RequestMapping("/api/perp/admin")
@RequiredArgsConstructor
@Tag(name = "Market Admin", description = "마켓/심볼 관리, 역할, 오라클, 옵션 볼트 API")
public class MarketAdminController {

    private final MarketAdminService marketAdminService;

    @Operation(summary = "마켓 목록")
    @GetMapping("/markets")
    public ResponseEntity<List<MarketResponse>> getMarkets() {
        return ResponseEntity.ok(marketAdminService.getMarkets());
    }

    @Operation(summary = "마켓 생성", description = "유동성 풀과 마켓을 함께 생성합니다.")
    @PostMapping("/markets")
    public ResponseEntity<MarketResponse> createMarket(
            @RequestHeader("X-User-Id") String userId,
            @Valid @RequestBody CreateMarketRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(marketAdminService.createMarket(userId, request));
    }

    @Operation(summary = "마켓 중지/재개")
    @PutMapping("/markets/{lpToken}/active")
    public ResponseEntity<MarketResponse> setMarketActive(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String lpToken,
            @RequestParam boolean active) {
        return ResponseEntity.ok(marketAdminService.setMarketActive(userId, lpToken, active));
    }

    @Operation(summary = "프로토콜 수수료 비율 변경")
    @PutMapping("/markets/{lpToken}/fee-share")
    public ResponseEntity<MarketResponse> updateProtocolFeeShare(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String lpToken,
            @RequestParam long protocolFeeShareBp) {
        return ResponseEntity.ok(marketAdminService.updateProtocolFeeShare(userId, lpToken, protocolFeeShareBp));
    }

    @Operation(summary = "프로토콜 수수료 인출")
    @PostMapping("/markets/{lpToken}/fees/claim")
    public ResponseEntity<Map<String, Long>> claimProtocolFee(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String lpToken,
            @RequestParam String token) {
        return ResponseEntity.ok(Map.of("claimed", marketAdminService.claimProtocolFee(userId, lpToken, token)));
    }

    @Operation(summary = "유동성 공급")
    @PostMapping("/markets/{lpToken}/liquidity")
    public ResponseEntity<Void> provideLiquidity(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String lpToken,
            @RequestParam String token,
            @RequestParam long amount) {
        marketAdminService.provideLiquidity(userId, lpToken, token, amount);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "심볼 조회")
    @GetMapping("/markets/{lpToken}/symbols/{baseToken}")
    public ResponseEntity<SymbolResponse> getSymbol(@PathVariable String lpToken, @PathVariable String baseToken) {
        return ResponseEntity.ok(marketAdminService.getSymbol(lpToken, baseToken));
    }

    @Operation(summary = "심볼 추가")
    @PostMapping("/markets/{lpToken}/symbols")
    public ResponseEntity<SymbolResponse> addSymbol(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String lpToken,
            @Valid @RequestBody AddSymbolRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(marketAdminService.addSymbol(userId, lpToken, request));
    }

    @Operation(summary = "심볼 설정 부분 변경")
    @PatchMapping("/markets/{lpToken}/symbols/{baseToken}")
    public ResponseEntity<SymbolResponse> updateSymbolConfig(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String lpToken,
            @PathVariable String baseToken,
            @RequestBody UpdateSymbolConfigRequest request) {
        return ResponseEntity.ok(marketAdminService.updateSymbolConfig(userId, lpToken, baseToken, request));
    }

    @Operation(summary = "심볼 중지/재개", description = "중지된 심볼에서도 reduce-only 주문은 허용됩니다.")
    @PutMapping("/markets/{lpToken}/symbols/{baseToken}/active")
    public ResponseEntity<SymbolResponse> setSymbolActive(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String lpToken,
            @PathVariable String baseToken,
            @RequestParam boolean active) {
        return ResponseEntity.ok(marketAdminService.setSymbolActive(userId, lpToken, baseToken, active));
    }

    @Operation(summary = "빈 심볼 제거")
    @DeleteMapping("/markets/{lpToken}/symbols/{baseToken}")
    public ResponseEntity<Void> removeSymbol(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String lpToken,
            @PathVariable String baseToken) {
        marketAdminService.removeSymbol(userId, lpToken, baseToken);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "가격 레벨 강제 취소", description = "주문 담보는 주문자에게 반환됩니다.")
    @PostMapping("/markets/{lpToken}/symbols/{baseToken}/force-cancel")
    public ResponseEntity<Map<String, Integer>> forceCancelOrders(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String lpToken,
            @PathVariable String baseToken,
            @RequestParam String bucket,
            @RequestParam long triggerPrice,
            @RequestParam(defaultValue = "50") int maxOps) {
        int cancelled = marketAdminService.forceCancelOrders(userId, lpToken, baseToken,
                EnumParser.parse(OrderBucket.class, bucket, "bucket"), triggerPrice, maxOps);
        return ResponseEntity.ok(Map.of("cancelled", cancelled));
    }

    @Operation(summary = "역할 부여")
    @PostMapping("/roles")
    public ResponseEntity<Void> grantRole(
            @RequestHeader("X-User-Id") String userId,
            @RequestParam String user,
            @RequestParam String role) {
        marketAdminService.grantRole(userId, user, EnumParser.parse(Role.class, role, "role"));
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "역할 회수", description = "마지막 관리자는 회수할 수 없습니다.")
    @DeleteMapping("/roles")
    public ResponseEntity<Void> revokeRole(
            @RequestHeader("X-User-Id") String userId,
            @RequestParam String user,
            @RequestParam String role) {
        marketAdminService.revokeRole(userId, user, EnumParser.parse(Role.class, role, "role"));
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "오라클 가격 입력")
    @PostMapping("/oracles/{oracleId}/price")
    public ResponseEntity<Void> pushOraclePrice(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable String oracleId,
            @Valid @RequestBody OraclePriceRequest request) {
        marketAdminService.pushOraclePrice(userId, oracleId, request);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "옵션 볼트 생성")
    @PostMapping("/vaults")
    public ResponseEntity<Void> createVault(
            @RequestHeader("X-User-Id") String userId,
            @Valid @RequestBody VaultRequest request) {
        marketAdminService.createVault(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @Operation(summary = "share당 가치 갱신")
    @PutMapping("/vaults/{vaultIndex}/value")
    public ResponseEntity<Void> updateVaultValue(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable long vaultIndex,
            @RequestParam long valuePerShare) {
        marketAdminService.updateVaultValue(userId, vaultIndex, valuePerShare);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "bid receipt 발급")
    @PostMapping("/vaults/{vaultIndex}/receipts")
    public ResponseEntity<BidReceipt> issueReceipt(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable long vaultIndex,
            @RequestParam long shares) {
        return ResponseEntity.status(HttpStatus.CREATED).body(marketAdminService.issueReceipt(userId, vaultIndex, shares));
    }
}
