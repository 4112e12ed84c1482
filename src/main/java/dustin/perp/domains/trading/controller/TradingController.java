package dustin.perp.domains.trading.controller;

import java.util.List;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import dustin.perp.domains.trading.model.dto.CollateralRequest;
import dustin.perp.domains.trading.model.dto.CreateOrderRequest;
import dustin.perp.domains.trading.model.dto.CreateOrderResponse;
import dustin.perp.domains.trading.model.dto.OrderResponse;
import dustin.perp.domains.trading.model.dto.PositionResponse;
import dustin.perp.domains.trading.model.dto.PositionValuationResponse;
import dustin.perp.domains.trading.service.TradingService;
import dustin.perp.shared.dto.PayoutResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * 거래 컨트롤러
 * Trading Controller
 *
 * 역할:
 * - 주문 생성/취소/조회, 포지션 조회/평가, 담보 증액/인출 REST API
 *
 * 인증:
 * - 호출자는 X-User-Id 헤더로 전달 (앞단 게이트웨이에서 인증 후 주입)
 *
 * API 엔드포인트:
 * - POST   /api/perp/orders - 주문 생성
 * - DELETE /api/perp/orders/{orderId} - 주문 취소
 * - GET    /api/perp/orders/my - 내 대기 주문
 * - GET    /api/perp/positions/my - 내 포지션
 * - GET    /api/perp/positions/{positionId} - 포지션 조회
 * - GET    /api/perp/positions/{positionId}/valuation - 포지션 평가
 * - POST   /api/perp/positions/{positionId}/collateral - 담보 증액
 * - POST   /api/perp/positions/{positionId}/collateral/release - 담보 인출
 */
@RestController
@RequestMapping("/api/perp")
@RequiredArgsConstructor
@Tag(name = "Trading", description = "주문 및 포지션 API")
public class TradingController {

    private final TradingService tradingService;

    @Operation(summary = "주문 생성",
            description = "지정가/스탑 주문을 생성합니다. 이미 발동 가격이면 즉시 체결되어 포지션에 반영됩니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "주문 생성 성공",
                    content = @Content(schema = @Schema(implementation = CreateOrderResponse.class))),
            @ApiResponse(responseCode = "400", description = "잘못된 요청 (수량/lot/오라클 불일치)"),
            @ApiResponse(responseCode = "403", description = "다른 사용자 명의 주문"),
            @ApiResponse(responseCode = "409", description = "비활성 마켓/심볼"),
            @ApiResponse(responseCode = "422", description = "담보 부족, 레버리지 초과, 준비금 부족"),
            @ApiResponse(responseCode = "503", description = "오라클 가격 지연")
    })
    @PostMapping("/orders")
    public ResponseEntity<CreateOrderResponse> createOrder(
            @RequestHeader("X-User-Id") String userId,
            @Valid @RequestBody CreateOrderRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(tradingService.createOrder(userId, request));
    }

    @Operation(summary = "주문 취소", description = "대기 주문을 취소하고 담보를 돌려받습니다.")
    @DeleteMapping("/orders/{orderId}")
    public ResponseEntity<PayoutResponse> cancelOrder(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable Long orderId,
            @Parameter(description = "마켓 LP 토큰") @RequestParam String lpToken,
            @Parameter(description = "심볼 기초 자산") @RequestParam String baseToken,
            @Parameter(description = "주문 발동 가격") @RequestParam Long triggerPrice) {
        return ResponseEntity.ok(tradingService.cancelOrder(userId, lpToken, baseToken, triggerPrice, orderId));
    }

    @Operation(summary = "내 대기 주문 조회")
    @GetMapping("/orders/my")
    public ResponseEntity<List<OrderResponse>> getMyOrders(
            @RequestHeader("X-User-Id") String userId,
            @RequestParam String lpToken,
            @RequestParam String baseToken) {
        return ResponseEntity.ok(tradingService.getMyOrders(userId, lpToken, baseToken));
    }

    @Operation(summary = "내 포지션 조회")
    @GetMapping("/positions/my")
    public ResponseEntity<List<PositionResponse>> getMyPositions(
            @RequestHeader("X-User-Id") String userId,
            @RequestParam String lpToken,
            @RequestParam String baseToken) {
        return ResponseEntity.ok(tradingService.getMyPositions(userId, lpToken, baseToken));
    }

    @Operation(summary = "포지션 조회")
    @GetMapping("/positions/{positionId}")
    public ResponseEntity<PositionResponse> getPosition(
            @PathVariable Long positionId,
            @RequestParam String lpToken,
            @RequestParam String baseToken) {
        return ResponseEntity.ok(tradingService.getPosition(lpToken, baseToken, positionId));
    }

    @Operation(summary = "포지션 평가", description = "현재 오라클 가격 기준 미실현 손익, 비용, 펀딩, 청산 여부")
    @GetMapping("/positions/{positionId}/valuation")
    public ResponseEntity<PositionValuationResponse> evaluatePosition(
            @PathVariable Long positionId,
            @RequestParam String lpToken,
            @RequestParam String baseToken) {
        return ResponseEntity.ok(tradingService.evaluatePosition(lpToken, baseToken, positionId));
    }

    @Operation(summary = "담보 증액")
    @PostMapping("/positions/{positionId}/collateral")
    public ResponseEntity<PayoutResponse> increaseCollateral(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable Long positionId,
            @Valid @RequestBody CollateralRequest request) {
        return ResponseEntity.ok(tradingService.increaseCollateral(userId, positionId, request));
    }

    @Operation(summary = "담보 인출", description = "인출 후 청산 대상이 되거나 레버리지 한도를 넘으면 거부됩니다.")
    @PostMapping("/positions/{positionId}/collateral/release")
    public ResponseEntity<PayoutResponse> releaseCollateral(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable Long positionId,
            @Valid @RequestBody CollateralRequest request) {
        return ResponseEntity.ok(tradingService.releaseCollateral(userId, positionId, request));
    }
}
