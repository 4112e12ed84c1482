package dustin.perp.domains.trading.service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import dustin.perp.domains.engine.EngineResult;
import dustin.perp.domains.engine.PerpEngine;
import dustin.perp.domains.engine.PriceFeeds;
import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;
import dustin.perp.domains.engine.model.CollateralMode;
import dustin.perp.domains.engine.model.Side;
import dustin.perp.domains.engine.order.CreateOrderCommand;
import dustin.perp.domains.engine.order.OrderResult;
import dustin.perp.domains.engine.order.TradingOrder;
import dustin.perp.domains.engine.port.BidReceipt;
import dustin.perp.domains.engine.position.Position;
import dustin.perp.domains.oracle.PriceFeedResolver;
import dustin.perp.domains.trading.model.dto.CollateralRequest;
import dustin.perp.domains.trading.model.dto.CreateOrderRequest;
import dustin.perp.domains.trading.model.dto.CreateOrderResponse;
import dustin.perp.domains.trading.model.dto.OrderResponse;
import dustin.perp.domains.trading.model.dto.PositionResponse;
import dustin.perp.domains.trading.model.dto.PositionValuationResponse;
import dustin.perp.domains.vault.InMemoryOptionVault;
import dustin.perp.shared.dto.PayoutResponse;
import dustin.perp.shared.util.EnumParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 거래 서비스
 * Trading Service
 *
 * 역할:
 * - 주문 생성/취소, 포지션 조회/평가, 담보 증액/인출
 * - 요청 DTO → 엔진 명령 변환 (enum 파싱, receipt id → BidReceipt)
 * - 호출 시점의 오라클 피드 조회 (PriceFeedResolver)
 *
 * 처리 흐름:
 * HTTP 요청 → TradingService → PerpEngine (락 + checkpoint) → 이벤트 발행 → 응답
 *
 * 주의사항:
 * - 엔진 오류(EngineException)는 그대로 전파되어 GlobalExceptionHandler에서 HTTP 상태로 변환
 * - 엔진 작업이 원자적이므로 서비스 단에서 보상 처리 없음
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradingService {

    private final PerpEngine perpEngine;
    private final PriceFeedResolver priceFeedResolver;
    private final InMemoryOptionVault optionVault;

    /**
     * 주문 생성
     * Create Order
     *
     * @param userId 주문자 (X-User-Id 헤더)
     * @return 생성 결과 (이미 발동 가격이면 즉시 체결 결과 포함)
     */
    public CreateOrderResponse createOrder(String userId, CreateOrderRequest request) {
        CollateralMode collateralMode = EnumParser.parse(CollateralMode.class, request.getCollateralMode(), "collateralMode");
        CreateOrderCommand command = CreateOrderCommand.builder()
                .user(userId)
                .side(EnumParser.parse(Side.class, request.getSide(), "side"))
                .stopOrder(request.isStopOrder())
                .reduceOnly(request.isReduceOnly())
                .size(request.getSize())
                .triggerPrice(request.getTriggerPrice())
                .collateralMode(collateralMode)
                .collateralAmount(collateralMode == CollateralMode.TOKEN ? request.getCollateralAmount() : 0L)
                .vaultIndex(request.getVaultIndex())
                .receipts(resolveReceipts(request.getReceiptIds()))
                .linkedPositionId(request.getLinkedPositionId())
                .build();

        PriceFeeds feeds = priceFeedResolver.resolve(request.getLpToken(), request.getBaseToken(), request.getCollateralToken());
        EngineResult<OrderResult> result = perpEngine.createOrder(userId, request.getLpToken(), request.getBaseToken(),
                feeds, command, request.isFromAccount());

        log.info("[TradingService] 주문 생성 완료: userId={}, symbol={}/{}, orderId={}, filled={}",
                userId, request.getLpToken(), request.getBaseToken(),
                result.getValue().getOrderId(), result.getValue().isFilled());
        return CreateOrderResponse.from(result);
    }

    /**
     * 주문 취소
     * Cancel Order
     *
     * 담보는 계정이 있으면 계정으로, 없으면 응답의 payouts로 반환
     */
    public PayoutResponse cancelOrder(String userId, String lpToken, String baseToken, long triggerPrice, long orderId) {
        EngineResult<TradingOrder> result = perpEngine.cancelOrder(userId, lpToken, baseToken, triggerPrice, orderId);
        log.info("[TradingService] 주문 취소 완료: userId={}, symbol={}/{}, orderId={}", userId, lpToken, baseToken, orderId);
        return PayoutResponse.from(result.getPayouts());
    }

    public List<OrderResponse> getMyOrders(String userId, String lpToken, String baseToken) {
        return perpEngine.orders(lpToken, baseToken, userId).stream()
                .map(OrderResponse::from)
                .collect(Collectors.toList());
    }

    public List<PositionResponse> getMyPositions(String userId, String lpToken, String baseToken) {
        return perpEngine.positions(lpToken, baseToken, userId).stream()
                .map(PositionResponse::from)
                .collect(Collectors.toList());
    }

    public PositionResponse getPosition(String lpToken, String baseToken, long positionId) {
        Position position = perpEngine.position(lpToken, baseToken, positionId)
                .orElseThrow(() -> new EngineException(ErrorCode.POSITION_NOT_FOUND, "Position not found: " + positionId));
        return PositionResponse.from(position);
    }

    /**
     * 포지션 평가 (미실현 손익, 비용, 펀딩, 청산 여부)
     * Evaluate Position
     */
    public PositionValuationResponse evaluatePosition(String lpToken, String baseToken, long positionId) {
        Position position = perpEngine.position(lpToken, baseToken, positionId)
                .orElseThrow(() -> new EngineException(ErrorCode.POSITION_NOT_FOUND, "Position not found: " + positionId));
        PriceFeeds feeds = priceFeedResolver.resolve(lpToken, baseToken, position.getCollateralToken());
        return PositionValuationResponse.from(perpEngine.evaluatePosition(lpToken, baseToken, feeds, positionId));
    }

    /**
     * 담보 증액
     * Increase Collateral
     */
    public PayoutResponse increaseCollateral(String userId, long positionId, CollateralRequest request) {
        PriceFeeds feeds = priceFeedResolver.resolve(request.getLpToken(), request.getBaseToken(), request.getCollateralToken());
        EngineResult<Long> result = perpEngine.increaseCollateral(userId, request.getLpToken(), request.getBaseToken(),
                feeds, positionId, request.getAmount(), resolveReceipts(request.getReceiptIds()), request.isFromAccount());
        log.info("[TradingService] 담보 증액 완료: userId={}, positionId={}, amount={}, receipts={}",
                userId, positionId, request.getAmount(), request.getReceiptIds().size());
        return PayoutResponse.from(result.getPayouts());
    }

    /**
     * 담보 인출 (토큰 담보만)
     * Release Collateral
     */
    public PayoutResponse releaseCollateral(String userId, long positionId, CollateralRequest request) {
        PriceFeeds feeds = priceFeedResolver.resolve(request.getLpToken(), request.getBaseToken(), request.getCollateralToken());
        EngineResult<Long> result = perpEngine.releaseCollateral(userId, request.getLpToken(), request.getBaseToken(),
                feeds, positionId, request.getAmount());
        log.info("[TradingService] 담보 인출 완료: userId={}, positionId={}, amount={}", userId, positionId, result.getValue());
        return PayoutResponse.from(result.getPayouts());
    }

    private List<BidReceipt> resolveReceipts(List<String> receiptIds) {
        if (receiptIds == null || receiptIds.isEmpty()) {
            return new ArrayList<>();
        }
        return receiptIds.stream().map(optionVault::receipt).collect(Collectors.toList());
    }
}
