package dustin.perp.domains.trading.model.dto;

import dustin.perp.domains.engine.EngineResult;
import dustin.perp.domains.engine.order.OrderResult;
import dustin.perp.shared.dto.PayoutResponse;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 주문 생성 응답 DTO
 * Create Order Response DTO
 *
 * - filled=false: 버킷에 대기 중
 * - filled=true: 이미 발동 조건을 만족해 즉시 체결됨 (fill 포함)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "주문 생성 결과")
public class CreateOrderResponse {

    private Long orderId;
    private String bucket;
    private Long triggerPrice;
    private Long leverageMbp;
    private boolean filled;
    private FillResponse fill;
    private PayoutResponse payouts;

    public static CreateOrderResponse from(EngineResult<OrderResult> result) {
        OrderResult order = result.getValue();
        return CreateOrderResponse.builder()
                .orderId(order.getOrderId())
                .bucket(order.getBucket().name())
                .triggerPrice(order.getTriggerPrice())
                .leverageMbp(order.getLeverageMbp())
                .filled(order.isFilled())
                .fill(FillResponse.from(order.getFill()))
                .payouts(PayoutResponse.from(result.getPayouts()))
                .build();
    }
}
