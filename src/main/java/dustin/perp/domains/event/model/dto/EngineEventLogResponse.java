package dustin.perp.domains.event.model.dto;

import java.time.LocalDateTime;

import dustin.perp.domains.event.model.entity.EngineEventLog;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 엔진 이벤트 로그 응답
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineEventLogResponse {

    private Long id;
    private String eventType;
    private String market;
    private String symbol;
    private String userId;
    private Long orderId;
    private Long positionId;
    private String detail;
    private String amounts;
    private Long eventTimestampMs;
    private LocalDateTime createdAt;

    public static EngineEventLogResponse from(EngineEventLog log) {
        return EngineEventLogResponse.builder()
                .id(log.getId())
                .eventType(log.getEventType())
                .market(log.getMarket())
                .symbol(log.getSymbol())
                .userId(log.getUserId())
                .orderId(log.getOrderId())
                .positionId(log.getPositionId())
                .detail(log.getDetail())
                .amounts(log.getAmounts())
                .eventTimestampMs(log.getEventTimestampMs())
                .createdAt(log.getCreatedAt())
                .build();
    }
}
