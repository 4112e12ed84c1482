package dustin.perp.domains.event.service;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import dustin.perp.domains.engine.event.EngineEvent;
import dustin.perp.domains.engine.event.EngineEventListener;
import dustin.perp.domains.event.model.entity.EngineEventLog;
import dustin.perp.domains.event.repository.EngineEventLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 엔진 이벤트 DB 기록기
 * Engine Event Recorder
 *
 * 역할:
 * - 커밋된 엔진 이벤트를 engine_event_logs 테이블에 저장
 *
 * 주의사항:
 * - 엔진 커밋 이후에 호출되므로 저장 실패가 엔진 상태를 되돌리지 않음
 * - 실패는 로깅만 (재시도 없음)
 */
@Slf4j
@Order(1)
@Component
@RequiredArgsConstructor
public class EngineEventRecorder implements EngineEventListener {

    private final EngineEventLogRepository engineEventLogRepository;
    private final ObjectMapper objectMapper;

    @Override
    public void onEvent(EngineEvent event) {
        try {
            EngineEventLog eventLog = EngineEventLog.builder()
                    .eventType(event.getType().name())
                    .market(event.getMarket())
                    .symbol(event.getSymbol())
                    .userId(event.getUser())
                    .orderId(event.getOrderId())
                    .positionId(event.getPositionId())
                    .detail(truncate(event.getDetail()))
                    .amounts(objectMapper.writeValueAsString(event.getAmounts()))
                    .eventTimestampMs(event.getTimestampMs())
                    .build();
            engineEventLogRepository.save(eventLog);
        } catch (JsonProcessingException e) {
            log.error("[EngineEventRecorder] 이벤트 직렬화 실패: type={}, error={}", event.getType(), e.getMessage());
        } catch (Exception e) {
            log.error("[EngineEventRecorder] 이벤트 저장 실패: type={}, error={}", event.getType(), e.getMessage());
        }
    }

    private static String truncate(String detail) {
        if (detail == null || detail.length() <= 500) {
            return detail;
        }
        return detail.substring(0, 500);
    }
}
