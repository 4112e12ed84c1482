package dustin.perp.shared.kafka;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;

import dustin.perp.config.EngineProperties;
import dustin.perp.domains.engine.event.EngineEvent;
import dustin.perp.domains.engine.event.EngineEventListener;
import lombok.extern.slf4j.Slf4j;

/**
 * Kafka 이벤트 발행자
 * Kafka Event Producer
 *
 * 역할:
 * - 커밋된 엔진 이벤트를 JSON으로 perp-engine-events 토픽에 발행
 * - 메시지 키: market:symbol (심볼 단위 순서 보장)
 *
 * 주의사항:
 * - 이벤트 발행은 비동기로 처리됨 (eventExecutor, 논블로킹)
 * - 엔진 락을 잡고 있는 스레드에서 전송하지 않음
 * - 실패해도 엔진 상태에는 영향 없음 (로깅만)
 * - perp.kafka.enabled=true일 때만 등록
 */
@Slf4j
@Order(2)
@Component
@ConditionalOnProperty(prefix = "perp.kafka", name = "enabled", havingValue = "true")
public class KafkaEventProducer implements EngineEventListener {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final Executor eventExecutor;
    private final String topic;

    public KafkaEventProducer(KafkaTemplate<String, String> kafkaTemplate,
                              ObjectMapper objectMapper,
                              @Qualifier("eventExecutor") Executor eventExecutor,
                              EngineProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.eventExecutor = eventExecutor;
        this.topic = properties.getKafka().getTopic();
    }

    @Override
    public void onEvent(EngineEvent event) {
        try {
            String key = event.getMarket() + ":" + event.getSymbol();
            String eventJson = objectMapper.writeValueAsString(event);
            CompletableFuture<Void> future = CompletableFuture.runAsync(() -> {
                try {
                    kafkaTemplate.send(topic, key, eventJson);
                } catch (Exception e) {
                    log.error("[KafkaEventProducer] 엔진 이벤트 발행 실패: type={}, error={}", event.getType(), e.getMessage());
                }
            }, eventExecutor);

            future.exceptionally(ex -> {
                log.error("[KafkaEventProducer] 엔진 이벤트 발행 중 예외 발생: type={}, error={}", event.getType(), ex.getMessage());
                return null;
            });

        } catch (Exception e) {
            log.error("[KafkaEventProducer] 엔진 이벤트 발행 실패: type={}, error={}", event.getType(), e.getMessage());
        }
    }
}
