package dustin.perp.domains.event.model.entity;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 엔진 이벤트 로그 엔티티
 * Engine Event Log Entity
 *
 * 역할:
 * - 커밋된 엔진 상태 변경을 한 행씩 기록 (감사 추적)
 * - 엔진 상태의 원본은 메모리에 있으며, 이 테이블은 읽기 전용 기록
 *
 * 데이터 구조:
 * ===========
 * - event_type: EngineEventType 이름 (예: 'ORDER_FILLED', 'POSITION_LIQUIDATED')
 * - market / symbol: LP 토큰 / 기초 자산
 * - user_id, order_id, position_id: 대상 (없으면 null)
 * - amounts: 이름이 붙은 수치 (JSON, 예: {"collateral_before":1000,"collateral_after":900})
 * - event_timestamp_ms: 엔진 시계 기준 발생 시각
 */
@Entity
@Table(name = "engine_event_logs",
       indexes = {
           @Index(name = "idx_engine_event_logs_event_type", columnList = "event_type"),
           @Index(name = "idx_engine_event_logs_market_symbol", columnList = "market, symbol"),
           @Index(name = "idx_engine_event_logs_user_id", columnList = "user_id"),
           @Index(name = "idx_engine_event_logs_position_id", columnList = "position_id"),
           @Index(name = "idx_engine_event_logs_created_at", columnList = "created_at")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineEventLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_type", nullable = false, length = 40)
    private String eventType;

    @Column(name = "market", length = 64)
    private String market;

    @Column(name = "symbol", length = 64)
    private String symbol;

    @Column(name = "user_id", length = 255)
    private String userId;

    @Column(name = "order_id")
    private Long orderId;

    @Column(name = "position_id")
    private Long positionId;

    @Column(name = "detail", length = 500)
    private String detail;

    /**
     * 이름이 붙은 수치 (JSON 형식)
     */
    @Column(name = "amounts", columnDefinition = "TEXT")
    private String amounts;

    @Column(name = "event_timestamp_ms", nullable = false)
    private Long eventTimestampMs;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
