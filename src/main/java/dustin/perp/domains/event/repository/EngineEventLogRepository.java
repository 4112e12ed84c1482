package dustin.perp.domains.event.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import dustin.perp.domains.event.model.entity.EngineEventLog;

/**
 * 엔진 이벤트 로그 Repository
 * Engine Event Log Repository
 */
@Repository
public interface EngineEventLogRepository extends JpaRepository<EngineEventLog, Long> {

    List<EngineEventLog> findByPositionIdOrderByIdAsc(Long positionId);

    List<EngineEventLog> findByUserIdOrderByIdDesc(String userId);

    List<EngineEventLog> findByMarketAndSymbolAndEventTypeOrderByIdDesc(String market, String symbol, String eventType);

    long countByEventType(String eventType);
}
