package dustin.perp.domains.event.service;

import java.util.List;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.perp.domains.engine.event.EngineEventType;
import dustin.perp.domains.event.model.dto.EngineEventLogResponse;
import dustin.perp.domains.event.repository.EngineEventLogRepository;
import dustin.perp.shared.util.EnumParser;
import lombok.RequiredArgsConstructor;

/**
 * 엔진 이벤트 로그 조회 서비스
 * Engine Event Query Service
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class EngineEventQueryService {

    private final EngineEventLogRepository engineEventLogRepository;

    public List<EngineEventLogResponse> getPositionHistory(Long positionId) {
        return engineEventLogRepository.findByPositionIdOrderByIdAsc(positionId).stream()
                .map(EngineEventLogResponse::from)
                .collect(Collectors.toList());
    }

    public List<EngineEventLogResponse> getUserHistory(String userId) {
        return engineEventLogRepository.findByUserIdOrderByIdDesc(userId).stream()
                .map(EngineEventLogResponse::from)
                .collect(Collectors.toList());
    }

    /**
     * 심볼별 특정 이벤트 (예: POSITION_LIQUIDATED, FUNDING_UPDATED)
     */
    public List<EngineEventLogResponse> getSymbolEvents(String lpToken, String baseToken, String eventType) {
        EngineEventType type = EnumParser.parse(EngineEventType.class, eventType, "eventType");
        return engineEventLogRepository.findByMarketAndSymbolAndEventTypeOrderByIdDesc(lpToken, baseToken, type.name()).stream()
                .map(EngineEventLogResponse::from)
                .collect(Collectors.toList());
    }
}
