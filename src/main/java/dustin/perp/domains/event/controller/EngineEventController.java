package dustin.perp.domains.event.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import dustin.perp.domains.event.model.dto.EngineEventLogResponse;
import dustin.perp.domains.event.service.EngineEventQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * 엔진 이벤트 조회 컨트롤러
 * Engine Event Controller
 *
 * API 엔드포인트:
 * - GET /api/perp/events/my - 내 이벤트 (최신순)
 * - GET /api/perp/events/positions/{positionId} - 포지션 이력 (발생순)
 * - GET /api/perp/events?lpToken&baseToken&eventType - 심볼별 이벤트
 */
@RestController
@RequestMapping("/api/perp/events")
@RequiredArgsConstructor
@Tag(name = "Engine Events", description = "엔진 이벤트 기록 조회 API")
public class EngineEventController {

    private final EngineEventQueryService engineEventQueryService;

    @Operation(summary = "내 이벤트 조회")
    @GetMapping("/my")
    public ResponseEntity<List<EngineEventLogResponse>> getMyEvents(@RequestHeader("X-User-Id") String userId) {
        return ResponseEntity.ok(engineEventQueryService.getUserHistory(userId));
    }

    @Operation(summary = "포지션 이력 조회", description = "개설부터 청산/종료까지 발생 순서대로 반환합니다.")
    @GetMapping("/positions/{positionId}")
    public ResponseEntity<List<EngineEventLogResponse>> getPositionHistory(@PathVariable Long positionId) {
        return ResponseEntity.ok(engineEventQueryService.getPositionHistory(positionId));
    }

    @Operation(summary = "심볼별 이벤트 조회")
    @GetMapping
    public ResponseEntity<List<EngineEventLogResponse>> getSymbolEvents(
            @RequestParam String lpToken,
            @RequestParam String baseToken,
            @RequestParam String eventType) {
        return ResponseEntity.ok(engineEventQueryService.getSymbolEvents(lpToken, baseToken, eventType));
    }
}
