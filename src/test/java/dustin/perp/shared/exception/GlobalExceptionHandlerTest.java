package dustin.perp.shared.exception;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;

/**
 * 엔진 오류 → HTTP 상태 매핑 테스트
 */
class GlobalExceptionHandlerTest {

    @Test
    @DisplayName("오류 분류별 HTTP 상태")
    void statusByCategory() {
        assertThat(GlobalExceptionHandler.statusOf(ErrorCode.UNAUTHORIZED)).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(GlobalExceptionHandler.statusOf(ErrorCode.POSITION_NOT_FOUND)).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(GlobalExceptionHandler.statusOf(ErrorCode.MARKET_INACTIVE)).isEqualTo(HttpStatus.CONFLICT);
        assertThat(GlobalExceptionHandler.statusOf(ErrorCode.SIZE_NOT_LOT_ALIGNED)).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(GlobalExceptionHandler.statusOf(ErrorCode.INVALID_ARGUMENT)).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(GlobalExceptionHandler.statusOf(ErrorCode.LEVERAGE_EXCEEDED)).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(GlobalExceptionHandler.statusOf(ErrorCode.RECEIPT_NOT_FOUND)).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(GlobalExceptionHandler.statusOf(ErrorCode.ORACLE_MISMATCH)).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(GlobalExceptionHandler.statusOf(ErrorCode.ORACLE_STALE)).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(GlobalExceptionHandler.statusOf(ErrorCode.NUMERIC_OVERFLOW))
                .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @Test
    @DisplayName("응답 본문에 오류 코드와 메시지 포함")
    void responseBody() {
        GlobalExceptionHandler handler = new GlobalExceptionHandler();

        ResponseEntity<Map<String, String>> response = handler.handleEngineException(
                new EngineException(ErrorCode.POSITION_HEALTHY, "Position 3 is above maintenance margin"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(response.getBody())
                .containsEntry("code", "POSITION_HEALTHY")
                .containsEntry("error", "Position 3 is above maintenance margin");
    }
}
