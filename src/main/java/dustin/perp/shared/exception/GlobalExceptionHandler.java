package dustin.perp.shared.exception;

import java.util.HashMap;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;
import lombok.extern.slf4j.Slf4j;

/**
 * 전역 예외 처리기
 * Global Exception Handler
 *
 * 엔진 오류 분류 → HTTP 상태:
 * - AUTHORIZATION → 403
 * - LIFECYCLE → 404 (NOT_FOUND 코드), 409 (그 외)
 * - SIZING, VALIDATION → 400
 * - SOLVENCY, DOMAIN → 422
 * - ORACLE → 503 (불일치는 400)
 * - NUMERIC → 500
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(EngineException.class)
    public ResponseEntity<Map<String, String>> handleEngineException(EngineException e) {
        Map<String, String> error = new HashMap<>();
        error.put("error", e.getMessage());
        error.put("code", e.getCode().name());

        HttpStatus status = statusOf(e.getCode());
        if (status.is5xxServerError()) {
            log.error("[GlobalExceptionHandler] 엔진 오류: code={}, message={}", e.getCode(), e.getMessage());
        } else {
            log.debug("[GlobalExceptionHandler] 요청 거부: code={}, message={}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidationException(MethodArgumentNotValidException e) {
        Map<String, String> error = new HashMap<>();
        String message = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
                .orElse("Invalid request");
        error.put("error", message);
        error.put("code", ErrorCode.INVALID_ARGUMENT.name());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, String>> handleMissingHeader(MissingRequestHeaderException e) {
        Map<String, String> error = new HashMap<>();
        error.put("error", "Missing header: " + e.getHeaderName());
        error.put("code", ErrorCode.UNAUTHORIZED.name());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        Map<String, String> error = new HashMap<>();
        error.put("error", e.getMessage());
        error.put("code", ErrorCode.INVALID_ARGUMENT.name());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    static HttpStatus statusOf(ErrorCode code) {
        switch (code.getCategory()) {
            case AUTHORIZATION:
                return HttpStatus.FORBIDDEN;
            case LIFECYCLE:
                return code.name().endsWith("_NOT_FOUND") ? HttpStatus.NOT_FOUND : HttpStatus.CONFLICT;
            case SIZING:
            case VALIDATION:
                return HttpStatus.BAD_REQUEST;
            case SOLVENCY:
            case DOMAIN:
                return code == ErrorCode.RECEIPT_NOT_FOUND ? HttpStatus.NOT_FOUND : HttpStatus.UNPROCESSABLE_ENTITY;
            case ORACLE:
                return code == ErrorCode.ORACLE_MISMATCH ? HttpStatus.BAD_REQUEST : HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
