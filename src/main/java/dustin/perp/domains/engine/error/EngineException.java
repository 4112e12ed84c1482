package dustin.perp.domains.engine.error;

/**
 * 엔진 예외
 * Engine Exception
 *
 * 역할:
 * - 사전조건 위반 시 발생 (권한, 상태, 수량, 담보, 오라클, 도메인, 연산)
 * - 발생 시 해당 작업 전체가 롤백됨 (부분 상태 변경 없음)
 */
public class EngineException extends RuntimeException {

    private final ErrorCode code;

    public EngineException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public EngineException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return code.getCategory();
    }
}
