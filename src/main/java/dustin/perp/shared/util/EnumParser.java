package dustin.perp.shared.util;

import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;

/**
 * 요청 문자열 → enum 변환 (대소문자 무시)
 */
public final class EnumParser {

    private EnumParser() {
    }

    public static <E extends Enum<E>> E parse(Class<E> type, String value, String field) {
        if (value == null || value.isBlank()) {
            throw new EngineException(ErrorCode.INVALID_ARGUMENT, field + " is required");
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new EngineException(ErrorCode.INVALID_ARGUMENT, "Unknown " + field + ": " + value, e);
        }
    }
}
