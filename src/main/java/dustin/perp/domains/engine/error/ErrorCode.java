package dustin.perp.domains.engine.error;

/**
 * 엔진 오류 코드
 * Engine error codes
 *
 * 모든 코드는 하나의 {@link ErrorCategory}에 속함
 */
public enum ErrorCode {
    UNAUTHORIZED(ErrorCategory.AUTHORIZATION),

    MARKET_NOT_FOUND(ErrorCategory.LIFECYCLE),
    MARKET_ALREADY_EXISTS(ErrorCategory.LIFECYCLE),
    MARKET_INACTIVE(ErrorCategory.LIFECYCLE),
    SYMBOL_NOT_FOUND(ErrorCategory.LIFECYCLE),
    SYMBOL_ALREADY_EXISTS(ErrorCategory.LIFECYCLE),
    SYMBOL_INACTIVE(ErrorCategory.LIFECYCLE),
    POOL_INACTIVE(ErrorCategory.LIFECYCLE),
    ORDER_NOT_FOUND(ErrorCategory.LIFECYCLE),
    POSITION_NOT_FOUND(ErrorCategory.LIFECYCLE),
    ACCOUNT_NOT_FOUND(ErrorCategory.LIFECYCLE),
    INVALID_PROCESS(ErrorCategory.LIFECYCLE),

    SIZE_BELOW_MINIMUM(ErrorCategory.SIZING),
    SIZE_NOT_LOT_ALIGNED(ErrorCategory.SIZING),
    OPEN_INTEREST_EXCEEDED(ErrorCategory.SIZING),
    INVALID_REDUCE_ONLY(ErrorCategory.SIZING),

    INSUFFICIENT_COLLATERAL(ErrorCategory.SOLVENCY),
    LEVERAGE_EXCEEDED(ErrorCategory.SOLVENCY),
    INSUFFICIENT_RESERVE(ErrorCategory.SOLVENCY),
    INSUFFICIENT_LIQUIDITY(ErrorCategory.SOLVENCY),
    INSUFFICIENT_BALANCE(ErrorCategory.SOLVENCY),
    POSITION_HEALTHY(ErrorCategory.SOLVENCY),
    RELEASE_TRIGGERS_LIQUIDATION(ErrorCategory.SOLVENCY),

    ORACLE_MISMATCH(ErrorCategory.ORACLE),
    ORACLE_STALE(ErrorCategory.ORACLE),
    ORACLE_INVALID_PRICE(ErrorCategory.ORACLE),

    COLLATERAL_TOKEN_MISMATCH(ErrorCategory.DOMAIN),
    BID_TOKEN_MISMATCH(ErrorCategory.DOMAIN),
    COLLATERAL_MODE_MISMATCH(ErrorCategory.DOMAIN),
    RECEIPT_NOT_FOUND(ErrorCategory.DOMAIN),

    NUMERIC_OVERFLOW(ErrorCategory.NUMERIC),

    INVALID_ARGUMENT(ErrorCategory.VALIDATION);

    private final ErrorCategory category;

    ErrorCode(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
