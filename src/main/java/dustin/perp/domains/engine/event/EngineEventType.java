package dustin.perp.domains.engine.event;

/**
 * 엔진 이벤트 타입
 * Engine event types
 */
public enum EngineEventType {
    MARKET_CREATED,
    SYMBOL_ADDED,
    SYMBOL_REMOVED,
    MARKET_CONFIG_UPDATED,
    MARKET_SUSPENDED,
    MARKET_RESUMED,
    SYMBOL_SUSPENDED,
    SYMBOL_RESUMED,
    PROTOCOL_FEE_SHARE_UPDATED,
    PROTOCOL_FEE_CLAIMED,
    ROLE_GRANTED,
    ROLE_REVOKED,

    ORDER_CREATED,
    ORDER_CANCELED,
    ORDER_RELEASED,
    ORDER_FILLED,

    POSITION_OPENED,
    POSITION_INCREASED,
    POSITION_REDUCED,
    POSITION_FLIPPED,
    POSITION_CLOSED,
    COSTS_REALIZED,
    COLLATERAL_INCREASED,
    COLLATERAL_RELEASED,

    FUNDING_UPDATED,

    POSITION_LIQUIDATED,
    RECEIPT_ESCROWED,
    RECEIPT_SETTLED
}
