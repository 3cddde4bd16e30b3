package trader.pipeline.model;

public enum EventType {
    SPREADS,
    OPPORTUNITY_BLOCKED,
    TRADE_COMPLETED,
    TRADE_FAILED,
    TRADE_ROLLBACK,
    SAFETY_LIMIT
}
