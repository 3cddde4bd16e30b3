package trader.pipeline.model;

public enum TradeStatus {
    PENDING,
    EXECUTING,
    EXECUTED,
    FAILED,
    ROLLED_BACK,
    CANCELLED;

    public boolean isTerminal() {
        return this == EXECUTED || this == FAILED || this == ROLLED_BACK || this == CANCELLED;
    }
}
