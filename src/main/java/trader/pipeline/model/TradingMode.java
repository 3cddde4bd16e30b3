package trader.pipeline.model;

public enum TradingMode {
    SIMULATION,
    PAPER,
    LIVE
}
