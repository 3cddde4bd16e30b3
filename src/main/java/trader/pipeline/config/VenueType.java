package trader.pipeline.config;

public enum VenueType {
    HTTP,
    SIMULATED
}
