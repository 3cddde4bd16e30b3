package trader.pipeline.service.orchestrator;

public enum AdmissionDecision {
    ADMITTED("admitted"),
    REJECTED_NOT_RUNNING("not_running"),
    REJECTED_RATE_LIMIT("rate_limit"),
    REJECTED_DAILY_LOSS_LIMIT("daily_loss_limit"),
    REJECTED_INSUFFICIENT_CAPITAL("insufficient_capital");

    // used as the "reason" tag of pipeline.opportunities.rejected
    private final String reason;

    AdmissionDecision(String reason) {
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }

    public boolean isAdmitted() {
        return this == ADMITTED;
    }
}
