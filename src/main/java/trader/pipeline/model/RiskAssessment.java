package trader.pipeline.model;

import lombok.Value;

@Value
public class RiskAssessment {
    boolean proceed;
    String rationale;

    public static RiskAssessment proceed(String rationale) {
        return new RiskAssessment(true, rationale);
    }

    public static RiskAssessment veto(String rationale) {
        return new RiskAssessment(false, rationale);
    }
}
