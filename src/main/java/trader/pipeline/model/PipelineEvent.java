package trader.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class PipelineEvent {
    EventType type;
    Instant timestamp;
    List<Spread> spreads;
    Opportunity opportunity;
    TradeRecord trade;
    String reason;
}
