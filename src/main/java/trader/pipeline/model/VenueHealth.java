package trader.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class VenueHealth {
    String venue;
    long totalFetches;
    long failedFetches;
    int consecutiveFailures;
    String lastError;
    Instant lastSuccessAt;
}
