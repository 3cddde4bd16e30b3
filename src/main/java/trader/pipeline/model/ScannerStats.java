package trader.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ScannerStats {
    boolean running;
    long totalScans;
    double successRate;
    int venuesMonitored;
    List<String> venues;
}
