package trader.pipeline.service.orchestrator;

import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class DailyStatsRollover {

    private final ArbitrageOrchestrator orchestrator;

    /**
     * Closes the trading day at midnight UTC.
     */
    @Scheduled(cron = "${pipeline.orchestrator.daily-reset-cron:0 0 0 * * *}", zone = "UTC")
    @Observed(name = "pipeline.daily.rollover")
    public void rollover() {
        log.info("=== Daily stats rollover ===");
        orchestrator.rollDailyStats();
    }
}
