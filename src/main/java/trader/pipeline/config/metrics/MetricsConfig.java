package trader.pipeline.config.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import trader.pipeline.service.ledger.CapitalLedger;
import trader.pipeline.service.orchestrator.ArbitrageOrchestrator;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter spreadsDetectedCounter(MeterRegistry registry) {
        return Counter.builder("pipeline.spreads.detected")
                .description("Number of significant cross-venue spreads detected")
                .register(registry);
    }

    @Bean
    public Counter viableOpportunitiesCounter(MeterRegistry registry) {
        return Counter.builder("pipeline.opportunities.viable")
                .description("Number of opportunities that passed the viability gate")
                .register(registry);
    }

    @Bean
    public Gauge reservedCapitalGauge(MeterRegistry registry, CapitalLedger capitalLedger) {
        return Gauge.builder("pipeline.capital.reserved",
                        () -> capitalLedger.getReservedCapital().doubleValue())
                .description("Capital currently reserved by in-flight trades")
                .register(registry);
    }

    @Bean
    public Gauge queuedOpportunitiesGauge(MeterRegistry registry, ArbitrageOrchestrator orchestrator) {
        return Gauge.builder("pipeline.opportunities.queued", orchestrator::getQueuedOpportunities)
                .description("Admitted opportunities waiting for the trade worker")
                .register(registry);
    }
}
