package trader.pipeline.service.safety;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import trader.pipeline.event.PipelineEventBus;
import trader.pipeline.model.PipelineEvent;
import trader.pipeline.service.orchestrator.ArbitrageOrchestrator;

import java.util.List;

/**
 * Feeds pipeline events to every registered {@link KillSwitch} and forces a full stop when one trips.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KillSwitchMonitor {

    private final PipelineEventBus eventBus;
    private final List<KillSwitch> killSwitches;
    private final ArbitrageOrchestrator orchestrator;

    private Disposable subscription;

    @PostConstruct
    public void init() {
        log.info("Kill switch monitor armed with {} switch(es)", killSwitches.size());
        subscription = eventBus.events().subscribe(
                this::inspect,
                error -> log.error("Kill switch monitor lost the event feed: {}", error.getMessage(), error));
    }

    void inspect(PipelineEvent event) {
        for (KillSwitch killSwitch : killSwitches) {
            if (killSwitch.shouldHalt(event)) {
                String reason = killSwitch.getClass().getSimpleName() + " tripped on " + event.getType()
                        + (event.getReason() != null ? ": " + event.getReason() : "");
                orchestrator.emergencyStop(reason);
                return;
            }
        }
    }

    @PreDestroy
    public void onDestroy() {
        if (subscription != null) {
            subscription.dispose();
        }
    }
}
