package trader.pipeline.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import trader.pipeline.model.EventType;
import trader.pipeline.model.PipelineEvent;

import java.util.EnumSet;
import java.util.Set;

/**
 * In-process outcome channel. Slow subscribers miss events rather than stall the publisher.
 */
@Slf4j
@Component
public class PipelineEventBus {

    private final Sinks.Many<PipelineEvent> sink = Sinks.many().multicast().directBestEffort();

    public synchronized void publish(PipelineEvent event) {
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Could not publish {} event: {}", event.getType(), result);
        }
    }

    public Flux<PipelineEvent> events() {
        return sink.asFlux();
    }

    public Flux<PipelineEvent> events(EventType first, EventType... rest) {
        Set<EventType> types = EnumSet.of(first, rest);
        return sink.asFlux().filter(event -> types.contains(event.getType()));
    }
}
