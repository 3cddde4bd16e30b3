package trader.pipeline.config.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.experimental.UtilityClass;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;

import java.util.function.Supplier;

@UtilityClass
public class TimerUtils {

    /**
     * Times a lazily assembled {@link Mono}. The outcome tag is {@code success}, {@code error}
     * or {@code cancelled} (the latter covers timeouts applied downstream).
     */
    public <T> Mono<T> timedMono(Supplier<Mono<T>> supplier, MeterRegistry registry, String name, String... tags) {
        return Mono.defer(() -> {
            Timer.Sample sample = Timer.start(registry);
            return supplier.get()
                    .doFinally(signal -> stopTimer(sample, registry, name, outcome(signal), tags));
        });
    }

    private String outcome(SignalType signal) {
        switch (signal) {
            case ON_ERROR:
                return "error";
            case CANCEL:
                return "cancelled";
            default:
                return "success";
        }
    }

    private void stopTimer(Timer.Sample sample, MeterRegistry registry, String name, String outcome, String... tags) {
        sample.stop(
                Timer.builder(name)
                        .tags(tags)
                        .tag("outcome", outcome)
                        .description("Timed operation: " + name)
                        .register(registry)
        );
    }
}
