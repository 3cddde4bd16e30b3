package trader.pipeline.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class ThreadPoolConfig {

    @Bean(name = "scanScheduler", destroyMethod = "dispose")
    public Scheduler scanScheduler() {
        return Schedulers.newSingle("price-scan");
    }

    // The one serialization point of the pipeline: every trade runs on this thread.
    @Bean(name = "tradeScheduler", destroyMethod = "dispose")
    public Scheduler tradeScheduler() {
        return Schedulers.newSingle("trade-worker");
    }
}
