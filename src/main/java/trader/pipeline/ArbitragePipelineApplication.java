package trader.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class ArbitragePipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArbitragePipelineApplication.class, args);
    }
}
