package trader.pipeline.service.safety;

import org.springframework.stereotype.Component;
import trader.pipeline.config.OrchestratorProperties;
import trader.pipeline.model.EventType;
import trader.pipeline.model.PipelineEvent;

@Component
public class SafetyLimitKillSwitch implements KillSwitch {

    private final OrchestratorProperties properties;

    public SafetyLimitKillSwitch(OrchestratorProperties properties) {
        this.properties = properties;
    }

    @Override
    public boolean shouldHalt(PipelineEvent event) {
        return properties.isHaltOnSafetyLimit() && event.getType() == EventType.SAFETY_LIMIT;
    }
}
