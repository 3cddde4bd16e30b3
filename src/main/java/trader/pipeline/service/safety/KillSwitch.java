package trader.pipeline.service.safety;

import trader.pipeline.model.PipelineEvent;

/**
 * Out-of-band emergency stop policy. Sees every pipeline event and decides whether to halt.
 */
public interface KillSwitch {

    boolean shouldHalt(PipelineEvent event);
}
