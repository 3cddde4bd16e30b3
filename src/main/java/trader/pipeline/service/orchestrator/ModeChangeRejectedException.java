package trader.pipeline.service.orchestrator;

import lombok.Getter;
import trader.pipeline.model.TradingMode;

/**
 * Thrown when a configuration update tries to switch the trading mode while the pipeline is running.
 */
@Getter
public class ModeChangeRejectedException extends RuntimeException {

    private final TradingMode currentMode;
    private final TradingMode requestedMode;

    public ModeChangeRejectedException(TradingMode currentMode, TradingMode requestedMode) {
        super("Cannot switch trading mode from " + currentMode + " to " + requestedMode + " while running; stop the pipeline first");
        this.currentMode = currentMode;
        this.requestedMode = requestedMode;
    }
}
