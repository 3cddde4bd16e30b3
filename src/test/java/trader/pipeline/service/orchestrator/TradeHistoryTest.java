package trader.pipeline.service.orchestrator;

import org.junit.jupiter.api.Test;
import trader.pipeline.model.TradeRecord;

import static org.assertj.core.api.Assertions.assertThat;

class TradeHistoryTest {

    @Test
    void keepsNewestTradesUpToCapacity() {
        TradeHistory history = new TradeHistory(3);
        for (int i = 1; i <= 5; i++) {
            history.add(TradeRecord.builder().id("T" + i).build());
        }

        assertThat(history.size()).isEqualTo(3);
        assertThat(history.recent(10)).extracting(TradeRecord::getId).containsExactly("T5", "T4", "T3");
        assertThat(history.recent(2)).extracting(TradeRecord::getId).containsExactly("T5", "T4");
    }
}
