package trader.pipeline.service.execution;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;
import trader.pipeline.model.ExecutionRequest;
import trader.pipeline.model.TradeStatus;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class PaperExecutionEngineTest {

    @Test
    void fillsAtQuotedPrices() {
        ExecutionRequest request = ExecutionRequest.builder()
                .tradeId("TRADE-1")
                .symbol("BTC")
                .buyVenue("alpha")
                .sellVenue("bravo")
                .buyPrice(new BigDecimal("100"))
                .sellPrice(new BigDecimal("102"))
                .quantity(new BigDecimal("10"))
                .expectedProfit(new BigDecimal("14.46"))
                .estimatedFees(new BigDecimal("5.54"))
                .build();

        StepVerifier.create(new PaperExecutionEngine().execute(request))
                .assertNext(report -> {
                    assertThat(report.getStatus()).isEqualTo(TradeStatus.EXECUTED);
                    assertThat(report.getActualProfit()).isEqualByComparingTo("14.46");
                    assertThat(report.getFees()).isEqualByComparingTo("5.54");
                    assertThat(report.getVolume()).isEqualByComparingTo("1000");
                })
                .verifyComplete();
    }
}
