package trader.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class Fees {
    BigDecimal maker;
    BigDecimal taker;
    BigDecimal network;
    BigDecimal buyFee;
    BigDecimal sellFee;

    public BigDecimal getTotal() {
        return maker.add(taker).add(network);
    }
}
