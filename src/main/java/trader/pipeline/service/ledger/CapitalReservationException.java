package trader.pipeline.service.ledger;

import java.math.BigDecimal;

/**
 * A reservation was refused after admission had already seen enough capital. The opportunity is dropped.
 */
public class CapitalReservationException extends RuntimeException {

    public CapitalReservationException(BigDecimal requested, BigDecimal available) {
        super("Cannot reserve " + requested.toPlainString() + ", only " + available.toPlainString() + " available");
    }
}
