package trader.pipeline.service.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import trader.pipeline.config.OrchestratorProperties;

import java.math.BigDecimal;

/**
 * Tracks total and reserved capital. Invariant: {@code 0 <= reservedCapital <= totalCapital}.
 * <p>
 * Only the trade worker reserves and releases; the methods are synchronized so that status reads
 * from other threads see a consistent pair.
 */
@Slf4j
@Component
public class CapitalLedger {

    private BigDecimal totalCapital;
    private BigDecimal reservedCapital = BigDecimal.ZERO;

    @Autowired
    public CapitalLedger(OrchestratorProperties properties) {
        this(properties.getCapital());
    }

    public CapitalLedger(BigDecimal totalCapital) {
        requireNonNegative(totalCapital, "Total capital");
        this.totalCapital = totalCapital;
    }

    /**
     * Reserves {@code amount} if it is available. Fails fast instead of waiting for a release.
     */
    public synchronized boolean tryReserve(BigDecimal amount) {
        requirePositive(amount);
        if (getAvailableCapital().compareTo(amount) < 0) {
            log.warn("Reservation of {} refused: available {}", amount, getAvailableCapital());
            return false;
        }
        reservedCapital = reservedCapital.add(amount);
        log.debug("Reserved {} (reserved now {} of {})", amount, reservedCapital, totalCapital);
        return true;
    }

    public synchronized void release(BigDecimal amount) {
        requirePositive(amount);
        if (reservedCapital.compareTo(amount) < 0) {
            throw new IllegalStateException("Cannot release " + amount + ", only " + reservedCapital + " reserved");
        }
        reservedCapital = reservedCapital.subtract(amount);
        log.debug("Released {} (reserved now {} of {})", amount, reservedCapital, totalCapital);
    }

    public synchronized void setTotalCapital(BigDecimal amount) {
        requireNonNegative(amount, "Total capital");
        if (amount.compareTo(reservedCapital) < 0) {
            throw new IllegalArgumentException("Total capital " + amount + " is below reserved capital " + reservedCapital);
        }
        log.info("Total capital set to {}", amount);
        totalCapital = amount;
    }

    /**
     * Books realized profit or loss into total capital. A loss never drops total below reserved capital.
     */
    public synchronized void applyProfit(BigDecimal profit) {
        BigDecimal updated = totalCapital.add(profit);
        totalCapital = updated.max(reservedCapital);
    }

    public synchronized BigDecimal getTotalCapital() {
        return totalCapital;
    }

    public synchronized BigDecimal getReservedCapital() {
        return reservedCapital;
    }

    public synchronized BigDecimal getAvailableCapital() {
        return totalCapital.subtract(reservedCapital);
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive: " + amount);
        }
    }

    private static void requireNonNegative(BigDecimal amount, String what) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException(what + " must not be negative: " + amount);
        }
    }
}
