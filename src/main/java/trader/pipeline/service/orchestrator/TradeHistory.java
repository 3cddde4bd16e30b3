package trader.pipeline.service.orchestrator;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import trader.pipeline.config.OrchestratorProperties;
import trader.pipeline.model.TradeRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded in-memory journal of finished trades, newest first on read.
 */
@Component
public class TradeHistory {

    private final int capacity;
    private final Deque<TradeRecord> trades = new ArrayDeque<>();

    @Autowired
    public TradeHistory(OrchestratorProperties properties) {
        this(properties.getTradeHistorySize());
    }

    public TradeHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Trade history capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public synchronized void add(TradeRecord trade) {
        trades.addLast(trade);
        while (trades.size() > capacity) {
            trades.removeFirst();
        }
    }

    public synchronized List<TradeRecord> recent(int limit) {
        List<TradeRecord> result = new ArrayList<>(Math.min(Math.max(limit, 0), trades.size()));
        Iterator<TradeRecord> newestFirst = trades.descendingIterator();
        while (newestFirst.hasNext() && result.size() < limit) {
            result.add(newestFirst.next());
        }
        return result;
    }

    public synchronized int size() {
        return trades.size();
    }
}
