package in.tradefuse.application.port.output;

import in.tradefuse.domain.trade.Position;
import in.tradefuse.domain.trade.TradeRecord;

/**
 * Books a fill as one Position write plus its TradeRecord, all or nothing.
 *
 * When either write fails, neither is visible afterwards and the failure propagates.
 */
public interface TradeBookkeeping {

    /**
     * Insert a newly opened position together with its BUY record.
     */
    void recordEntry(Position opened, TradeRecord buy);

    /**
     * Persist a closed position together with its SELL record.
     */
    void recordExit(Position closed, TradeRecord sell);
}
