package in.tradefuse.application.port.output;

import in.tradefuse.domain.trade.TradeRecord;

import java.time.Instant;
import java.util.List;

/**
 * Append-only trade log.
 */
public interface TradeRecordRepository {

    void append(TradeRecord record);

    /**
     * Records of one instrument at or after since, oldest first.
     */
    List<TradeRecord> findByInstrumentSince(String instrument, Instant since);
}
