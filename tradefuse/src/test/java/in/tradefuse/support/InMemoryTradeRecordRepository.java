package in.tradefuse.support;

import in.tradefuse.application.port.output.TradeRecordRepository;
import in.tradefuse.domain.trade.TradeRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class InMemoryTradeRecordRepository implements TradeRecordRepository {

    private final List<TradeRecord> records = new ArrayList<>();
    private boolean failWrites;

    @Override
    public void append(TradeRecord record) {
        if (failWrites) {
            throw new RuntimeException("trade store unavailable");
        }
        records.add(record);
    }

    @Override
    public List<TradeRecord> findByInstrumentSince(String instrument, Instant since) {
        return records.stream()
            .filter(r -> r.instrument().equals(instrument) && !r.timestamp().isBefore(since))
            .toList();
    }

    public List<TradeRecord> all() {
        return List.copyOf(records);
    }

    public void failWrites(boolean fail) {
        this.failWrites = fail;
    }
}
