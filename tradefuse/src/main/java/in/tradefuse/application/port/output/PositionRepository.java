package in.tradefuse.application.port.output;

import in.tradefuse.domain.trade.Position;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Position store. Writes are last-writer-wins per position.
 */
public interface PositionRepository {

    void insert(Position position);

    void update(Position position);

    Optional<Position> findOpen(String instrument);

    List<Position> findAllOpen();

    /**
     * Positions closed at or after since, most recent exit first.
     */
    List<Position> findClosedSince(Instant since);
}
