package in.tradefuse.infrastructure.persistence;

import in.tradefuse.application.port.output.TradeBookkeeping;
import in.tradefuse.domain.trade.Position;
import in.tradefuse.domain.trade.TradeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * PostgreSQL implementation of TradeBookkeeping.
 *
 * The position row and the trade record are written on one connection in a single
 * transaction; any failure rolls both back.
 */
public final class PostgresTradeBookkeeping implements TradeBookkeeping {
    private static final Logger log = LoggerFactory.getLogger(PostgresTradeBookkeeping.class);

    private final DataSource dataSource;

    public PostgresTradeBookkeeping(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void recordEntry(Position opened, TradeRecord buy) {
        inTransaction("entry", opened, conn -> {
            PostgresPositionRepository.insert(conn, opened);
            PostgresTradeRecordRepository.append(conn, buy);
        });
        log.info("Entry booked: position {} {} order {}", opened.positionId(), opened.instrument(), buy.orderId());
    }

    @Override
    public void recordExit(Position closed, TradeRecord sell) {
        if (!closed.closed()) {
            throw new IllegalArgumentException("Exit bookkeeping needs a closed position: " + closed.positionId());
        }
        inTransaction("exit", closed, conn -> {
            PostgresPositionRepository.update(conn, closed);
            PostgresTradeRecordRepository.append(conn, sell);
        });
        log.info("Exit booked: position {} {} order {}", closed.positionId(), closed.instrument(), sell.orderId());
    }

    private void inTransaction(String kind, Position position, Work work) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                work.run(conn);
                conn.commit();
            } catch (Exception e) {
                rollback(conn, position);
                throw e;
            }
        } catch (Exception e) {
            log.error("Failed to book {} for position {}: {}", kind, position.positionId(), e.getMessage(), e);
            throw new RuntimeException("Failed to book " + kind + " for position " + position.positionId(), e);
        }
    }

    private static void rollback(Connection conn, Position position) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.error("Rollback failed for position {}: {}", position.positionId(), e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface Work {
        void run(Connection conn) throws Exception;
    }
}
