package in.tradefuse.application.port.input;

import in.tradefuse.domain.order.BatchResult;
import in.tradefuse.domain.order.OrderBatch;

/**
 * Message-driven execution unit of work.
 */
public interface ExecutionTask {

    /**
     * Process the batch sequentially. Per-request failures are reported in the result,
     * never re-raised, so a transport cannot replay orders that already reached the exchange.
     */
    BatchResult consume(InvocationContext ctx, OrderBatch batch);
}
