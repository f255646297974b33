package in.tradefuse.application.port.output;

import in.tradefuse.domain.order.OrderRequest;

/**
 * Hands order requests from scoring/monitoring to execution.
 *
 * Publishing the same requestId twice must enqueue it once.
 */
public interface OrderPublisher {

    void publish(OrderRequest request);
}
