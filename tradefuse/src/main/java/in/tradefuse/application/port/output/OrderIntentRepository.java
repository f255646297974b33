package in.tradefuse.application.port.output;

import in.tradefuse.domain.order.OrderIntent;

import java.util.Optional;

/**
 * Idempotency keys for order placement.
 */
public interface OrderIntentRepository {

    /**
     * Atomically reserve the intent key.
     *
     * @return true if this call created the intent, false if the key already existed
     */
    boolean claim(OrderIntent intent);

    void markPlaced(String intentKey, String orderId);

    void markFailed(String intentKey, String detail);

    Optional<OrderIntent> find(String intentKey);
}
