package in.tradefuse.domain.order;

/**
 * Lifecycle of an order intent.
 */
public enum IntentStatus {
    CLAIMED, // Key reserved, order not yet acknowledged by the exchange
    PLACED, // Exchange returned an order id
    FAILED // Placement call failed; the key stays reserved
}
