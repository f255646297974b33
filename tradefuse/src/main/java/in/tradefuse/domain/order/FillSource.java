package in.tradefuse.domain.order;

/**
 * Where a fill's quantity and price came from.
 */
public enum FillSource {
    EXCHANGE, // Reported by the exchange's execution history
    BALANCE_ESTIMATE, // Derived from the balance change around the order
    LIVE_QUOTE // Price taken from an independent live quote
}
