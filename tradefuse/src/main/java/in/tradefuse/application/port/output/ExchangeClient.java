package in.tradefuse.application.port.output;

import in.tradefuse.domain.order.Balances;
import in.tradefuse.domain.order.Fill;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Spot exchange. Order placement is state-mutating and must never be retried blindly.
 *
 * All methods throw {@link ExchangeException} on failure.
 */
public interface ExchangeClient {

    /**
     * Market buy spending quoteAmount of the quote currency.
     *
     * @return exchange order id
     */
    String placeMarketBuy(String instrument, BigDecimal quoteAmount);

    /**
     * Market sell of quantity base units.
     *
     * @return exchange order id
     */
    String placeMarketSell(String instrument, BigDecimal quantity);

    /**
     * Aggregated fill of an order, or empty while execution data is not yet available.
     */
    Optional<Fill> getFill(String instrument, String orderId);

    Balances getBalances();
}
