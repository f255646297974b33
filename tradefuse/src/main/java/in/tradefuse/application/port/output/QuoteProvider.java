package in.tradefuse.application.port.output;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Independent live quote, used to sanity-check fills and drive the trailing stop.
 */
public interface QuoteProvider {

    Optional<BigDecimal> lastPrice(String instrument);
}
