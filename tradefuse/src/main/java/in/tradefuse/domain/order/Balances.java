package in.tradefuse.domain.order;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Per-asset exchange balances. Asset codes are lower case (e.g. "jpy", "eth").
 */
public record Balances(
    Map<String, BigDecimal> free,
    Map<String, BigDecimal> reserved
) {
    public Balances {
        free = free == null ? Map.of() : Map.copyOf(free);
        reserved = reserved == null ? Map.of() : Map.copyOf(reserved);
    }

    public BigDecimal free(String asset) {
        return free.getOrDefault(asset, BigDecimal.ZERO);
    }

    public BigDecimal reserved(String asset) {
        return reserved.getOrDefault(asset, BigDecimal.ZERO);
    }
}
