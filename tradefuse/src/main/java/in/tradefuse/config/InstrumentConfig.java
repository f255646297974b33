package in.tradefuse.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Per-instrument trading rules.
 */
public record InstrumentConfig(
    @JsonProperty("symbol")
    String symbol,                  // Exchange pair, e.g. eth_jpy

    @JsonProperty("baseAsset")
    String baseAsset,

    @JsonProperty("quoteAsset")
    String quoteAsset,

    @JsonProperty("minOrderQuantity")
    BigDecimal minOrderQuantity,

    @JsonProperty("quantityScale")
    int quantityScale,              // Decimal places accepted for order quantities

    @JsonProperty("baselineBandWidth")
    double baselineBandWidth,       // Typical Bollinger band width for volatility calibration

    @JsonProperty("reference")
    boolean reference               // Reference asset: no dominance correction
) {
    public static InstrumentConfig of(String base, String quote, String minQty, int scale,
                                      double baselineBandWidth, boolean reference) {
        return new InstrumentConfig(base + "_" + quote, base, quote, new BigDecimal(minQty), scale,
            baselineBandWidth, reference);
    }

    public boolean isValid() {
        return symbol != null && !symbol.isBlank()
            && baseAsset != null && !baseAsset.isBlank()
            && quoteAsset != null && !quoteAsset.isBlank()
            && minOrderQuantity != null && minOrderQuantity.signum() > 0
            && quantityScale >= 0
            && baselineBandWidth > 0;
    }
}
