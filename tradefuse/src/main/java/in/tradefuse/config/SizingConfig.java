package in.tradefuse.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;

/**
 * Kelly sizing parameters and the fallback table used while trade history is thin.
 */
public record SizingConfig(
    @JsonProperty("lookbackDays")
    int lookbackDays,

    @JsonProperty("minTradesForKelly")
    int minTradesForKelly,

    @JsonProperty("fallbackBands")
    List<FallbackBand> fallbackBands,

    @JsonProperty("kellyMultiplier")
    double kellyMultiplier,          // 0.5 = Half-Kelly

    @JsonProperty("strongScore")
    double strongScore,              // Score at which the strength factor reaches 1.0

    @JsonProperty("minScoreFactor")
    double minScoreFactor,           // Strength factor at the BUY threshold

    @JsonProperty("minFraction")
    double minFraction,

    @JsonProperty("maxFraction")
    double maxFraction,

    @JsonProperty("reserveAmount")
    BigDecimal reserveAmount,        // Quote currency always kept aside

    @JsonProperty("minOrderAmount")
    BigDecimal minOrderAmount,       // Orders below this quote amount are rejected

    @JsonProperty("takerFeeRate")
    double takerFeeRate,

    @JsonProperty("amountScale")
    int amountScale                  // Decimal places of the quote amount sent to the exchange
) {
    /**
     * Score band of the fallback table: scores at or above minScore get fraction.
     */
    public record FallbackBand(
        @JsonProperty("minScore") double minScore,
        @JsonProperty("fraction") double fraction
    ) {}

    public static SizingConfig defaults() {
        return new SizingConfig(
            90,
            5,
            List.of(
                new FallbackBand(0.45, 0.80),
                new FallbackBand(0.35, 0.60),
                new FallbackBand(0.25, 0.40),
                new FallbackBand(0.15, 0.25)
            ),
            0.5,
            0.70,
            0.3,
            0.10,
            0.80,
            new BigDecimal("1000"),
            new BigDecimal("500"),
            0.0,
            0
        );
    }

    /**
     * Fraction from the fallback table; the highest band the score reaches wins.
     */
    public double fallbackFraction(double score) {
        return fallbackBands.stream()
            .sorted(Comparator.comparingDouble(FallbackBand::minScore).reversed())
            .filter(b -> score >= b.minScore())
            .mapToDouble(FallbackBand::fraction)
            .findFirst()
            .orElse(minFraction);
    }

    public boolean isValid() {
        if (fallbackBands == null || reserveAmount == null || minOrderAmount == null) {
            return false;
        }
        // Fallback table must be monotonic: higher score band, higher or equal fraction
        List<FallbackBand> sorted = fallbackBands.stream()
            .sorted(Comparator.comparingDouble(FallbackBand::minScore))
            .toList();
        double previous = minFraction;
        for (FallbackBand band : sorted) {
            if (band.fraction() < previous || band.fraction() > maxFraction) return false;
            previous = band.fraction();
        }
        return lookbackDays > 0
            && minTradesForKelly > 0
            && kellyMultiplier > 0 && kellyMultiplier <= 1
            && minScoreFactor > 0 && minScoreFactor <= 1
            && minFraction > 0 && maxFraction >= minFraction && maxFraction <= 1
            && reserveAmount.signum() >= 0
            && minOrderAmount.signum() > 0
            && takerFeeRate >= 0 && takerFeeRate < 0.1
            && amountScale >= 0;
    }
}
