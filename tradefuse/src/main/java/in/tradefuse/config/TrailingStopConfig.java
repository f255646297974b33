package in.tradefuse.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.List;

/**
 * Configuration for the trailing stop exit strategy.
 *
 * Controls when the trailing stop activates, how far it trails the peak at each gain tier,
 * and the initial protective levels of a new position.
 *
 * A tier only takes effect while the position is still open at that gain. With the default
 * 10% take-profit the 12% tier never applies: the peak that would reach it is already at or
 * above take-profit, so the position exits first. It applies once takeProfitPercent is
 * configured above 12. See {@link #unreachableTiers()}.
 */
public record TrailingStopConfig(
    @JsonProperty("activationPercent")
    double activationPercent,       // Gain from entry to peak (%) before trailing starts (e.g., 3.0)

    @JsonProperty("tiers")
    List<TrailTier> tiers,          // Trail distance from peak per gain tier

    @JsonProperty("roundTripFeePercent")
    double roundTripFeePercent,     // Floor of a trailing stop above entry (breakeven plus fees)

    @JsonProperty("initialStopLossPercent")
    double initialStopLossPercent,  // Stop below entry at open (e.g., 5.0)

    @JsonProperty("takeProfitPercent")
    double takeProfitPercent        // Take-profit above entry at open (e.g., 10.0)
) {
    /**
     * Gains of at least minGainPercent trail the peak by trailPercent.
     */
    public record TrailTier(
        @JsonProperty("minGainPercent") double minGainPercent,
        @JsonProperty("trailPercent") double trailPercent
    ) {}

    public static TrailingStopConfig defaults() {
        return new TrailingStopConfig(
            3.0,
            List.of(
                new TrailTier(3.0, 2.0),
                new TrailTier(6.0, 1.5),
                new TrailTier(9.0, 1.2),
                new TrailTier(12.0, 1.0)
            ),
            0.2,
            5.0,
            10.0
        );
    }

    /**
     * Trail percentage for a gain, or 0 when below activation.
     */
    public double trailPercentFor(double gainPercent) {
        if (gainPercent < activationPercent) {
            return 0.0;
        }
        return tiers.stream()
            .sorted(Comparator.comparingDouble(TrailTier::minGainPercent).reversed())
            .filter(t -> gainPercent >= t.minGainPercent())
            .mapToDouble(TrailTier::trailPercent)
            .findFirst()
            .orElse(0.0);
    }

    /**
     * Tiers starting at or above take-profit; a position exits before its peak can reach them.
     */
    public List<TrailTier> unreachableTiers() {
        if (tiers == null) {
            return List.of();
        }
        return tiers.stream()
            .filter(t -> t.minGainPercent() >= takeProfitPercent)
            .sorted(Comparator.comparingDouble(TrailTier::minGainPercent))
            .toList();
    }

    public boolean isValid() {
        if (tiers == null || tiers.isEmpty()) {
            return false;
        }
        // Tighter trail at higher gain
        List<TrailTier> sorted = tiers.stream()
            .sorted(Comparator.comparingDouble(TrailTier::minGainPercent))
            .toList();
        double previous = Double.MAX_VALUE;
        for (TrailTier tier : sorted) {
            if (tier.trailPercent() <= 0 || tier.trailPercent() >= 100 || tier.trailPercent() > previous) {
                return false;
            }
            previous = tier.trailPercent();
        }
        return activationPercent > 0 && activationPercent <= 100
            && sorted.get(0).minGainPercent() <= activationPercent
            && roundTripFeePercent >= 0 && roundTripFeePercent < activationPercent
            && initialStopLossPercent > 0 && initialStopLossPercent < 100
            && takeProfitPercent > 0;
    }
}
