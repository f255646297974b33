package in.tradefuse.domain.signal;

import java.time.Instant;
import java.util.List;

/**
 * Market-wide context: score in [-1, 1], regime classification and dominance trend.
 */
public record MacroResult(
    ComponentStatus status,
    double score,
    MacroRegime regime,
    DominanceTrend dominanceTrend,
    List<String> labels,
    Instant observedAt
) {
    public MacroResult {
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    public static MacroResult present(double score, MacroRegime regime, DominanceTrend dominanceTrend,
                                      List<String> labels, Instant observedAt) {
        return new MacroResult(ComponentStatus.PRESENT, score, regime, dominanceTrend, labels, observedAt);
    }

    public static MacroResult missing() {
        return new MacroResult(ComponentStatus.MISSING, 0.0, MacroRegime.NEUTRAL, DominanceTrend.FLAT, List.of(), null);
    }

    public MacroResult asStale() {
        return new MacroResult(ComponentStatus.STALE, score, regime, dominanceTrend, labels, observedAt);
    }

    public boolean isUsable() {
        return status.isUsable();
    }

    /**
     * True only for a fresh reading in an extreme-fear or extreme-greed regime.
     */
    public boolean isExtreme() {
        return isUsable() && regime.isExtreme();
    }
}
