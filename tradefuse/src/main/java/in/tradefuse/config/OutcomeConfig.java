package in.tradefuse.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.tradefuse.domain.signal.OutcomeWindow;

import java.util.List;

/**
 * Outcome labeling of past decisions.
 */
public record OutcomeConfig(
    @JsonProperty("windows")
    List<OutcomeWindow> windows,

    @JsonProperty("winThresholdPercent")
    double winThresholdPercent      // Moves within +/- this are a DRAW
) {
    public static OutcomeConfig defaults() {
        return new OutcomeConfig(List.of(OutcomeWindow.values()), 0.3);
    }

    public boolean isValid() {
        return windows != null && !windows.isEmpty() && winThresholdPercent >= 0;
    }
}
