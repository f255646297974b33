package in.tradefuse.domain.signal;

import java.util.List;

/**
 * The four signal components on a common [-1, 1] scale.
 *
 * forecast is already confidence-damped. missingComponents names the components
 * that were replaced by their neutral default.
 */
public record NormalizedComponents(
    double technical,
    double forecast,
    double sentiment,
    double macro,
    double forecastConfidence,
    List<String> missingComponents
) {
    public NormalizedComponents {
        missingComponents = missingComponents == null ? List.of() : List.copyOf(missingComponents);
    }

    public boolean isLowConfidence() {
        return !missingComponents.isEmpty();
    }
}
