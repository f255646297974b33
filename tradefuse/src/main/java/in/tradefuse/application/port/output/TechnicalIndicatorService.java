package in.tradefuse.application.port.output;

import in.tradefuse.domain.data.Timeframe;
import in.tradefuse.domain.signal.TechnicalResult;

/**
 * Technical-indicator collaborator.
 */
public interface TechnicalIndicatorService {

    /**
     * Latest technical result, or a MISSING result when none exists.
     */
    TechnicalResult latest(String instrument, Timeframe timeframe);
}
