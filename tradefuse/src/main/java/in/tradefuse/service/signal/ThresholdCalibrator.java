package in.tradefuse.service.signal;

import in.tradefuse.config.ThresholdConfig;
import in.tradefuse.domain.signal.MacroResult;
import in.tradefuse.domain.signal.ThresholdSet;

/**
 * Threshold Calibrator - adapts BUY/SELL thresholds to volatility and macro mood.
 *
 * ratio = clamp(bandWidth / baselineBandWidth, minRatio, maxRatio)
 * buy   = min(baseBuy * ratio + (extreme macro ? adder : 0), ceiling)
 * sell  = baseSell * ratio
 *
 * The macro correction never touches SELL so exits stay reachable in any market mood.
 */
public final class ThresholdCalibrator {

    private final ThresholdConfig config;

    public ThresholdCalibrator(ThresholdConfig config) {
        this.config = config;
    }

    /**
     * @param bandWidth         Current band width of the instrument; 0 or non-finite when unknown
     * @param baselineBandWidth Typical band width of the instrument
     * @param macro             Macro context; only a fresh extreme reading moves the BUY threshold
     */
    public ThresholdSet calibrate(String instrument, double bandWidth, double baselineBandWidth, MacroResult macro) {
        double ratio = volatilityRatio(bandWidth, baselineBandWidth);
        boolean macroAdjusted = macro != null && macro.isExtreme();
        double adder = macroAdjusted ? config.macroAdder() : 0.0;

        double buy = Math.min(config.baseBuy() * ratio + adder, config.buyCeiling());
        double sell = config.baseSell() * ratio;

        return new ThresholdSet(instrument, Scores.clampUnit(buy), Scores.clampUnit(sell), ratio, macroAdjusted);
    }

    /**
     * Clamped volatility ratio; 1.0 when either width is unknown.
     */
    public double volatilityRatio(double bandWidth, double baselineBandWidth) {
        if (!Double.isFinite(bandWidth) || bandWidth <= 0 || !Double.isFinite(baselineBandWidth) || baselineBandWidth <= 0) {
            return 1.0;
        }
        return Scores.clamp(bandWidth / baselineBandWidth, config.minVolatilityRatio(), config.maxVolatilityRatio());
    }
}
