package in.tradefuse.domain.signal;

/**
 * Directional-agreement adjustment applied to an aggregated score.
 */
public enum AlignmentAdjustment {
    BONUS,
    PENALTY,
    NONE
}
