package in.tradefuse.domain.signal;

public enum OutcomeLabel {
    WIN,
    LOSS,
    DRAW
}
