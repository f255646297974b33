package in.tradefuse.domain.trade;

public enum TradeAction {
    BUY,
    SELL
}
