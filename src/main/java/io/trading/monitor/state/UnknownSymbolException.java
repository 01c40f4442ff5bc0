package io.trading.monitor.state;

/**
 * Thrown when a record refers to a symbol outside the tracked set.
 */
public class UnknownSymbolException extends RuntimeException {

    private final String symbol;

    public UnknownSymbolException(String symbol) {
        super("Untracked symbol: " + symbol);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
