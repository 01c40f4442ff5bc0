package io.trading.monitor.state;

/**
 * Thrown when an order book update arrives with a sequence below the stored one.
 * The stored book is left untouched; the caller is expected to resynchronize.
 */
public class SequenceDesyncException extends RuntimeException {

    private final String symbol;
    private final long storedSequence;
    private final long receivedSequence;

    public SequenceDesyncException(String symbol, long storedSequence, long receivedSequence) {
        super("Order book sequence regression for " + symbol
            + ": stored=" + storedSequence + ", received=" + receivedSequence);
        this.symbol = symbol;
        this.storedSequence = storedSequence;
        this.receivedSequence = receivedSequence;
    }

    public String getSymbol() {
        return symbol;
    }

    public long getStoredSequence() {
        return storedSequence;
    }

    public long getReceivedSequence() {
        return receivedSequence;
    }
}
