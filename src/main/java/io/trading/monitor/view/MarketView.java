package io.trading.monitor.view;

/**
 * Optional read-only presentation of the market state.
 */
public interface MarketView {

    /**
     * Starts the view.
     *
     * @return true if the view is running after the call
     */
    boolean start();

    /**
     * Stops the view. Safe to call when not running.
     */
    void stop();

    boolean isRunning();
}
