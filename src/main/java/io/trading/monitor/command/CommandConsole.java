package io.trading.monitor.command;

import java.io.IOException;

/**
 * Operator console: a source of command lines and a sink for reports.
 */
public interface CommandConsole {

    /**
     * Blocks until the next command line is available.
     *
     * @return the line, or null at end of input
     * @throws IOException if reading failed
     */
    String readCommand() throws IOException;

    /**
     * Reports a transient message: command output, connection changes, flush results.
     * A line console prints it with a time of day; a console with a status area may
     * replace it with the next transient message.
     */
    void report(String message, Severity severity);

    /**
     * Reports a message on the non-expiring channel (startup banner, shutdown notices).
     * Never replaced by later reports. Defaults to {@link #report}, for consoles with one channel.
     */
    default void reportPersistent(String message, Severity severity) {
        report(message, severity);
    }
}
