package io.trading.monitor.command;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;

/**
 * {@link CommandConsole} over a line-oriented input stream and a print stream (stdin/stdout by default).
 *
 * Output is a plain transcript, so nothing is ever overwritten: transient reports carry an
 * HH:mm:ss prefix, persistent ones only the severity label.
 */
public class ConsoleCommandIO implements CommandConsole {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final BufferedReader reader;
    private final PrintStream out;

    public ConsoleCommandIO() {
        this(System.in, System.out);
    }

    public ConsoleCommandIO(InputStream in, PrintStream out) {
        this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public String readCommand() throws IOException {
        return reader.readLine();
    }

    @Override
    public void report(String message, Severity severity) {
        synchronized (out) {
            out.printf("%s [%s] %s%n", LocalTime.now().format(TIME_FORMAT), severity.getLabel(), message);
            out.flush();
        }
    }

    @Override
    public void reportPersistent(String message, Severity severity) {
        synchronized (out) {
            out.printf("[%s] %s%n", severity.getLabel(), message);
            out.flush();
        }
    }
}
