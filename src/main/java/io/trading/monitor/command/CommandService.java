package io.trading.monitor.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads operator commands on a dedicated thread and dispatches them through a {@link CommandRegistry}.
 */
public class CommandService {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandService.class);

    private static final long STOP_TIMEOUT_MS = 2000;

    private final CommandRegistry registry;
    private final CommandConsole console;

    private Thread thread;
    private volatile boolean running = false;

    public CommandService(CommandRegistry registry, CommandConsole console) {
        this.registry = registry;
        this.console = console;
    }

    /**
     * Starts the command loop thread.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        thread = new Thread(this::runLoop, "command-loop");
        thread.setDaemon(true);
        thread.start();
        LOGGER.info("Command service started ({} commands)", registry.commands().size());
    }

    /**
     * Ends the command loop. Safe to call more than once and from a command handler.
     */
    public void stop() {
        Thread loop;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            loop = thread;
            thread = null;
        }

        if (loop != null && loop != Thread.currentThread()) {
            loop.interrupt();
            try {
                // A loop blocked on stdin cannot be interrupted; it is a daemon thread and exits with the JVM
                loop.join(STOP_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        LOGGER.info("Command service stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Parses and runs one command line. Never throws; failures are reported on the console.
     *
     * @return false if the line was not a known command
     */
    public boolean dispatch(String line) {
        if (line == null || line.isBlank()) {
            return true;
        }

        List<String> tokens = new ArrayList<>(Arrays.asList(line.trim().split("\\s+")));
        String name = tokens.remove(0);

        CommandRegistry.Command command = registry.find(name);
        if (command == null) {
            console.report("Unknown command: " + name + ". Type 'help' for available commands.", Severity.ERROR);
            return false;
        }

        LOGGER.debug("Executing command: {} {}", command.name(), tokens);
        try {
            command.handler().execute(tokens, console);
        } catch (RuntimeException e) {
            LOGGER.error("Command '{}' failed", command.name(), e);
            console.report("Command '" + command.name() + "' failed: " + e.getMessage(), Severity.ERROR);
        }
        return true;
    }

    private void runLoop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            String line;
            try {
                line = console.readCommand();
            } catch (IOException e) {
                if (running) {
                    LOGGER.error("Error reading command input", e);
                    console.report("Error reading command input: " + e.getMessage(), Severity.ERROR);
                }
                break;
            }

            if (line == null) {
                LOGGER.info("Command input closed");
                break;
            }
            if (!running) {
                break;
            }
            dispatch(line);
        }
        LOGGER.debug("Command loop exited");
    }
}
