package io.trading.monitor.command;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Named console commands. Names are case-insensitive; registration order is the help order.
 */
public class CommandRegistry {

    private final Map<String, Command> commands = new LinkedHashMap<>();

    /**
     * Registers a command.
     *
     * @throws IllegalArgumentException if the name is blank or already registered
     */
    public CommandRegistry register(String name, String description, CommandHandler handler) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or empty");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        String key = name.toLowerCase(Locale.ROOT);
        if (commands.containsKey(key)) {
            throw new IllegalArgumentException("Command already registered: " + name);
        }
        commands.put(key, new Command(key, description == null ? "" : description, handler));
        return this;
    }

    public Command find(String name) {
        return name == null ? null : commands.get(name.toLowerCase(Locale.ROOT));
    }

    public List<Command> commands() {
        return Collections.unmodifiableList(new ArrayList<>(commands.values()));
    }

    public record Command(String name, String description, CommandHandler handler) {
    }

    /**
     * Executes one command invocation.
     */
    @FunctionalInterface
    public interface CommandHandler {
        /**
         * @param args    Whitespace-separated arguments after the command name
         * @param console Console to report results on
         */
        void execute(List<String> args, CommandConsole console);
    }
}
