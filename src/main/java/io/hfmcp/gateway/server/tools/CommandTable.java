package io.hfmcp.gateway.server.tools;

import io.hfmcp.gateway.protocol.InputSchema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Sub-commands of a multi-operation tool, by operation name.
 *
 * @param <C> the context each command handler receives
 */
public final class CommandTable<C> {

    /**
     * Executes one operation with arguments already validated against the command's schema.
     */
    @FunctionalInterface
    public interface CommandHandler<C> {
        Map<String, Object> execute(Map<String, Object> arguments, C context) throws Exception;
    }

    /**
     * One operation: its description, argument schema and handler.
     */
    public record Command<C>(String description, InputSchema arguments, CommandHandler<C> handler) {
    }

    private final Map<String, Command<C>> commands;

    private CommandTable(Map<String, Command<C>> commands) {
        this.commands = Collections.unmodifiableMap(new LinkedHashMap<>(commands));
    }

    public static <C> Builder<C> builder() {
        return new Builder<>();
    }

    public Optional<Command<C>> find(String operation) {
        return Optional.ofNullable(commands.get(operation));
    }

    public Set<String> operations() {
        return commands.keySet();
    }

    /**
     * One line per operation: name and description.
     */
    public String usage() {
        StringBuilder text = new StringBuilder();
        commands.forEach((name, command) -> text.append("- ").append(name).append(": ").append(command.description()).append('\n'));
        return text.toString();
    }

    public static class Builder<C> {
        private final Map<String, Command<C>> commands = new LinkedHashMap<>();

        public Builder<C> command(String operation, String description, InputSchema arguments, CommandHandler<C> handler) {
            if (commands.putIfAbsent(operation, new Command<>(description, arguments, handler)) != null) {
                throw new IllegalStateException("Duplicate operation: " + operation);
            }
            return this;
        }

        public CommandTable<C> build() {
            return new CommandTable<>(commands);
        }
    }
}
