package com.planetary.api.config;

import java.util.Arrays;
import java.util.Optional;

/**
 * Administrative commands accepted as program arguments.
 */
public enum DatabaseCommand {
    DB_CREATE("db_create"),
    DB_DROP("db_drop"),
    DB_SEED("db_seed");

    private final String argument;

    DatabaseCommand(String argument) {
        this.argument = argument;
    }

    public String getArgument() {
        return argument;
    }

    public static Optional<DatabaseCommand> fromArgument(String argument) {
        return Arrays.stream(values())
                .filter(command -> command.argument.equals(argument))
                .findFirst();
    }

    public static boolean anyPresent(String... args) {
        return Arrays.stream(args).anyMatch(arg -> fromArgument(arg).isPresent());
    }
}
