package com.planetary.api.config;

import com.planetary.api.service.DatabaseAdminService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Runs the admin commands named on the command line, in the order given.
 *
 * <pre>
 * java -jar planetary-api.jar db_drop db_create db_seed
 * </pre>
 *
 * Arguments that are not admin commands are ignored here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseCommandRunner implements ApplicationRunner {

    private final DatabaseAdminService databaseAdminService;

    @Override
    public void run(ApplicationArguments args) {
        for (String argument : args.getNonOptionArgs()) {
            DatabaseCommand.fromArgument(argument).ifPresent(this::execute);
        }
    }

    void execute(DatabaseCommand command) {
        log.info("Running admin command: {}", command.getArgument());
        switch (command) {
            case DB_CREATE -> databaseAdminService.createAll();
            case DB_DROP -> databaseAdminService.dropAll();
            case DB_SEED -> databaseAdminService.seed();
        }
    }
}
