package com.planetary.api;

import com.planetary.api.config.DatabaseCommand;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * PlanetaryApiApplication - Main entry point for the Planetary API.
 *
 * The service exposes:
 * - Public read access to the planet catalogue
 * - Registration, login and password recovery for users
 * - Token-guarded planet add / update / remove
 *
 * Runtime Context:
 * - Runs on port 5000 (configured in application.yml)
 * - Connects to an H2 file database by default, any JDBC store via DATABASE_URL
 * - Stateless design - callers prove identity with a signed JWT per request
 *
 * Administrative commands (db_create, db_drop, db_seed) are passed as program
 * arguments. When one is present the context starts without a web server, the
 * commands run in order and the process exits.
 *
 * @see com.planetary.api.controller.PlanetController for the planet endpoints
 * @see com.planetary.api.controller.AuthController for the account endpoints
 * @see com.planetary.api.config.DatabaseCommandRunner for the admin commands
 */
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class PlanetaryApiApplication {

    /**
     * Application entry point.
     *
     * @param args Command-line arguments; admin command names switch the
     *             application into one-shot maintenance mode
     */
    public static void main(String[] args) {
        if (DatabaseCommand.anyPresent(args)) {
            System.exit(SpringApplication.exit(runAdminCommands(args)));
        }
        SpringApplication.run(PlanetaryApiApplication.class, args);
    }

    /**
     * Start a context without a web server; DatabaseCommandRunner executes the
     * admin commands found in {@code args} during startup.
     *
     * @return the started context, for the caller to close
     */
    static ConfigurableApplicationContext runAdminCommands(String... args) {
        return new SpringApplicationBuilder(PlanetaryApiApplication.class)
                .web(WebApplicationType.NONE)
                .run(args);
    }
}
