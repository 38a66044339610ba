package com.planetary.api;

import com.planetary.api.config.DatabaseCommandRunner;
import com.planetary.api.entity.Planet;
import com.planetary.api.repository.PlanetRepository;
import com.planetary.api.repository.UserRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.jdbc.core.JdbcTemplate;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Starts the application the way the admin command line does: no web server,
 * no Hibernate DDL, tables only from db_create.
 */
@DisplayName("Admin command mode tests")
class AdminCommandsTest {

    private static final String TABLE_COUNT_SQL = "SELECT COUNT(*) FROM INFORMATION_SCHEMA.TABLES "
            + "WHERE TABLE_SCHEMA = 'PUBLIC' AND TABLE_NAME IN ('PLANETS', 'USERS')";

    private static String[] adminArgs(String database, String... commands) {
        String[] args = new String[commands.length + 2];
        args[0] = "--spring.datasource.url=jdbc:h2:mem:" + database + ";DB_CLOSE_DELAY=-1";
        args[1] = "--spring.jpa.hibernate.ddl-auto=none";
        System.arraycopy(commands, 0, args, 2, commands.length);
        return args;
    }

    private static Integer tableCount(ConfigurableApplicationContext context) {
        return context.getBean(JdbcTemplate.class).queryForObject(TABLE_COUNT_SQL, Integer.class);
    }

    @Test
    @DisplayName("db_drop on a fresh store leaves it without tables and no web security")
    void dropOnFreshStore_NoSchema() {
        // when
        try (ConfigurableApplicationContext context =
                     PlanetaryApiApplication.runAdminCommands(adminArgs("admin-empty", "db_drop"))) {
            // then
            assertThat(context.containsBean("securityFilterChain")).isFalse();
            assertThat(tableCount(context)).isZero();
        }
    }

    @Test
    @DisplayName("db_create and db_seed build and fill the tables, db_drop removes them")
    void createSeedDrop() {
        // when: db_create then db_seed at startup
        try (ConfigurableApplicationContext context =
                     PlanetaryApiApplication.runAdminCommands(adminArgs("admin-commands", "db_create", "db_seed"))) {

            // then: both tables exist and hold the bootstrap data
            assertThat(tableCount(context)).isEqualTo(2);
            PlanetRepository planetRepository = context.getBean(PlanetRepository.class);
            UserRepository userRepository = context.getBean(UserRepository.class);
            assertThat(planetRepository.count()).isEqualTo(3);
            assertThat(planetRepository.findAll())
                    .extracting(Planet::getPlanetName)
                    .containsExactlyInAnyOrder("Mercury", "Venus", "Earth");
            assertThat(userRepository.count()).isEqualTo(1);
            assertThat(userRepository.findByEmailAndPassword("jemima_eloise@earth.com", "chulis2022")).isPresent();

            // when: db_drop
            context.getBean(DatabaseCommandRunner.class).run(new DefaultApplicationArguments("db_drop"));

            // then: the tables are gone
            assertThat(tableCount(context)).isZero();
        }
    }
}
