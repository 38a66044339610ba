package com.planetary.api.service;

import com.planetary.api.entity.Planet;
import com.planetary.api.entity.User;
import com.planetary.api.repository.PlanetRepository;
import com.planetary.api.repository.UserRepository;
import jakarta.persistence.EntityManagerFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.SessionFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * DatabaseAdminService - schema create/drop and bootstrap data.
 *
 * Not reachable over HTTP; driven by {@link com.planetary.api.config.DatabaseCommandRunner}.
 * Schema operations use Hibernate's SchemaManager against the mapped entities,
 * so the tables always match the JPA model.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatabaseAdminService {

    private final EntityManagerFactory entityManagerFactory;
    private final PlanetRepository planetRepository;
    private final UserRepository userRepository;

    public void createAll() {
        sessionFactory().getSchemaManager().exportMappedObjects(true);
        log.info("Database created");
    }

    public void dropAll() {
        sessionFactory().getSchemaManager().dropMappedObjects(true);
        log.info("Database dropped");
    }

    /**
     * Insert the three inner planets and one test user. Records that already
     * exist (same planet name, same email) are left alone.
     *
     * @return number of rows inserted
     */
    @Transactional
    public int seed() {
        int inserted = 0;
        for (Planet planet : seedPlanets()) {
            if (planetRepository.existsByPlanetName(planet.getPlanetName())) {
                log.info("Seed planet already present: {}", planet.getPlanetName());
                continue;
            }
            planetRepository.save(planet);
            inserted++;
        }

        User testUser = seedUser();
        if (userRepository.existsByEmail(testUser.getEmail())) {
            log.info("Seed user already present: {}", testUser.getEmail());
        } else {
            userRepository.save(testUser);
            inserted++;
        }

        log.info("Database seeded: {} rows inserted", inserted);
        return inserted;
    }

    static List<Planet> seedPlanets() {
        return List.of(
                Planet.builder()
                        .planetName("Mercury")
                        .planetType("Class D")
                        .homeStar("Sol")
                        .mass(3.258e23)
                        .radius(1516.0)
                        .distance(35.98e6)
                        .build(),
                Planet.builder()
                        .planetName("Venus")
                        .planetType("Class K")
                        .homeStar("Sol")
                        .mass(4.867e24)
                        .radius(3760.0)
                        .distance(67.24e6)
                        .build(),
                Planet.builder()
                        .planetName("Earth")
                        .planetType("Class M")
                        .homeStar("Sol")
                        .mass(5.972e24)
                        .radius(3959.0)
                        .distance(92.96e6)
                        .build());
    }

    static User seedUser() {
        return User.builder()
                .firstname("Jemima")
                .lastname("Briones")
                .email("jemima_eloise@earth.com")
                .password("chulis2022")
                .build();
    }

    private SessionFactory sessionFactory() {
        return entityManagerFactory.unwrap(SessionFactory.class);
    }
}
