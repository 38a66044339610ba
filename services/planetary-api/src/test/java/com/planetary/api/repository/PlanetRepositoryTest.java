package com.planetary.api.repository;

import com.planetary.api.entity.Planet;
import com.planetary.api.entity.User;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Repository queries and store constraints against an embedded H2 database.
 */
@DataJpaTest
@DisplayName("Planet and User repository tests")
class PlanetRepositoryTest {

    @Autowired
    private TestEntityManager entityManager;
    @Autowired
    private PlanetRepository planetRepository;
    @Autowired
    private UserRepository userRepository;

    private static Planet mars() {
        return Planet.builder()
                .planetName("Mars")
                .planetType("Class K")
                .homeStar("Sol")
                .mass(6.39e23)
                .radius(2106.0)
                .distance(141.6e6)
                .build();
    }

    @Test
    @DisplayName("an inserted planet reads back equal by id")
    void insertThenFindById() {
        // given
        Planet saved = planetRepository.save(mars());
        entityManager.flush();
        entityManager.clear();

        // when
        Optional<Planet> found = planetRepository.findById(saved.getPlanetId());

        // then
        assertThat(found).isPresent();
        assertThat(found.get()).isEqualTo(saved);
        assertThat(found.get()).isNotSameAs(saved);
    }

    @Test
    @DisplayName("planets are found and checked by exact name")
    void findByPlanetName() {
        // given
        planetRepository.save(mars());

        // when & then
        assertThat(planetRepository.findByPlanetName("Mars")).isPresent();
        assertThat(planetRepository.existsByPlanetName("Mars")).isTrue();
        assertThat(planetRepository.existsByPlanetName("mars")).isFalse();
    }

    @Test
    @DisplayName("the store rejects a second planet with the same name")
    void duplicatePlanetName() {
        // given
        planetRepository.saveAndFlush(mars());

        // when & then
        assertThatThrownBy(() -> planetRepository.saveAndFlush(mars()))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("users match only on the exact email and password pair")
    void findByEmailAndPassword() {
        // given
        userRepository.save(User.builder()
                .firstname("Ana")
                .lastname("Lopez")
                .email("ana@earth.com")
                .password("stardust")
                .build());

        // when & then
        assertThat(userRepository.findByEmailAndPassword("ana@earth.com", "stardust")).isPresent();
        assertThat(userRepository.findByEmailAndPassword("ana@earth.com", "Stardust")).isEmpty();
        assertThat(userRepository.findByEmail("ana@earth.com")).isPresent();
        assertThat(userRepository.existsByEmail("other@earth.com")).isFalse();
    }

    @Test
    @DisplayName("the store rejects a second user with the same email")
    void duplicateEmail() {
        // given
        userRepository.saveAndFlush(User.builder().email("ana@earth.com").password("a").build());

        // when & then
        assertThatThrownBy(() -> userRepository.saveAndFlush(
                User.builder().email("ana@earth.com").password("b").build()))
                .isInstanceOf(DataIntegrityViolationException.class);
    }
}
