package com.planetary.api.repository;

import com.planetary.api.entity.Planet;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * PlanetRepository - Data Access Layer for Planet entities.
 *
 * Inherited findAll / findById / save / delete cover listing, detail, insert,
 * update and removal. No pagination; findAll returns rows in store order.
 */
@Repository
public interface PlanetRepository extends JpaRepository<Planet, Integer> {

    Optional<Planet> findByPlanetName(String planetName);

    boolean existsByPlanetName(String planetName);
}
