package com.planetary.api.service;

import com.planetary.api.dto.PlanetRequest;
import com.planetary.api.entity.Planet;
import com.planetary.api.exception.ResourceConflictException;
import com.planetary.api.exception.ResourceNotFoundException;
import com.planetary.api.repository.PlanetRepository;
import com.planetary.api.util.TitleCase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * PlanetService - catalogue reads and token-guarded writes.
 *
 * Every method is one lookup plus at most one write. The token check happens
 * in the security chain before these methods are reached.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PlanetService {

    static final String PLANET_NOT_FOUND = "That planet does not exist";

    private final PlanetRepository planetRepository;

    public List<Planet> listPlanets() {
        return planetRepository.findAll();
    }

    public Planet getPlanet(Integer planetId) {
        return planetRepository.findById(planetId)
                .orElseThrow(() -> notFound(planetId));
    }

    /**
     * Insert a new planet. The name is title-cased before the duplicate check
     * and before storage.
     *
     * @throws ResourceConflictException if a planet with the title-cased name exists
     */
    @Transactional
    public Planet addPlanet(PlanetRequest request) {
        String planetName = TitleCase.apply(request.getPlanetName());
        if (planetRepository.existsByPlanetName(planetName)) {
            log.info("Add rejected, planet already exists: {}", planetName);
            throw new ResourceConflictException("There is already a planet by that name");
        }

        Planet planet = Planet.builder()
                .planetName(planetName)
                .planetType(request.getPlanetType())
                .homeStar(request.getHomeStar())
                .mass(request.getMass())
                .radius(request.getRadius())
                .distance(request.getDistance())
                .build();
        Planet saved = planetRepository.save(planet);
        log.info("Added planet: planetId={}, planetName={}", saved.getPlanetId(), saved.getPlanetName());
        return saved;
    }

    /**
     * Overwrite every mutable field of an existing planet. The name is stored
     * as given.
     *
     * @throws ResourceNotFoundException if no planet has this id
     */
    @Transactional
    public Planet updatePlanet(Integer planetId, PlanetRequest request) {
        Planet planet = planetRepository.findById(planetId)
                .orElseThrow(() -> notFound(planetId));

        planet.setPlanetName(request.getPlanetName());
        planet.setPlanetType(request.getPlanetType());
        planet.setHomeStar(request.getHomeStar());
        planet.setMass(request.getMass());
        planet.setRadius(request.getRadius());
        planet.setDistance(request.getDistance());
        Planet saved = planetRepository.save(planet);
        log.info("Updated planet: planetId={}", planetId);
        return saved;
    }

    /**
     * @throws ResourceNotFoundException if no planet has this id
     */
    @Transactional
    public void removePlanet(Integer planetId) {
        Planet planet = planetRepository.findById(planetId)
                .orElseThrow(() -> notFound(planetId));

        planetRepository.delete(planet);
        log.info("Removed planet: planetId={}, planetName={}", planetId, planet.getPlanetName());
    }

    private ResourceNotFoundException notFound(Integer planetId) {
        log.debug("Planet not found: planetId={}", planetId);
        return new ResourceNotFoundException(PLANET_NOT_FOUND);
    }
}
