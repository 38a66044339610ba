package com.planetary.api.controller;

import com.planetary.api.dto.MessageResponse;
import com.planetary.api.dto.PlanetRequest;
import com.planetary.api.dto.PlanetResponse;
import com.planetary.api.service.PlanetService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.List;

/**
 * Planet catalogue API.
 *
 * Reads are public. add_planet, update_planet and remove_planet need a bearer
 * token; the caller's email arrives as the Principal and is only logged.
 * Form fields use snake_case names (planet_name, home_star, ...).
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class PlanetController {

    private final PlanetService planetService;

    @GetMapping("/planets")
    public ResponseEntity<List<PlanetResponse>> listPlanets() {
        return ResponseEntity.ok(PlanetResponse.fromAll(planetService.listPlanets()));
    }

    @GetMapping("/planet_detail/{planetId}")
    public ResponseEntity<PlanetResponse> planetDetail(@PathVariable Integer planetId) {
        return ResponseEntity.ok(PlanetResponse.from(planetService.getPlanet(planetId)));
    }

    @PostMapping("/add_planet")
    public ResponseEntity<MessageResponse> addPlanet(
            @RequestParam("planet_name") String planetName,
            @RequestParam("planet_type") String planetType,
            @RequestParam("home_star") String homeStar,
            @RequestParam("mass") Double mass,
            @RequestParam("radius") Double radius,
            @RequestParam("distance") Double distance,
            Principal principal
    ) {
        log.info("Add planet: planetName={}, by={}", planetName, principal.getName());
        planetService.addPlanet(PlanetRequest.builder()
                .planetName(planetName)
                .planetType(planetType)
                .homeStar(homeStar)
                .mass(mass)
                .radius(radius)
                .distance(distance)
                .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(new MessageResponse("You added a planet"));
    }

    @PutMapping("/update_planet")
    public ResponseEntity<MessageResponse> updatePlanet(
            @RequestParam("planet_id") Integer planetId,
            @RequestParam("planet_name") String planetName,
            @RequestParam("planet_type") String planetType,
            @RequestParam("home_star") String homeStar,
            @RequestParam("mass") Double mass,
            @RequestParam("radius") Double radius,
            @RequestParam("distance") Double distance,
            Principal principal
    ) {
        log.info("Update planet: planetId={}, by={}", planetId, principal.getName());
        planetService.updatePlanet(planetId, PlanetRequest.builder()
                .planetName(planetName)
                .planetType(planetType)
                .homeStar(homeStar)
                .mass(mass)
                .radius(radius)
                .distance(distance)
                .build());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new MessageResponse("You updated a planet"));
    }

    @DeleteMapping("/remove_planet/{planetId}")
    public ResponseEntity<MessageResponse> removePlanet(@PathVariable Integer planetId, Principal principal) {
        log.info("Remove planet: planetId={}, by={}", planetId, principal.getName());
        planetService.removePlanet(planetId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new MessageResponse("You deleted a planet"));
    }
}
