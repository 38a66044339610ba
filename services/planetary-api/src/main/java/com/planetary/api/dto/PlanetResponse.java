package com.planetary.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.planetary.api.entity.Planet;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * PlanetResponse - wire projection of a Planet.
 *
 * Example:
 * <pre>
 * {
 *   "planet_id": 3,
 *   "planet_name": "Earth",
 *   "planet_type": "Class M",
 *   "home_star": "Sol",
 *   "mass": 5.972e24,
 *   "radius": 3959.0,
 *   "distance": 9.296e7
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PlanetResponse {

    private Integer planetId;
    private String planetName;
    private String planetType;
    private String homeStar;
    private Double mass;
    private Double radius;
    private Double distance;

    public static PlanetResponse from(Planet planet) {
        return PlanetResponse.builder()
                .planetId(planet.getPlanetId())
                .planetName(planet.getPlanetName())
                .planetType(planet.getPlanetType())
                .homeStar(planet.getHomeStar())
                .mass(planet.getMass())
                .radius(planet.getRadius())
                .distance(planet.getDistance())
                .build();
    }

    public static List<PlanetResponse> fromAll(List<Planet> planets) {
        return planets.stream()
                .map(PlanetResponse::from)
                .toList();
    }
}
