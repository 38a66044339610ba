package com.planetary.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * PlanetRequest - the mutable planet fields taken from an add or update form.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanetRequest {

    private String planetName;
    private String planetType;
    private String homeStar;
    private Double mass;
    private Double radius;
    private Double distance;
}
