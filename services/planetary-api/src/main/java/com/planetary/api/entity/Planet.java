package com.planetary.api.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Planet - JPA Entity for one catalogue entry.
 *
 * Physical quantities are not validated: mass in kilograms, radius and
 * distance in kilometers.
 *
 * planet_name is unique at the store level as well as being checked by
 * PlanetService before insert, so a lost check-then-insert race still ends in
 * a constraint violation rather than a duplicate row.
 */
@Entity
@Table(name = "planets")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Planet {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "planet_id")
    private Integer planetId;

    @Column(name = "planet_name", unique = true, nullable = false)
    private String planetName;

    @Column(name = "planet_type")
    private String planetType;

    @Column(name = "home_star")
    private String homeStar;

    @Column(name = "mass")
    private Double mass;

    @Column(name = "radius")
    private Double radius;

    @Column(name = "distance")
    private Double distance;
}
