package io.github.jakubt4.sightings.model;

import java.util.Optional;

/**
 * Entry of the observatory code table.
 *
 * @param code     three-character MPC code
 * @param name     observatory name as published, may be blank
 * @param parallax fixed-site constants, {@code null} for observers without a fixed
 *                 position such as space telescopes
 */
public record Observatory(String code, String name, ParallaxConstant parallax) {

    public Optional<ParallaxConstant> parallaxConstant() {
        return Optional.ofNullable(parallax);
    }
}
