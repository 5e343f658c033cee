package io.github.jakubt4.sightings.observatory;

import io.github.jakubt4.sightings.model.Observatory;

import java.util.Optional;

/**
 * Read-only view of the observatory code table.
 */
@FunctionalInterface
public interface ParallaxLookup {

    /**
     * @param code three-character MPC observatory code
     * @return the observatory, or empty if the code is not in the table. A present
     *         observatory without parallax constants is a valid non-fixed observer.
     */
    Optional<Observatory> find(String code);
}
