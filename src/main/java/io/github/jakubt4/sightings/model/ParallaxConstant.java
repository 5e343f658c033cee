package io.github.jakubt4.sightings.model;

/**
 * Geocentric parallax constants of a fixed observatory.
 *
 * @param longitude east longitude in radians
 * @param rhoCosPhi ρ·cos φ′, in AU
 * @param rhoSinPhi ρ·sin φ′, in AU
 */
public record ParallaxConstant(double longitude, double rhoCosPhi, double rhoSinPhi) {
}
