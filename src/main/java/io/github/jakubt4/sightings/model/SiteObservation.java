package io.github.jakubt4.sightings.model;

/**
 * Observation from a fixed ground site with known parallax constants.
 */
public record SiteObservation(Measurement measurement, String siteCode, ParallaxConstant parallax)
        implements Observation {
}
