package io.github.jakubt4.sightings.model;

/**
 * A single decoded position measurement, either from a fixed ground site or from
 * a spacecraft with a geocentric offset.
 */
public sealed interface Observation extends TrackletSubject
        permits SiteObservation, SatelliteObservation {

    Measurement measurement();

    /** Three-character MPC observatory code. */
    String siteCode();

    default String designation() {
        return measurement().designation();
    }

    @Override
    default double mjd() {
        return measurement().mjd();
    }

    @Override
    default String observer() {
        return siteCode();
    }
}
