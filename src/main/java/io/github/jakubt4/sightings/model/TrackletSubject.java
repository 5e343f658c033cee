package io.github.jakubt4.sightings.model;

/**
 * Minimal view of an observation needed to split an arc into tracklets.
 */
public interface TrackletSubject {

    /** Modified Julian Date of the observation. */
    double mjd();

    /** Identifies the observer or site that made the observation. */
    String observer();
}
