package io.github.jakubt4.sightings.model;

import java.util.List;

/**
 * Observations of one designation read contiguously from an input stream.
 */
public record Arc(String designation, List<Observation> observations) {

    public Arc {
        observations = List.copyOf(observations);
    }

    public int size() {
        return observations.size();
    }
}
