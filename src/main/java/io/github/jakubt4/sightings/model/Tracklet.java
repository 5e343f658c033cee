package io.github.jakubt4.sightings.model;

import java.util.List;

/**
 * One inferred observing session.
 *
 * @param designation object the tracklet belongs to
 * @param indices     positions in the source arc, in time order
 * @param meanTime    mean MJD of the members, used for ordering
 */
public record Tracklet(String designation, List<Integer> indices, double meanTime) {

    public Tracklet {
        indices = List.copyOf(indices);
    }

    public int size() {
        return indices.size();
    }

    /** Resolves the member indices against the arc they were computed from. */
    public <T> List<T> members(final List<T> source) {
        return indices.stream().map(source::get).toList();
    }
}
