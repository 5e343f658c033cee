package io.github.jakubt4.sightings.model;

import java.util.List;

public record ArcTracklets(Arc arc, List<Tracklet> tracklets) {

    public ArcTracklets {
        tracklets = List.copyOf(tracklets);
    }
}
