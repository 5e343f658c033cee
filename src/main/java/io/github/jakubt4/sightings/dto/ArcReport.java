package io.github.jakubt4.sightings.dto;

import java.util.List;

public record ArcReport(String designation, int observations, List<TrackletReport> tracklets) {
}
