package io.github.jakubt4.sightings.dto;

import java.util.List;

/**
 * @param observer observatory code shared by the members
 * @param meanMjd  mean epoch of the members
 * @param indices  member positions within the arc, in time order
 */
public record TrackletReport(String observer, double meanMjd, List<Integer> indices) {
}
