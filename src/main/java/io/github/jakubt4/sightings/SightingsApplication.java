package io.github.jakubt4.sightings;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Sightings: arc and tracklet segmentation of minor-planet astrometry.
 *
 * <p>Decodes MPC 80-column observation records against the observatory code table,
 * cuts the record stream into per-object arcs and splits every arc into tracklets,
 * the observing sessions orbit determination works from.
 *
 * @see io.github.jakubt4.sightings.service.arc.ArcSplitter
 * @see io.github.jakubt4.sightings.service.tracklet.TrackletClusterer
 */
@SpringBootApplication
@EnableRetry
public class SightingsApplication {

    public static void main(String[] args) {
        SpringApplication.run(SightingsApplication.class, args);
    }
}
