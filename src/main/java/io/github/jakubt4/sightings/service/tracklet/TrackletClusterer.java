package io.github.jakubt4.sightings.service.tracklet;

import io.github.jakubt4.sightings.model.Arc;
import io.github.jakubt4.sightings.model.Tracklet;
import io.github.jakubt4.sightings.model.TrackletSubject;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Splits an arc into tracklets.
 *
 * <p>A tracklet is a few observations over a short time span showing the object's
 * motion, usually from one observer under the same conditions. The 80-column format
 * does not record sessions, so they are reconstructed heuristically: observations are
 * grouped by observer, sorted by time, and each group is cut at its largest time gaps
 * until the pieces look like single sessions.
 *
 * <p>The result depends only on times and observers, not on input order. Tracklets are
 * ordered by mean time; equal means are ordered by their smallest member index.
 */
public final class TrackletClusterer {

    /** About one hour. Anything within it is a tracklet. */
    static final double SINGLE_SESSION = 0.042;
    /** Up to {@link #SHORT_SET_SIZE} observations within three hours. */
    static final double SHORT_SPAN = 0.125;
    static final int SHORT_SET_SIZE = 5;
    /** Six hours, accepted whatever the observation count once splitting is inconclusive. */
    static final double LONG_SPAN = 0.25;
    static final double SAME_NIGHT = 0.5;

    private TrackletClusterer() {
    }

    public static List<Tracklet> findTracklets(final Arc arc) {
        return findTracklets(arc.designation(), arc.observations());
    }

    /**
     * @param designation copied onto every tracklet
     * @param subjects    observations in any order
     * @return tracklets holding indices into {@code subjects}, sorted by mean time
     */
    public static List<Tracklet> findTracklets(final String designation,
                                               final List<? extends TrackletSubject> subjects) {
        final var byObserver = new LinkedHashMap<String, List<Dated>>();
        for (var i = 0; i < subjects.size(); i++) {
            final var subject = subjects.get(i);
            byObserver.computeIfAbsent(subject.observer(), k -> new ArrayList<>())
                    .add(new Dated(subject.mjd(), i));
        }

        final var found = new ArrayList<Candidate>();
        for (final var group : byObserver.values()) {
            group.sort(Comparator.comparingDouble(Dated::mjd));
            reduce(group, found);
        }

        found.sort(Comparator.comparingDouble(Candidate::mean).thenComparingInt(Candidate::firstIndex));
        return found.stream()
                .map(c -> new Tracklet(designation, c.indices(), c.mean()))
                .toList();
    }

    /**
     * Cuts one observer's time-sorted observations into tracklets. Rules are tried in
     * order and the first that applies wins. Pieces awaiting a decision sit on an
     * explicit stack; every cut yields two non-empty pieces, so at most {@code n - 1}
     * cuts happen for {@code n} observations.
     */
    private static void reduce(final List<Dated> sorted, final List<Candidate> found) {
        final var work = new ArrayDeque<List<Dated>>();
        work.push(sorted);
        while (!work.isEmpty()) {
            final var set = work.pop();
            final var span = span(set);

            if (span < SINGLE_SESSION) {
                found.add(Candidate.of(set));
                continue;
            }
            if (set.size() <= SHORT_SET_SIZE && span < SHORT_SPAN) {
                found.add(Candidate.of(set));
                continue;
            }
            if (set.size() == 2) {
                if (span < SAME_NIGHT) {
                    found.add(Candidate.of(set));
                } else {
                    found.add(Candidate.of(set.subList(0, 1)));
                    found.add(Candidate.of(set.subList(1, 2)));
                }
                continue;
            }

            final var split = largestGap(set);
            final var left = set.subList(0, split);
            final var right = set.subList(split, set.size());

            if (left.size() >= 3 && right.size() >= 3) {
                work.push(right);
                work.push(left);
            } else if (left.size() == 2 && right.size() >= 2 && span(left) < SAME_NIGHT) {
                found.add(Candidate.of(left));
                work.push(right);
            } else if (right.size() == 2 && left.size() >= 2 && span(right) < SAME_NIGHT) {
                work.push(left);
                found.add(Candidate.of(right));
            } else if (set.size() == 3 && span < SAME_NIGHT) {
                found.add(Candidate.of(set));
            } else if (span < LONG_SPAN) {
                found.add(Candidate.of(set));
            } else {
                work.push(right);
                work.push(left);
            }
        }
    }

    /** Index of the first element after the largest gap. The earliest gap wins ties. */
    static int largestGap(final List<Dated> set) {
        var split = 1;
        var longest = set.get(1).mjd() - set.get(0).mjd();
        for (var i = 2; i < set.size(); i++) {
            final var gap = set.get(i).mjd() - set.get(i - 1).mjd();
            if (gap > longest) {
                longest = gap;
                split = i;
            }
        }
        return split;
    }

    private static double span(final List<Dated> set) {
        return set.get(set.size() - 1).mjd() - set.get(0).mjd();
    }

    record Dated(double mjd, int index) {
    }

    private record Candidate(List<Integer> indices, double mean, int firstIndex) {

        static Candidate of(final List<Dated> set) {
            final var indices = new ArrayList<Integer>(set.size());
            var sum = 0.0;
            var first = Integer.MAX_VALUE;
            for (final var dated : set) {
                indices.add(dated.index());
                sum += dated.mjd();
                first = Math.min(first, dated.index());
            }
            return new Candidate(indices, sum / set.size(), first);
        }
    }
}
