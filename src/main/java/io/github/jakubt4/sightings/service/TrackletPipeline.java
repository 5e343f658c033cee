package io.github.jakubt4.sightings.service;

import io.github.jakubt4.sightings.model.Arc;
import io.github.jakubt4.sightings.model.ArcTracklets;
import io.github.jakubt4.sightings.observatory.ParallaxLookup;
import io.github.jakubt4.sightings.service.arc.ArcResult;
import io.github.jakubt4.sightings.service.arc.ArcSplitter;
import io.github.jakubt4.sightings.service.tracklet.TrackletClusterer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Streams observation records through arc splitting and tracklet clustering.
 *
 * <p>A producer task reads and splits the stream into arcs on a worker thread and hands
 * every {@link ArcResult} to the calling thread through a bounded queue. The producer
 * blocks while the queue is full; the consumer blocks while it is empty. The terminal
 * result (end of stream or read error) is the last element ever queued.
 */
@Slf4j
@Service
public class TrackletPipeline {

    private final ParallaxLookup parallaxLookup;
    private final int queueCapacity;
    private final AtomicInteger producerCounter = new AtomicInteger();
    private final ExecutorService executor = Executors.newCachedThreadPool(task -> {
        final var thread = new Thread(task, "arc-producer-" + producerCounter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    public TrackletPipeline(final ParallaxLookup parallaxLookup,
                            @Value("${sightings.pipeline.queue-capacity:16}") final int queueCapacity) {
        this.parallaxLookup = parallaxLookup;
        this.queueCapacity = queueCapacity;
    }

    /**
     * Segments a whole stream. Parse failures are collected and reading continues; a read
     * failure ends the run and is reported in {@link SegmentationReport#readError()}.
     *
     * @param records 80-column records, grouped by designation
     */
    public SegmentationReport segment(final Reader records) {
        final BlockingQueue<ArcResult> queue = new ArrayBlockingQueue<>(queueCapacity);
        final var lines = new BufferedReader(records);
        final var splitter = new ArcSplitter(lines::readLine, parallaxLookup);
        final Future<?> producer = executor.submit(() -> produce(splitter, queue));

        final var arcs = new ArrayList<ArcTracklets>();
        final var failures = new ArrayList<ArcResult.ParseFailure>();
        IOException readError = null;
        try {
            var done = false;
            while (!done) {
                final var result = queue.take();
                switch (result.tag()) {
                    case ARC -> arcs.add(cluster(((ArcResult.Complete) result).arc()));
                    case PARSE_FAILURE -> {
                        final var failure = (ArcResult.ParseFailure) result;
                        failure.partialArc().ifPresent(arc -> arcs.add(cluster(arc)));
                        failures.add(failure);
                    }
                    case FATAL_READ_ERROR -> {
                        final var fatal = (ArcResult.FatalReadError) result;
                        fatal.partialArc().ifPresent(arc -> arcs.add(cluster(arc)));
                        readError = fatal.cause();
                        done = true;
                    }
                    case END_OF_STREAM -> done = true;
                }
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            producer.cancel(true);
            readError = new InterruptedIOException("Segmentation interrupted");
        }

        log.info("Segmentation finished: arcs={}, tracklets={}, parseFailures={}",
                arcs.size(), arcs.stream().mapToInt(a -> a.tracklets().size()).sum(), failures.size());
        return new SegmentationReport(arcs, failures, readError);
    }

    private void produce(final ArcSplitter splitter, final BlockingQueue<ArcResult> queue) {
        try {
            ArcResult result;
            do {
                result = step(splitter);
                queue.put(result);
            } while (!result.isTerminal());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Arc producer interrupted");
        }
    }

    // the consumer only stops on a terminal result, so none may be lost to an exception
    private static ArcResult step(final ArcSplitter splitter) {
        try {
            return splitter.next();
        } catch (final RuntimeException e) {
            log.error("Arc producer failed: {}", e.getMessage(), e);
            return new ArcResult.FatalReadError(new IOException("Arc producer failed", e), null);
        }
    }

    private static ArcTracklets cluster(final Arc arc) {
        return new ArcTracklets(arc, TrackletClusterer.findTracklets(arc));
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
        log.info("Tracklet pipeline stopped");
    }
}
