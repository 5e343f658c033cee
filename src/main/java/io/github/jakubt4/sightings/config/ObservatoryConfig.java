package io.github.jakubt4.sightings.config;

import io.github.jakubt4.sightings.client.ObscodeClient;
import io.github.jakubt4.sightings.observatory.ObscodeParser;
import io.github.jakubt4.sightings.observatory.ObservatoryCodes;
import io.github.jakubt4.sightings.observatory.ObservatoryCodesException;
import io.github.jakubt4.sightings.observatory.ParallaxLookup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Publishes the observatory code table every decoder reads from.
 *
 * <p>The table is built completely before the bean is exposed and never changes
 * afterwards. The complete current list is downloaded from the Minor Planet Center at
 * startup. The copy bundled on the classpath, which covers the major survey and
 * follow-up sites, is used when the download fails or {@code sightings.obscode.fetch}
 * is {@code false}.
 */
@Slf4j
@Configuration
public class ObservatoryConfig {

    @Bean
    ParallaxLookup parallaxLookup(final ObscodeClient obscodeClient,
                                  @Value("${sightings.obscode.fetch:true}") final boolean fetch,
                                  @Value("${sightings.obscode.resource:obscode.dat}") final String resource) {
        if (fetch) {
            final var text = obscodeClient.fetchObscodeDat();
            if (text != null) {
                try {
                    final var codes = ObscodeParser.parse(text);
                    log.info("Observatory codes fetched: {} sites", codes.size());
                    return codes;
                } catch (final ObservatoryCodesException e) {
                    log.warn("Fetched observatory list unusable, falling back to classpath:{}: {}",
                            resource, e.getMessage());
                }
            }
        }
        final var codes = loadBundled(resource);
        log.info("Observatory codes loaded from classpath:{}: {} sites", resource, codes.size());
        return codes;
    }

    /**
     * @throws ObservatoryCodesException if the resource is missing or unreadable
     */
    static ObservatoryCodes loadBundled(final String resource) {
        final var stream = ObservatoryConfig.class.getClassLoader().getResourceAsStream(resource);
        if (stream == null) {
            throw new ObservatoryCodesException(resource + " not found on classpath");
        }
        try (var reader = new InputStreamReader(stream, StandardCharsets.US_ASCII)) {
            return ObscodeParser.parse(reader);
        } catch (final IOException e) {
            throw new ObservatoryCodesException("Failed to read " + resource, e);
        }
    }
}
