package io.github.jakubt4.sightings.observatory;

import io.github.jakubt4.sightings.model.Observatory;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Immutable observatory code table. Fully populated on construction, so a single
 * instance can be shared by any number of decoding threads.
 */
public final class ObservatoryCodes implements ParallaxLookup {

    private final Map<String, Observatory> byCode;

    public ObservatoryCodes(final Collection<Observatory> observatories) {
        this.byCode = observatories.stream()
                .collect(Collectors.toUnmodifiableMap(Observatory::code, Function.identity(), (first, last) -> last));
    }

    @Override
    public Optional<Observatory> find(final String code) {
        return Optional.ofNullable(byCode.get(code));
    }

    public int size() {
        return byCode.size();
    }
}
