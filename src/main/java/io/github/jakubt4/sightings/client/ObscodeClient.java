package io.github.jakubt4.sightings.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Downloads the Minor Planet Center observatory code list (the {@code obscode.dat}
 * layout, optionally wrapped in HTML).
 */
@Slf4j
@Service
public class ObscodeClient {

    private final RestClient restClient;
    private final String obscodeUrl;

    public ObscodeClient(final RestClient.Builder restClientBuilder,
                         @Value("${sightings.obscode.url:https://minorplanetcenter.net/iau/lists/ObsCodes.html}")
                         final String obscodeUrl) {
        this.restClient = restClientBuilder.build();
        this.obscodeUrl = obscodeUrl;
    }

    /**
     * @return the raw list, retried on transport and HTTP errors
     */
    @Retryable(retryFor = RestClientException.class, maxAttempts = 3,
               backoff = @Backoff(delay = 500, maxDelay = 2000))
    public String fetchObscodeDat() {
        log.info("Fetching observatory codes from {}", obscodeUrl);
        return restClient.get()
                .uri(obscodeUrl)
                .retrieve()
                .body(String.class);
    }

    /**
     * @return {@code null}, telling the caller to use its bundled table
     */
    @Recover
    public String recoverFetchObscodeDat(final RestClientException e) {
        log.warn("Failed to fetch observatory codes after retries: {}", e.getMessage());
        return null;
    }
}
