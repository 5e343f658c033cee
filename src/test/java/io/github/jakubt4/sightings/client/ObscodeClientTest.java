package io.github.jakubt4.sightings.client;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import static io.github.jakubt4.sightings.ObservationFixtures.OBSCODE_SAMPLE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ObscodeClientTest {

    private static final String OBSCODE_URL = "http://localhost:8090/iau/lists/ObsCodes.html";

    private ObscodeClient client;
    private MockRestServiceServer mockServer;

    @BeforeEach
    void setUp() {
        final var restTemplate = new RestTemplate();
        mockServer = MockRestServiceServer.bindTo(restTemplate).build();

        final var builder = RestClient.builder()
                .requestFactory(restTemplate.getRequestFactory());

        client = new ObscodeClient(builder, OBSCODE_URL);
    }

    @Test
    void fetchObscodeDatReturnsPageBody() {
        mockServer.expect(requestTo(OBSCODE_URL))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("<pre>" + OBSCODE_SAMPLE + "</pre>", MediaType.TEXT_HTML));

        final var body = client.fetchObscodeDat();

        assertThat(body).contains("644 243.140220.836325+0.546877Palomar Mountain/NEAT");
        mockServer.verify();
    }

    @Test
    void fetchObscodeDatThrowsOnServerError() {
        mockServer.expect(requestTo(OBSCODE_URL))
                .andRespond(withServerError());

        assertThatThrownBy(() -> client.fetchObscodeDat())
                .isInstanceOf(HttpServerErrorException.class);
    }

    @Test
    void recoverSignalsFallbackWithNull() {
        assertThat(client.recoverFetchObscodeDat(new RestClientException("timeout"))).isNull();
    }
}
