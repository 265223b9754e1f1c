package com.tennis.matchdata.client;

import com.tennis.matchdata.config.SourceProperties;
import com.tennis.matchdata.model.SourceTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ResultsFileClientTest {

    private static final String LINE = "tourney_name,winner_name\nMérida,María José Martínez Sánchez\n";

    SourceProperties properties;
    AtomicReference<String> requestedUrl;

    @BeforeEach
    void setUp() {
        properties = new SourceProperties();
        properties.setTourUrlTemplate("http://results.test/tour_{year}.csv");
        requestedUrl = new AtomicReference<>();
    }

    private WebClient serving(HttpStatus status, byte[] body) {
        return WebClient.builder()
                .exchangeFunction(request -> {
                    requestedUrl.set(request.url().toString());
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, "text/plain; charset=utf-8")
                            .body(Flux.<DataBuffer>just(DefaultDataBufferFactory.sharedInstance.wrap(body)))
                            .build());
                })
                .build();
    }

    @Test
    void latin1File_isDecodedWithConfiguredCharset() {
        ResultsFileClient client = new ResultsFileClient(
                serving(HttpStatus.OK, LINE.getBytes(StandardCharsets.ISO_8859_1)), properties);

        String body = client.fetchYear(SourceTier.TOUR, 2019);

        assertEquals(LINE, body);
        assertEquals("http://results.test/tour_2019.csv", requestedUrl.get());
    }

    @Test
    void charsetCanBeOverridden() {
        properties.setCharset(StandardCharsets.UTF_8);
        ResultsFileClient client = new ResultsFileClient(
                serving(HttpStatus.OK, LINE.getBytes(StandardCharsets.UTF_8)), properties);

        assertEquals(LINE, client.fetchYear(SourceTier.TOUR, 2019));
    }

    @Test
    void httpErrorStatus_propagates() {
        ResultsFileClient client = new ResultsFileClient(
                serving(HttpStatus.NOT_FOUND, "404: Not Found".getBytes(StandardCharsets.US_ASCII)), properties);

        WebClientResponseException e = assertThrows(WebClientResponseException.class,
                () -> client.fetchYear(SourceTier.TOUR, 2031));
        assertEquals(404, e.getStatusCode().value());
    }
}
