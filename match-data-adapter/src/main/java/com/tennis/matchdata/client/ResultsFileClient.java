package com.tennis.matchdata.client;

import com.tennis.matchdata.config.SourceProperties;
import com.tennis.matchdata.model.SourceTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Downloads yearly results files as text, decoded with the configured charset
 * whatever the server declares.
 */
@Component
public class ResultsFileClient {

    private static final Logger log = LoggerFactory.getLogger(ResultsFileClient.class);

    private final WebClient webClient;
    private final SourceProperties properties;

    public ResultsFileClient(WebClient resultsWebClient, SourceProperties properties) {
        this.webClient = resultsWebClient;
        this.properties = properties;
    }

    /**
     * Fetch one season of results for a tier.
     * Throws WebClientResponseException for HTTP errors (4xx, 5xx).
     */
    public String fetchYear(SourceTier tier, int year) {
        String url = properties.urlFor(tier, year);
        log.debug("Downloading {} results for {} from {}", tier, year, url);

        try {
            byte[] bytes = webClient.get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(byte[].class)
                    .block();
            if (bytes == null) {
                throw new ResultsSourceException("Empty results file at " + url, null);
            }
            log.debug("Downloaded {} bytes from {}", bytes.length, url);
            return new String(bytes, properties.getCharset());
        } catch (WebClientResponseException e) {
            log.error("HTTP error downloading {}: status={}", url, e.getStatusCode());
            throw e;
        } catch (ResultsSourceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Error downloading {}: {}", url, e.getMessage());
            throw new ResultsSourceException("Failed to download " + url + ": " + e.getMessage(), e);
        }
    }

    /**
     * Download failure that is not an HTTP error status.
     */
    public static class ResultsSourceException extends RuntimeException {
        public ResultsSourceException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
