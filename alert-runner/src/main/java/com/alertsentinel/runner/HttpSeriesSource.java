package com.alertsentinel.runner;

import com.alertsentinel.core.error.SourceUnavailableException;
import com.alertsentinel.core.evaluation.SeriesRequest;
import com.alertsentinel.core.evaluation.SeriesSource;
import com.alertsentinel.core.model.SeriesPoint;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * {@link SeriesSource} backed by the insight query HTTP API.
 *
 * <h3>Request</h3>
 *
 * <pre>
 * GET {baseUrl}/insights/{insightRef}/series/{seriesIndex}?interval=daily&amp;points=31&amp;include_ongoing=false
 * </pre>
 *
 * <h3>Response</h3>
 *
 * <pre>
 * {"points": [{"timestamp": "2024-05-06T00:00:00Z", "value": 42.0}]}
 * </pre>
 *
 * <p>
 * Points are sorted by timestamp before they are returned. Any non-200
 * status, I/O failure or unparseable body becomes a
 * {@link SourceUnavailableException}.
 * </p>
 *
 * @since 1.0.0
 */
public class HttpSeriesSource implements SeriesSource {

    private static final Logger LOG = LoggerFactory.getLogger(HttpSeriesSource.class);

    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration requestTimeout;
    private final ObjectMapper mapper;

    public HttpSeriesSource(String baseUrl, Duration requestTimeout) {
        this(HttpClient.newBuilder().connectTimeout(requestTimeout).build(), baseUrl, requestTimeout);
    }

    public HttpSeriesSource(HttpClient httpClient, String baseUrl, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "HttpClient must not be null");
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "request timeout must not be null");
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                // a null or absent value is a missing point, never 0.0
                .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true)
                .configure(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES, true);
    }

    @Override
    public List<SeriesPoint> fetch(SeriesRequest request) {
        URI uri = uriFor(request);
        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SourceUnavailableException("Series request to " + uri + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException("Interrupted while requesting " + uri, e);
        }

        if (response.statusCode() != 200) {
            throw new SourceUnavailableException("Series request to " + uri + " returned HTTP "
                    + response.statusCode());
        }

        SeriesResponse body;
        try {
            body = mapper.readValue(response.body(), SeriesResponse.class);
        } catch (JsonProcessingException e) {
            throw new SourceUnavailableException("Malformed series response from " + uri + ": "
                    + e.getOriginalMessage(), e);
        }
        List<SeriesPoint> points = body != null && body.points != null
                ? body.points.stream().sorted(Comparator.comparing(SeriesPoint::getTimestamp)).toList()
                : List.of();
        LOG.debug("Fetched {} point(s) for {}", points.size(), request);
        return points;
    }

    URI uriFor(SeriesRequest request) {
        return URI.create(baseUrl
                + "/insights/" + URLEncoder.encode(request.getInsightRef(), StandardCharsets.UTF_8)
                + "/series/" + request.getSeriesIndex()
                + "?interval=" + request.getInterval().name().toLowerCase(Locale.ROOT)
                + "&points=" + request.getNumPoints()
                + "&include_ongoing=" + request.isIncludeOngoing());
    }

    static final class SeriesResponse {

        private final List<SeriesPoint> points;

        @JsonCreator
        SeriesResponse(@JsonProperty("points") List<SeriesPoint> points) {
            this.points = points;
        }
    }
}
