package com.bbthechange.seatwatch.client;

import com.bbthechange.seatwatch.config.RegistrationPlatformProperties;
import com.bbthechange.seatwatch.dto.banner.SectionRecord;
import com.bbthechange.seatwatch.dto.banner.SectionSearchResponse;
import com.bbthechange.seatwatch.exception.RegistrationQueryException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Client for the Banner student registration search.
 *
 * Every call opens its own cookie session: the term is declared with a form POST,
 * then the section search runs as a GET in the same session. Sessions are never
 * shared between calls.
 */
@Component
public class BannerRegistrationClient {

    private static final Logger logger = LoggerFactory.getLogger(BannerRegistrationClient.class);

    private static final String USER_AGENT = "SeatWatch/1.0";
    private static final String TERM_STEP = "term declaration";
    private static final String SEARCH_STEP = "section search";

    private final Supplier<HttpClient> sessionFactory;
    private final ObjectMapper objectMapper;
    private final RegistrationPlatformProperties properties;

    @Autowired
    public BannerRegistrationClient(ObjectMapper objectMapper, RegistrationPlatformProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.sessionFactory = () -> HttpClient.newBuilder()
                .cookieHandler(new CookieManager(null, CookiePolicy.ACCEPT_ALL))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(properties.getConnectTimeout())
                .build();
    }

    /**
     * Constructor for testing with a custom session factory.
     */
    BannerRegistrationClient(Supplier<HttpClient> sessionFactory, ObjectMapper objectMapper,
                             RegistrationPlatformProperties properties) {
        this.sessionFactory = sessionFactory;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Fetch the sections offered for a course in a term.
     *
     * @param term platform term code, e.g. "252"
     * @param subject subject code, e.g. "ENGL"
     * @param courseNumber course number as text, e.g. "214"
     * @return matching sections; empty when the platform reports no match or an unsuccessful search
     * @throws RegistrationQueryException on transport failure, non-2xx status, unreadable body
     *                                    or when the exchange exceeds the configured timeout
     */
    public List<SectionRecord> fetchSections(String term, String subject, String courseNumber) {
        HttpClient session = sessionFactory.get();
        long deadline = System.nanoTime() + properties.getTimeout().toNanos();

        declareTerm(session, term, deadline);
        SectionSearchResponse response = searchSections(session, term, subject, courseNumber, deadline);

        if (response == null || !Boolean.TRUE.equals(response.getSuccess()) || response.getData() == null) {
            logger.debug("Search for {} {} in term {} returned no usable data", subject, courseNumber, term);
            return List.of();
        }

        logger.debug("Search for {} {} in term {} returned {} sections",
                subject, courseNumber, term, response.getData().size());
        return response.getData();
    }

    /**
     * Bind the session to the term. The response body is ignored.
     */
    private void declareTerm(HttpClient session, String term, long deadline) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("term", term);
        form.put("studyPath", "");
        form.put("studyPathText", "");
        form.put("startDatepicker", "");
        form.put("endDatepicker", "");

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(properties.getTermSearchUrl()))
                .header("User-Agent", USER_AGENT)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .timeout(remaining(deadline, TERM_STEP))
                .POST(HttpRequest.BodyPublishers.ofString(encodeForm(form)))
                .build();

        send(session, request, deadline, TERM_STEP);
    }

    private SectionSearchResponse searchSections(HttpClient session, String term, String subject,
                                                 String courseNumber, long deadline) {
        URI uri = UriComponentsBuilder.fromUriString(properties.getSearchUrl())
                .queryParam("txt_subject", subject)
                .queryParam("txt_courseNumber", courseNumber)
                .queryParam("txt_term", term)
                .queryParam("startDatepicker", "")
                .queryParam("endDatepicker", "")
                .queryParam("pageOffset", 0)
                .queryParam("pageMaxSize", properties.getPageMaxSize())
                .queryParam("sortColumn", "subjectDescription")
                .queryParam("sortDirection", "asc")
                .encode()
                .build()
                .toUri();

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/json")
                .timeout(remaining(deadline, SEARCH_STEP))
                .GET()
                .build();

        String body = send(session, request, deadline, SEARCH_STEP);
        if (body == null || body.isBlank()) {
            return null;
        }

        try {
            return objectMapper.readValue(body, SectionSearchResponse.class);
        } catch (JsonProcessingException e) {
            throw RegistrationQueryException.malformedResponse(e);
        }
    }

    /**
     * Send within what is left of the deadline. The timeout covers the body as well as the headers.
     */
    private String send(HttpClient session, HttpRequest request, long deadline, String step) {
        CompletableFuture<HttpResponse<String>> pending;
        try {
            pending = session.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        } catch (RuntimeException e) {
            throw RegistrationQueryException.transportFailure(step, e);
        }

        HttpResponse<String> response;
        try {
            response = pending.get(remaining(deadline, step).toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw RegistrationQueryException.timeout(step);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw RegistrationQueryException.transportFailure(step, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof HttpTimeoutException) {
                throw RegistrationQueryException.timeout(step);
            }
            throw RegistrationQueryException.transportFailure(step, cause);
        } catch (RegistrationQueryException e) {
            pending.cancel(true);
            throw e;
        }

        int statusCode = response.statusCode();
        logger.debug("Registration platform {} response status: {}", step, statusCode);

        if (statusCode < 200 || statusCode >= 300) {
            throw RegistrationQueryException.badStatus(step, statusCode);
        }
        return response.body();
    }

    /**
     * Time left before the deadline, used as the per-request timeout.
     */
    private Duration remaining(long deadline, String step) {
        long nanosLeft = deadline - System.nanoTime();
        if (nanosLeft <= 0) {
            throw RegistrationQueryException.timeout(step);
        }
        return Duration.ofNanos(nanosLeft);
    }

    private static String encodeForm(Map<String, String> form) {
        return form.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue() == null ? "" : e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
