package com.bbthechange.seatwatch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

@Component
@ConfigurationProperties(prefix = "seatwatch.registration")
public class RegistrationPlatformProperties {

    /**
     * Upper bound the platform accepts for pageMaxSize.
     */
    public static final int MAX_PAGE_SIZE = 50;

    private String baseUrl = "https://banner9-registration.kfupm.edu.sa";

    private String termSearchPath = "/StudentRegistrationSsb/ssb/term/search";

    private String searchPath = "/StudentRegistrationSsb/ssb/searchResults/searchResults";

    // Deadline for the term declaration and the search together
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration timeout = Duration.ofSeconds(20);

    @DurationUnit(ChronoUnit.SECONDS)
    private Duration connectTimeout = Duration.ofSeconds(10);

    private int pageMaxSize = MAX_PAGE_SIZE;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getTermSearchPath() {
        return termSearchPath;
    }

    public void setTermSearchPath(String termSearchPath) {
        this.termSearchPath = termSearchPath;
    }

    public String getSearchPath() {
        return searchPath;
    }

    public void setSearchPath(String searchPath) {
        this.searchPath = searchPath;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public int getPageMaxSize() {
        return Math.min(Math.max(pageMaxSize, 1), MAX_PAGE_SIZE);
    }

    public void setPageMaxSize(int pageMaxSize) {
        this.pageMaxSize = pageMaxSize;
    }

    public String getTermSearchUrl() {
        return baseUrl + termSearchPath;
    }

    public String getSearchUrl() {
        return baseUrl + searchPath;
    }
}
