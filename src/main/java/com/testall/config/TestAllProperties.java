package com.testall.config;

import com.testall.core.model.Platform;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "testall")
public class TestAllProperties {

    /** Root locations, relative to the base directory, searched in this order. */
    private List<String> roots = new ArrayList<>(List.of("apps", "packages", "services"));

    private int timeoutSeconds = 600;
    private int terminationGraceSeconds = 5;

    /** Runner adapter command per platform; the project path is appended as the last argument. */
    private Map<Platform, String> runners = new EnumMap<>(Platform.class);

    public List<String> getRoots() { return roots; }
    public void setRoots(List<String> roots) { this.roots = roots; }
    public int getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    public int getTerminationGraceSeconds() { return terminationGraceSeconds; }
    public void setTerminationGraceSeconds(int terminationGraceSeconds) {
        if (terminationGraceSeconds < 0) {
            throw new IllegalArgumentException("termination-grace-seconds must not be negative: " + terminationGraceSeconds);
        }
        this.terminationGraceSeconds = terminationGraceSeconds;
    }
    public Map<Platform, String> getRunners() { return runners; }
    public void setRunners(Map<Platform, String> runners) { this.runners = runners; }

    public Duration getTimeout() { return Duration.ofSeconds(timeoutSeconds); }
    public Duration getTerminationGrace() { return Duration.ofSeconds(terminationGraceSeconds); }
}
