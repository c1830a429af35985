package com.testall.core.discovery;

import com.testall.core.model.Platform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Assigns exactly one {@link Platform} to a candidate directory by evaluating
 * marker rules top to bottom; the first match wins.
 * <p>
 * Flutter is checked before Node because Flutter apps often carry a
 * {@code package.json} for web tooling; Maven before Gradle for mixed builds.
 */
@Service
public class PlatformClassifier {

    private static final Logger log = LoggerFactory.getLogger(PlatformClassifier.class);

    static final List<MarkerRule> DEFAULT_RULES = List.of(
            MarkerRule.anyFile(Platform.FLUTTER, "pubspec.yaml"),
            MarkerRule.anyFile(Platform.NODE, "package.json"),
            MarkerRule.anyFile(Platform.MAVEN, "pom.xml"),
            MarkerRule.anyFile(Platform.GRADLE, "build.gradle", "build.gradle.kts"),
            MarkerRule.anyFile(Platform.PYTHON, "pyproject.toml", "requirements.txt", "setup.py"),
            MarkerRule.anyFile(Platform.GO, "go.mod"),
            MarkerRule.anyFile(Platform.RUST, "Cargo.toml")
    );

    private final List<MarkerRule> rules;

    public PlatformClassifier() {
        this(DEFAULT_RULES);
    }

    PlatformClassifier(List<MarkerRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Classifies the directory.
     *
     * @param dir candidate project directory
     * @return the platform of the first matching rule, or empty if no marker matches
     */
    public Optional<Platform> classify(Path dir) {
        for (MarkerRule rule : rules) {
            if (rule.matches(dir)) {
                log.debug("{} classified as {} (marker {})", dir, rule.platform(), rule.description());
                return Optional.of(rule.platform());
            }
        }
        return Optional.empty();
    }

    public List<MarkerRule> rules() {
        return rules;
    }
}
