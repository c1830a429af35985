package com.testall.core.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Enumerates candidate project directories one level below each root location.
 * <p>
 * Roots are visited in the given order and children are sorted by name, so the
 * result is stable for an unchanged tree. Overlapping roots yield each directory
 * once, at its first position. Missing roots, unreadable, hidden and placeholder
 * directories are skipped without error.
 */
@Service
public class ProjectDiscoverer {

    private static final Logger log = LoggerFactory.getLogger(ProjectDiscoverer.class);

    /**
     * @param baseDir directory the roots are resolved against
     * @param roots   root locations relative to {@code baseDir}, in priority order
     * @return distinct candidate directories, possibly empty
     */
    public List<Path> discover(Path baseDir, List<String> roots) {
        var candidates = new ArrayList<Path>();
        Set<Path> seen = new HashSet<>();
        for (String root : roots) {
            Path rootDir = baseDir.resolve(root).normalize();
            if (!Files.isDirectory(rootDir)) {
                log.debug("Root {} does not exist, skipping", rootDir);
                continue;
            }
            for (Path child : childrenOf(rootDir)) {
                if (seen.add(child.toAbsolutePath().normalize())) {
                    candidates.add(child);
                } else {
                    log.debug("Directory {} already discovered through another root", child);
                }
            }
        }
        log.debug("Discovered {} candidate directories under {}", candidates.size(), baseDir);
        return candidates;
    }

    private List<Path> childrenOf(Path rootDir) {
        var children = new ArrayList<Path>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(rootDir, Files::isDirectory)) {
            for (Path child : stream) {
                if (isPlausibleProject(child)) {
                    children.add(child);
                }
            }
        } catch (IOException | SecurityException e) {
            log.debug("Root {} is not readable: {}", rootDir, e.getMessage());
            return List.of();
        }
        children.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return children;
    }

    /**
     * A directory is a plausible project when it is readable, not hidden, and
     * contains at least one non-hidden entry ({@code .gitkeep}-only dirs are placeholders).
     */
    boolean isPlausibleProject(Path dir) {
        if (dir.getFileName().toString().startsWith(".")) {
            return false;
        }
        if (!Files.isReadable(dir)) {
            log.debug("Directory {} is not readable, skipping", dir);
            return false;
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (Path entry : entries) {
                if (!entry.getFileName().toString().startsWith(".")) {
                    return true;
                }
            }
            log.debug("Directory {} is an empty placeholder, skipping", dir);
            return false;
        } catch (IOException | SecurityException e) {
            log.debug("Directory {} is not readable: {}", dir, e.getMessage());
            return false;
        }
    }
}
