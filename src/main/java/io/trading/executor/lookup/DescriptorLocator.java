package io.trading.executor.lookup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Ordered list of directories searched for descriptor files.
 *
 * Default order:
 * 1. explicit override ({@code EXECUTOR_CONFIG_DIR} or configured value)
 * 2. project-local {@code ./config}
 * 3. user-home {@code ~/.strategy-executor}
 *
 * Within a location, descriptors live at {@code <dir>/<kind directory>/<venue>.json}.
 */
public class DescriptorLocator {

    private static final Logger LOGGER = LoggerFactory.getLogger(DescriptorLocator.class);

    public static final String OVERRIDE_ENV = "EXECUTOR_CONFIG_DIR";
    public static final String PROJECT_DIR = "config";
    public static final String USER_DIR = ".strategy-executor";

    private final List<Path> locations;

    public DescriptorLocator(List<Path> locations) {
        if (locations == null || locations.isEmpty()) {
            throw new IllegalArgumentException("locations cannot be null or empty");
        }
        this.locations = List.copyOf(locations);
    }

    /**
     * Builds the standard three-tier search path.
     *
     * @param overrideDir Explicit override directory, may be null or empty
     */
    public static DescriptorLocator standard(String overrideDir) {
        List<Path> locations = new ArrayList<>(3);
        if (overrideDir != null && !overrideDir.isBlank()) {
            locations.add(Paths.get(overrideDir));
        }
        locations.add(Paths.get(PROJECT_DIR).toAbsolutePath());
        locations.add(Paths.get(System.getProperty("user.home"), USER_DIR));
        LOGGER.info("Descriptor search path: {}", locations);
        return new DescriptorLocator(locations);
    }

    /**
     * Standard search path with the override taken from the environment.
     */
    public static DescriptorLocator fromEnv() {
        return standard(System.getenv(OVERRIDE_ENV));
    }

    /**
     * Candidate files for a venue, highest priority first. Files may not exist.
     */
    public List<Path> candidates(DescriptorKind kind, String venue) {
        String fileName = venue.toLowerCase(Locale.ROOT) + ".json";
        List<Path> files = new ArrayList<>(locations.size());
        for (Path location : locations) {
            files.add(location.resolve(kind.getDirectory()).resolve(fileName));
        }
        return files;
    }

    public List<Path> getLocations() {
        return locations;
    }
}
