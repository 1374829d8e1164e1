package com.redhat.ci.steps.build;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.jboss.logging.Logger;

/**
 * Archives the logs of successful builds as job artifacts.
 */
public class BuildLogArtifacts {

    private static final Logger log = Logger.getLogger(BuildLogArtifacts.class);

    static final String BUILD_LOGS_DIR = "build-logs";

    private final BuildClient client;
    private final Optional<Path> artifactDir;

    public BuildLogArtifacts(BuildClient client, Optional<Path> artifactDir) {
        this.client = client;
        this.artifactDir = artifactDir;
    }

    /**
     * Writes the log of the build to {@code build-logs/<name>.log} under the artifact directory, if one is
     * configured.
     *
     * @return the written file
     */
    public Optional<Path> gatherSuccessfulBuildLog(String namespace, String name) throws IOException {
        if (artifactDir.isEmpty()) {
            return Optional.empty();
        }
        String content = client.getBuildLog(namespace, name);
        Path dir = artifactDir.get().resolve(BUILD_LOGS_DIR);
        Files.createDirectories(dir);
        Path file = dir.resolve(name + ".log");
        Files.writeString(file, content == null ? "" : content);
        log.debugf("Wrote log of build %s to %s", name, file);
        return Optional.of(file);
    }
}
