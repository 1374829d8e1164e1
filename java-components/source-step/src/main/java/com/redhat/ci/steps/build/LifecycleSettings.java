package com.redhat.ci.steps.build;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.eclipse.microprofile.config.Config;

/**
 * The tunables of the build lifecycle: how often to poll, how long to wait for a deleted build to go away,
 * which failures count as infrastructure failures and where to archive build logs.
 */
public class LifecycleSettings {

    public static final String POLL_INTERVAL = "source-step.poll-interval";
    public static final String DELETION_INITIAL_DELAY = "source-step.deletion.initial-delay";
    public static final String DELETION_FACTOR = "source-step.deletion.factor";
    public static final String DELETION_STEPS = "source-step.deletion.steps";
    public static final String INFRA_REASONS = "source-step.infra-reasons";
    public static final String INFRA_LOG_HINTS = "source-step.infra-log-hints";
    public static final String ARTIFACT_DIR = "artifact-dir";

    static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(5);

    public static Builder builder() {
        return new LifecycleSettings().new Builder();
    }

    public static LifecycleSettings defaults() {
        return builder().build();
    }

    /**
     * Reads the settings from MicroProfile Config, keeping the default of every property that is not set.
     */
    public static LifecycleSettings fromConfig(Config config) {
        Builder builder = builder();
        config.getOptionalValue(POLL_INTERVAL, Duration.class).ifPresent(builder::setPollInterval);
        ExponentialBackoff defaults = ExponentialBackoff.DEFAULT;
        builder.setDeletionBackoff(new ExponentialBackoff(
                config.getOptionalValue(DELETION_INITIAL_DELAY, Duration.class).orElse(defaults.initialDelay()),
                config.getOptionalValue(DELETION_FACTOR, Double.class).orElse(defaults.factor()),
                config.getOptionalValue(DELETION_STEPS, Integer.class).orElse(defaults.steps())));
        config.getOptionalValues(INFRA_REASONS, String.class).ifPresent(l -> builder.setInfraReasons(new HashSet<>(l)));
        config.getOptionalValues(INFRA_LOG_HINTS, String.class).ifPresent(builder::setInfraLogHints);
        config.getOptionalValue(ARTIFACT_DIR, String.class).map(Path::of).ifPresent(builder::setArtifactDir);
        return builder.build();
    }

    public class Builder {

        private boolean built;

        private Builder() {
        }

        private void ensureNotBuilt() {
            if (built) {
                throw new IllegalStateException("This builder instance has already been built");
            }
        }

        public LifecycleSettings build() {
            built = true;
            return LifecycleSettings.this;
        }

        /**
         * How long to wait between two reads of a running build.
         *
         * @param pollInterval a positive duration
         * @return this builder instance
         */
        public Builder setPollInterval(Duration pollInterval) {
            ensureNotBuilt();
            if (pollInterval.isNegative() || pollInterval.isZero()) {
                throw new IllegalArgumentException("Poll interval must be positive, got " + pollInterval);
            }
            LifecycleSettings.this.pollInterval = pollInterval;
            return this;
        }

        public Builder setDeletionBackoff(ExponentialBackoff deletionBackoff) {
            ensureNotBuilt();
            LifecycleSettings.this.deletionBackoff = deletionBackoff;
            return this;
        }

        public Builder setInfraReasons(Set<String> infraReasons) {
            ensureNotBuilt();
            if (infraReasons != null && !infraReasons.isEmpty()) {
                LifecycleSettings.this.infraReasons = Set.copyOf(infraReasons);
            }
            return this;
        }

        public Builder setInfraLogHints(List<String> infraLogHints) {
            ensureNotBuilt();
            if (infraLogHints != null && !infraLogHints.isEmpty()) {
                LifecycleSettings.this.infraLogHints = List.copyOf(infraLogHints);
            }
            return this;
        }

        /**
         * The directory that logs of successful builds are archived under. Nothing is archived if unset.
         *
         * @param artifactDir the artifact directory
         * @return this builder instance
         */
        public Builder setArtifactDir(Path artifactDir) {
            ensureNotBuilt();
            LifecycleSettings.this.artifactDir = artifactDir;
            return this;
        }
    }

    private Duration pollInterval = DEFAULT_POLL_INTERVAL;
    private ExponentialBackoff deletionBackoff = ExponentialBackoff.DEFAULT;
    private Set<String> infraReasons = InfraFailureClassifier.DEFAULT_REASONS;
    private List<String> infraLogHints = InfraFailureClassifier.DEFAULT_LOG_HINTS;
    private Path artifactDir;

    private LifecycleSettings() {
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public ExponentialBackoff getDeletionBackoff() {
        return deletionBackoff;
    }

    public Set<String> getInfraReasons() {
        return infraReasons;
    }

    public List<String> getInfraLogHints() {
        return infraLogHints;
    }

    public Optional<Path> getArtifactDir() {
        return Optional.ofNullable(artifactDir);
    }

    public InfraFailureClassifier classifier() {
        return new InfraFailureClassifier(infraReasons, infraLogHints);
    }
}
