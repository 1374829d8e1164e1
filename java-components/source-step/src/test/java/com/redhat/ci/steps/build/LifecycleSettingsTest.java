package com.redhat.ci.steps.build;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.Test;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;

public class LifecycleSettingsTest {

    static Config config(Map<String, String> properties) {
        return new SmallRyeConfigBuilder()
                .addDefaultInterceptors()
                .withSources(new PropertiesConfigSource(properties, "test", 500))
                .build();
    }

    @Test
    public void testDefaults() {
        LifecycleSettings settings = LifecycleSettings.fromConfig(config(Map.of()));
        assertEquals(Duration.ofSeconds(5), settings.getPollInterval());
        assertEquals(ExponentialBackoff.DEFAULT, settings.getDeletionBackoff());
        assertEquals(InfraFailureClassifier.DEFAULT_REASONS, settings.getInfraReasons());
        assertEquals(InfraFailureClassifier.DEFAULT_LOG_HINTS, settings.getInfraLogHints());
        assertFalse(settings.getArtifactDir().isPresent());
    }

    @Test
    public void testOverrides() {
        LifecycleSettings settings = LifecycleSettings.fromConfig(config(Map.of(
                LifecycleSettings.POLL_INTERVAL, "PT0.5S",
                LifecycleSettings.DELETION_INITIAL_DELAY, "PT0.1S",
                LifecycleSettings.DELETION_FACTOR, "3",
                LifecycleSettings.DELETION_STEPS, "4",
                LifecycleSettings.INFRA_REASONS, "NodeLost,BuildPodEvicted",
                LifecycleSettings.INFRA_LOG_HINTS, "quota exceeded",
                LifecycleSettings.ARTIFACT_DIR, "/tmp/artifacts")));
        assertEquals(Duration.ofMillis(500), settings.getPollInterval());
        assertEquals(new ExponentialBackoff(Duration.ofMillis(100), 3.0, 4), settings.getDeletionBackoff());
        assertEquals(Set.of("NodeLost", "BuildPodEvicted"), settings.getInfraReasons());
        assertEquals(List.of("quota exceeded"), settings.getInfraLogHints());
        assertEquals(Path.of("/tmp/artifacts"), settings.getArtifactDir().get());
    }

    @Test
    public void testBuilderCannotBeReused() {
        var builder = LifecycleSettings.builder();
        builder.build();
        assertThrows(IllegalStateException.class, () -> builder.setPollInterval(Duration.ofSeconds(1)));
    }

    @Test
    public void testPollIntervalMustBePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> LifecycleSettings.builder().setPollInterval(Duration.ZERO));
    }
}
