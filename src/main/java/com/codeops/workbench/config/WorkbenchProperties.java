package com.codeops.workbench.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Externalized settings bound from {@code codeops.workbench.*}.
 */
@ConfigurationProperties(prefix = "codeops.workbench")
@Getter
@Setter
public class WorkbenchProperties {

    /** Directory holding the collections index and collection files. */
    private Path dataDir = Path.of(System.getProperty("user.home"), ".codeops-workbench");

    /** Recompute and compare the whole request index after every mutation. */
    private boolean validateIndex = false;

    /** Minimum time between two opportunistic saves of the same collection. */
    private Duration saveThrottle = Duration.ofSeconds(1);

    /** Milliseconds between two scheduled flush ticks. */
    private long flushInterval = 500;

    /** Seed a sample collection on startup under the dev profile. */
    private boolean seedSampleData = true;
}
