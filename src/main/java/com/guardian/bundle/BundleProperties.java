package com.guardian.bundle;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "guardian.bundle")
public class BundleProperties {

    /** Where bundle archives and manifests are written. */
    private String directory = "evidence/bundles";

    /** Export periodic snapshots of newly appended records. */
    private boolean enabled = true;

    /** Delay between periodic snapshots. */
    private Duration interval = Duration.ofHours(1);

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getInterval() {
        return interval;
    }

    public void setInterval(Duration interval) {
        this.interval = interval;
    }
}
