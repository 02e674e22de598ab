package com.phillippitts.scriptmonitor.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the raw transcript file (every received fragment, one sentence per line).
 */
@ConfigurationProperties(prefix = "monitor.raw-out")
@Validated
public class RawOutProperties {

    /** Enable/disable writing the raw transcript. */
    private boolean enabled = false;

    /** Target file; parent directories are created on first write. */
    @NotBlank(message = "Raw transcript path must not be blank")
    private String path = "./raw_out/raw_subtitle.txt";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }
}
