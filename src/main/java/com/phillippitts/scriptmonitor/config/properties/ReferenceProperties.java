package com.phillippitts.scriptmonitor.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Reference script loaded at startup. Leave {@code path} empty to start without a script
 * and upload one through the REST API.
 */
@ConfigurationProperties(prefix = "monitor.reference")
public class ReferenceProperties {

    private String path;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }
}
