package com.phillippitts.scriptmonitor.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for relaying received fragments to a downstream subtitle inserter.
 */
@Validated
@ConfigurationProperties(prefix = "monitor.subtitle")
public class SubtitleProperties {

    /** Default checkcode the subtitle inserter answers with (0x01350126). */
    public static final int DEFAULT_RESPONSE_CHECKCODE = 0x01350126;

    /** Forwarding is off unless explicitly enabled. */
    private final boolean enabled;

    @NotBlank
    private final String host;

    @Min(1)
    @Max(65535)
    private final int port;

    /** Checkcode written into every request header. */
    private final int checkcode;

    /** Checkcode expected in the inserter's acknowledgement. */
    private final int expectedResponseCheckcode;

    /** Connect and read timeout, in milliseconds. */
    @Positive
    private final int timeoutMs;

    @ConstructorBinding
    public SubtitleProperties(Boolean enabled, String host, Integer port, Integer checkcode,
                              Integer expectedResponseCheckcode, Integer timeoutMs) {
        this.enabled = enabled == null ? false : enabled;
        this.host = host == null || host.isBlank() ? "127.0.0.1" : host;
        this.port = port == null ? 26071 : port;
        this.checkcode = checkcode == null ? 20250918 : checkcode;
        this.expectedResponseCheckcode = expectedResponseCheckcode == null
                ? DEFAULT_RESPONSE_CHECKCODE : expectedResponseCheckcode;
        this.timeoutMs = timeoutMs == null ? 5000 : timeoutMs;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public int getCheckcode() {
        return checkcode;
    }

    public int getExpectedResponseCheckcode() {
        return expectedResponseCheckcode;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    public String endpoint() {
        return host + ":" + port;
    }
}
