package com.phillippitts.scriptmonitor.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the TCP listener that receives transcript fragments.
 */
@Validated
@ConfigurationProperties(prefix = "monitor.server")
public class MonitorServerProperties {

    private final boolean enabled;

    @NotBlank
    private final String host;

    /** 0 binds an ephemeral port (tests). */
    @Min(0)
    @Max(65535)
    private final int port;

    /** Checkcode written into every acknowledgement header. */
    private final int responseCheckcode;

    /** Largest accepted payload, in bytes. */
    @Positive
    private final int maxFrameBytes;

    /** Accept loop wake-up interval, so stop() is noticed promptly. */
    @Positive
    private final int acceptTimeoutMs;

    @ConstructorBinding
    public MonitorServerProperties(Boolean enabled, String host, Integer port, Integer responseCheckcode,
                                   Integer maxFrameBytes, Integer acceptTimeoutMs) {
        this.enabled = enabled == null ? true : enabled;
        this.host = host == null || host.isBlank() ? "127.0.0.1" : host;
        this.port = port == null ? 26072 : port;
        this.responseCheckcode = responseCheckcode == null ? 20250918 : responseCheckcode;
        this.maxFrameBytes = maxFrameBytes == null ? 1_048_576 : maxFrameBytes;
        this.acceptTimeoutMs = acceptTimeoutMs == null ? 1000 : acceptTimeoutMs;
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

    public int getResponseCheckcode() {
        return responseCheckcode;
    }

    public int getMaxFrameBytes() {
        return maxFrameBytes;
    }

    public int getAcceptTimeoutMs() {
        return acceptTimeoutMs;
    }
}
