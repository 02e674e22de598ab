package com.phillippitts.scriptmonitor.service.health;

import com.phillippitts.scriptmonitor.service.subtitle.SubtitleForwarder;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the subtitle display server connection.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: forwarding enabled and connected, or forwarding disabled</li>
 *   <li>DOWN: forwarding enabled but no open connection</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class SubtitleSinkHealthIndicator implements HealthIndicator {

    private final SubtitleForwarder forwarder;

    public SubtitleSinkHealthIndicator(SubtitleForwarder forwarder) {
        this.forwarder = forwarder;
    }

    @Override
    public Health health() {
        if (!forwarder.isEnabled()) {
            return Health.up().withDetail("subtitle", "disabled").build();
        }
        Health.Builder builder = forwarder.isConnected() ? Health.up() : Health.down();
        return builder
                .withDetail("subtitle", forwarder.isConnected() ? "connected" : "disconnected")
                .withDetail("endpoint", forwarder.endpoint())
                .build();
    }
}
