package com.phillippitts.scriptmonitor.service.subtitle;

import com.phillippitts.scriptmonitor.config.properties.SubtitleProperties;
import com.phillippitts.scriptmonitor.exception.SubtitleForwardException;
import com.phillippitts.scriptmonitor.service.metrics.MonitorMetrics;
import com.phillippitts.scriptmonitor.service.subtitle.event.SubtitleForwardFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Relays received payloads to the subtitle display server.
 *
 * <p>Forwarding never fails the caller: errors are logged, counted and published as
 * {@link SubtitleForwardFailedEvent}. When {@code monitor.subtitle.enabled=false} every call is a
 * no-op.
 */
@Service
public class SubtitleForwarder implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(SubtitleForwarder.class);

    private final SubtitleProperties props;
    private final SubtitleClient client;
    private final MonitorMetrics metrics;
    private final ApplicationEventPublisher publisher;

    private volatile boolean running;

    @Autowired
    public SubtitleForwarder(SubtitleProperties props, MonitorMetrics metrics, ApplicationEventPublisher publisher) {
        this(props, new SubtitleClient(props.getHost(), props.getPort(), props.getCheckcode(),
                props.getExpectedResponseCheckcode(), props.getTimeoutMs()), metrics, publisher);
    }

    SubtitleForwarder(SubtitleProperties props,
                      SubtitleClient client,
                      MonitorMetrics metrics,
                      ApplicationEventPublisher publisher) {
        this.props = props;
        this.client = client;
        this.metrics = metrics;
        this.publisher = publisher;
    }

    /**
     * Attempts the initial connection. Failure is not fatal; the next forward retries.
     */
    @Override
    public void start() {
        running = true;
        if (!props.isEnabled()) {
            LOG.info("Subtitle forwarding disabled");
            return;
        }
        tryConnect();
    }

    @Override
    public void stop() {
        running = false;
        client.disconnect();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Starts before the monitor server so the first relayed fragment finds the sink connected.
     */
    @Override
    public int getPhase() {
        return SmartLifecycle.DEFAULT_PHASE - 1;
    }

    /**
     * Sends one payload to the subtitle server, connecting first if needed.
     *
     * @return true if the server acknowledged the payload
     */
    public boolean forward(String payload) {
        if (!props.isEnabled()) {
            return false;
        }
        try {
            boolean sent = client.send(payload);
            if (sent) {
                metrics.incrementForwarded("ok");
            }
            return sent;
        } catch (SubtitleForwardException e) {
            metrics.incrementForwarded("failed");
            LOG.warn("Subtitle forward failed: {}", e.getMessage());
            publisher.publishEvent(new SubtitleForwardFailedEvent(e.getEndpoint(), reasonOf(e), Instant.now()));
            return false;
        }
    }

    /**
     * Drops the current connection and connects again.
     *
     * @return true if the new connection is open
     */
    public boolean reconnect() {
        if (!props.isEnabled()) {
            return false;
        }
        client.disconnect();
        return tryConnect();
    }

    public boolean isEnabled() {
        return props.isEnabled();
    }

    public boolean isConnected() {
        return client.isConnected();
    }

    public String endpoint() {
        return client.endpoint();
    }

    private boolean tryConnect() {
        try {
            client.connect();
            return true;
        } catch (SubtitleForwardException e) {
            LOG.warn("Subtitle server unavailable: {}", e.getMessage());
            publisher.publishEvent(new SubtitleForwardFailedEvent(e.getEndpoint(), "connect", Instant.now()));
            return false;
        }
    }

    private static String reasonOf(SubtitleForwardException e) {
        Throwable cause = e.getCause();
        return cause == null ? "protocol" : cause.getClass().getSimpleName();
    }
}
