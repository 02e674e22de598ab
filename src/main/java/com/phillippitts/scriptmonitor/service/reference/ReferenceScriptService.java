package com.phillippitts.scriptmonitor.service.reference;

import com.phillippitts.scriptmonitor.config.properties.ReferenceProperties;
import com.phillippitts.scriptmonitor.exception.ReferenceLoadException;
import com.phillippitts.scriptmonitor.service.reference.event.ReferenceLoadedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.regex.Pattern;

/**
 * Holds the reference script the live transcript is scored against.
 *
 * <p>Scripts are stored trimmed with whitespace runs (including line breaks) collapsed to single
 * spaces. Every successful load publishes a {@link ReferenceLoadedEvent}, which resets the
 * scoring session.
 */
@Service
public class ReferenceScriptService {

    private static final Logger LOG = LogManager.getLogger(ReferenceScriptService.class);
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    static final String TEXT_SOURCE = "text";

    private final ReferenceProperties props;
    private final ApplicationEventPublisher publisher;

    private volatile String current = "";

    public ReferenceScriptService(ReferenceProperties props, ApplicationEventPublisher publisher) {
        this.props = props;
        this.publisher = publisher;
    }

    /**
     * Loads the script named by {@code monitor.reference.path}, if any. A missing or unreadable
     * file leaves the monitor in passthrough mode.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void loadConfiguredScript() {
        String path = props.getPath();
        if (path == null || path.isBlank()) {
            LOG.info("No reference script configured; scoring stays in passthrough mode until one is loaded");
            return;
        }
        try {
            loadFromFile(Path.of(path));
        } catch (ReferenceLoadException e) {
            LOG.error("Configured reference script could not be loaded; continuing without one", e);
        }
    }

    /**
     * Reads a UTF-8 script file and makes it the current reference.
     *
     * @return the collapsed script
     * @throws ReferenceLoadException if the file is missing or unreadable
     */
    public String loadFromFile(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new ReferenceLoadException("Reference script not found", String.valueOf(file));
        }
        String raw;
        try {
            raw = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ReferenceLoadException("Failed to read reference script", file.toString(), e);
        }
        return install(raw, file.toString());
    }

    /**
     * Makes the given text the current reference.
     *
     * @return the collapsed script
     * @throws IllegalArgumentException if text is null
     */
    public String loadFromText(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Reference text must not be null");
        }
        return install(text, TEXT_SOURCE);
    }

    /**
     * @return the current script, or "" when none is loaded
     */
    public String current() {
        return current;
    }

    public boolean isLoaded() {
        return !current.isEmpty();
    }

    static String collapse(String raw) {
        return WHITESPACE_RUN.matcher(raw.strip()).replaceAll(" ");
    }

    private String install(String raw, String source) {
        String script = collapse(raw);
        current = script;
        LOG.info("Reference script loaded from {} ({} chars)", source, script.length());
        publisher.publishEvent(new ReferenceLoadedEvent(source, script.length(), Instant.now()));
        return script;
    }
}
