package com.phillippitts.scriptmonitor.service.rawout;

import com.phillippitts.scriptmonitor.config.properties.RawOutProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Appends received fragments to a plain UTF-8 transcript file, one sentence per line.
 *
 * <p>A fragment is split after each {@code ?}, {@code !} or {@code .}; every terminated sentence
 * is followed by a newline, an unterminated tail by a single space so the next fragment continues
 * the same line.
 */
@Component
public class RawTranscriptWriter {

    private static final Logger LOG = LogManager.getLogger(RawTranscriptWriter.class);

    private final RawOutProperties props;
    private final ReentrantLock lock = new ReentrantLock();

    public RawTranscriptWriter(RawOutProperties props) {
        this.props = props;
    }

    public boolean isEnabled() {
        return props.isEnabled();
    }

    /**
     * Appends the fragment if raw output is enabled. Blank fragments are skipped.
     *
     * @throws UncheckedIOException if the file cannot be written
     */
    public void append(String fragment) {
        if (!props.isEnabled() || fragment == null || fragment.isBlank()) {
            return;
        }
        String out = layout(fragment.strip());
        Path file = Path.of(props.getPath());
        lock.lock();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, out, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append raw transcript to " + file, e);
        } finally {
            lock.unlock();
        }
        LOG.trace("Appended {} chars to {}", out.length(), file);
    }

    static String layout(String fragment) {
        StringBuilder sb = new StringBuilder(fragment.length() + 4);
        int chunkStart = 0;
        for (int i = 0; i < fragment.length(); i++) {
            char c = fragment.charAt(i);
            if (c == '?' || c == '!' || c == '.') {
                sb.append(fragment, chunkStart, i + 1).append('\n');
                chunkStart = i + 1;
            }
        }
        if (chunkStart < fragment.length()) {
            sb.append(fragment, chunkStart, fragment.length()).append(' ');
        }
        return sb.toString();
    }
}
