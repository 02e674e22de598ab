package com.phillippitts.scriptmonitor.service.subtitle;

import com.phillippitts.scriptmonitor.exception.SubtitleForwardException;
import com.phillippitts.scriptmonitor.service.transport.FrameCodec;
import com.phillippitts.scriptmonitor.service.transport.FrameResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Persistent TCP client for the subtitle display server.
 *
 * <p>One connection is kept open across fragments. Any I/O or protocol failure closes it, and the
 * next {@link #send(String)} reconnects.
 *
 * <p>Thread-safe: all socket access is synchronized on the client.
 */
public class SubtitleClient {

    private static final Logger LOG = LogManager.getLogger(SubtitleClient.class);

    /** Request code for a subtitle push, echoed by the server. */
    public static final int REQUEST_SUBTITLE = 0x01;

    private final String host;
    private final int port;
    private final int checkcode;
    private final int expectedResponseCheckcode;
    private final int timeoutMs;

    private Socket socket;

    public SubtitleClient(String host, int port, int checkcode, int expectedResponseCheckcode, int timeoutMs) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        this.host = host;
        this.port = port;
        this.checkcode = checkcode;
        this.expectedResponseCheckcode = expectedResponseCheckcode;
        this.timeoutMs = timeoutMs;
    }

    /**
     * Opens the connection if it is not already open.
     *
     * @throws SubtitleForwardException if the server cannot be reached
     */
    public synchronized void connect() {
        if (socket != null) {
            return;
        }
        Socket s = new Socket();
        try {
            s.connect(new InetSocketAddress(host, port), timeoutMs);
            s.setSoTimeout(timeoutMs);
            s.setTcpNoDelay(true);
        } catch (IOException e) {
            closeQuietly(s);
            throw new SubtitleForwardException("Connect failed", endpoint(), e);
        }
        socket = s;
        LOG.info("Connected to subtitle server {}", endpoint());
    }

    public synchronized void disconnect() {
        if (socket == null) {
            return;
        }
        closeQuietly(socket);
        socket = null;
        LOG.info("Disconnected from subtitle server {}", endpoint());
    }

    public synchronized boolean isConnected() {
        return socket != null;
    }

    /**
     * Sends one subtitle and waits for its acknowledgement.
     *
     * @param text subtitle text or JSON payload, sent as UTF-8 after trimming
     * @return false if the trimmed text was blank and nothing was sent, true once acknowledged
     * @throws SubtitleForwardException on connect, I/O or protocol failure; the connection is closed
     */
    public synchronized boolean send(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            return false;
        }
        connect();
        try {
            OutputStream out = socket.getOutputStream();
            out.write(FrameCodec.encodeRequest(checkcode, REQUEST_SUBTITLE, trimmed));
            out.flush();
            verify(FrameCodec.readResponse(socket.getInputStream()));
        } catch (IOException | RuntimeException e) {
            disconnect();
            if (e instanceof SubtitleForwardException sfe) {
                throw sfe;
            }
            throw new SubtitleForwardException("Send failed", endpoint(), e);
        }
        LOG.debug("Subtitle acknowledged ({} bytes)", trimmed.getBytes(StandardCharsets.UTF_8).length);
        return true;
    }

    public String endpoint() {
        return host + ":" + port;
    }

    private void verify(FrameResponse response) {
        if (response.checkcode() != expectedResponseCheckcode) {
            throw new SubtitleForwardException(String.format("Invalid response checkcode 0x%08x (expected 0x%08x)",
                    response.checkcode(), expectedResponseCheckcode), endpoint());
        }
        if (response.requestCode() != REQUEST_SUBTITLE) {
            throw new SubtitleForwardException("Mismatched response code " + response.requestCode()
                    + " (expected " + REQUEST_SUBTITLE + ")", endpoint());
        }
        if (!response.isOk()) {
            throw new SubtitleForwardException("Server returned status " + response.status(), endpoint());
        }
    }

    private static void closeQuietly(Socket s) {
        try {
            s.close();
        } catch (IOException e) {
            LOG.debug("Error closing subtitle socket: {}", e.getMessage());
        }
    }
}
