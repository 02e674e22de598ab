package com.phillippitts.scriptmonitor.service.transport;

import com.phillippitts.scriptmonitor.config.properties.MonitorServerProperties;
import com.phillippitts.scriptmonitor.exception.FrameDecodingException;
import com.phillippitts.scriptmonitor.service.hypothesis.HypothesisLog;
import com.phillippitts.scriptmonitor.service.metrics.MonitorMetrics;
import com.phillippitts.scriptmonitor.service.rawout.RawTranscriptWriter;
import com.phillippitts.scriptmonitor.service.subtitle.SubtitleForwarder;
import com.phillippitts.scriptmonitor.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * TCP listener that receives transcript fragments from the STT producer.
 *
 * <p>Each accepted client is served on the connection executor until it disconnects or sends
 * an undecodable frame. Per frame: decode, extract the fragment, append it to the
 * {@link HypothesisLog}, copy it to the raw transcript, relay the payload to the subtitle server,
 * then acknowledge with status 0. Frames without a usable fragment are still acknowledged.
 */
@Service
public class MonitorServer implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(MonitorServer.class);
    private static final int BACKLOG = 5;

    private final MonitorServerProperties props;
    private final HypothesisLog hypothesisLog;
    private final RawTranscriptWriter rawWriter;
    private final SubtitleForwarder forwarder;
    private final MonitorMetrics metrics;
    private final TaskExecutor connectionExecutor;

    private final Set<Socket> clients = ConcurrentHashMap.newKeySet();
    private final AtomicLong connectionSeq = new AtomicLong();

    private volatile boolean running;
    private volatile ServerSocket serverSocket;
    private Thread acceptThread;

    public MonitorServer(MonitorServerProperties props,
                         HypothesisLog hypothesisLog,
                         RawTranscriptWriter rawWriter,
                         SubtitleForwarder forwarder,
                         MonitorMetrics metrics,
                         @Qualifier("connectionExecutor") TaskExecutor connectionExecutor) {
        this.props = props;
        this.hypothesisLog = hypothesisLog;
        this.rawWriter = rawWriter;
        this.forwarder = forwarder;
        this.metrics = metrics;
        this.connectionExecutor = connectionExecutor;
    }

    /**
     * Binds the listening socket and starts the accept loop.
     *
     * @throws UncheckedIOException if the address cannot be bound
     */
    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        if (!props.isEnabled()) {
            LOG.info("Monitor server disabled (monitor.server.enabled=false)");
            running = true;
            return;
        }
        try {
            ServerSocket ss = new ServerSocket();
            ss.setReuseAddress(true);
            ss.bind(new InetSocketAddress(InetAddress.getByName(props.getHost()), props.getPort()), BACKLOG);
            ss.setSoTimeout(props.getAcceptTimeoutMs());
            serverSocket = ss;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to bind monitor server to "
                    + props.getHost() + ":" + props.getPort(), e);
        }
        running = true;
        acceptThread = new Thread(this::acceptLoop, "monitor-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
        LOG.info("Monitor server listening on {}:{}", props.getHost(), getLocalPort());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        closeQuietly(serverSocket);
        for (Socket client : clients) {
            closeQuietly(client);
        }
        clients.clear();
        if (acceptThread != null) {
            try {
                acceptThread.join(props.getAcceptTimeoutMs() * 2L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            acceptThread = null;
        }
        serverSocket = null;
        LOG.info("Monitor server stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * @return the bound port, or -1 when the server is not listening
     */
    public int getLocalPort() {
        ServerSocket ss = serverSocket;
        return ss == null ? -1 : ss.getLocalPort();
    }

    public int getActiveConnections() {
        return clients.size();
    }

    private void acceptLoop() {
        while (running) {
            try {
                Socket client = serverSocket.accept();
                clients.add(client);
                connectionExecutor.execute(() -> serve(client));
            } catch (SocketTimeoutException e) {
                // periodic wake-up to observe stop()
            } catch (IOException e) {
                if (running) {
                    LOG.error("Accept failed; monitor server stops listening", e);
                    running = false;
                }
            }
        }
    }

    void serve(Socket client) {
        String connectionId = Long.toString(connectionSeq.incrementAndGet());
        ThreadContext.put("connectionId", connectionId);
        ThreadContext.put("remote", String.valueOf(client.getRemoteSocketAddress()));
        LOG.info("Client connected");
        try (Socket s = client) {
            InputStream in = s.getInputStream();
            OutputStream out = s.getOutputStream();
            while (running) {
                Optional<Frame> frame = FrameCodec.readFrame(in, props.getMaxFrameBytes());
                if (frame.isEmpty()) {
                    break;
                }
                handleFrame(frame.get());
                FrameCodec.writeResponse(out, new FrameResponse(
                        props.getResponseCheckcode(), frame.get().requestCode(), FrameCodec.STATUS_OK));
            }
        } catch (FrameDecodingException e) {
            metrics.incrementFramesRejected("decode");
            LOG.warn("Dropping client after undecodable frame: {}", e.getMessage());
        } catch (SocketException e) {
            if (running) {
                metrics.incrementFramesRejected("io");
                LOG.warn("Client socket error: {}", e.getMessage());
            }
        } catch (IOException e) {
            metrics.incrementFramesRejected("io");
            LOG.warn("Client I/O error: {}", e.getMessage());
        } finally {
            clients.remove(client);
            LOG.info("Client disconnected");
            ThreadContext.remove("connectionId");
            ThreadContext.remove("remote");
        }
    }

    void handleFrame(Frame frame) {
        Optional<String> fragment = FragmentParser.parse(frame.text());
        metrics.incrementFramesReceived(fragment.isPresent());
        if (fragment.isEmpty()) {
            return;
        }
        String text = fragment.get();
        LOG.debug("Received fragment: {}", LogSanitizer.preview(text, 60));
        hypothesisLog.append(text);
        try {
            rawWriter.append(text);
        } catch (UncheckedIOException e) {
            LOG.warn("Raw transcript write failed: {}", e.getMessage());
        }
        forwarder.forward(frame.text());
    }

    private static void closeQuietly(Closeable c) {
        if (c == null) {
            return;
        }
        try {
            c.close();
        } catch (IOException e) {
            LOG.debug("Error closing socket: {}", e.getMessage());
        }
    }
}
