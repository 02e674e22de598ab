package com.phillippitts.scriptmonitor.service.subtitle;

import com.phillippitts.scriptmonitor.service.transport.Frame;
import com.phillippitts.scriptmonitor.service.transport.FrameCodec;
import com.phillippitts.scriptmonitor.service.transport.FrameResponse;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Minimal subtitle display server: acknowledges every frame with a configurable checkcode and
 * status, and records received payloads.
 */
class FakeSubtitleServer implements AutoCloseable {

    final List<Frame> received = new CopyOnWriteArrayList<>();
    final AtomicInteger connections = new AtomicInteger();

    private final ServerSocket serverSocket;
    private final Thread acceptThread;
    private volatile int responseCheckcode;
    private volatile int status;

    FakeSubtitleServer(int responseCheckcode) throws IOException {
        this.responseCheckcode = responseCheckcode;
        this.serverSocket = new ServerSocket(0, 5, InetAddress.getLoopbackAddress());
        this.acceptThread = new Thread(this::acceptLoop, "fake-subtitle");
        this.acceptThread.setDaemon(true);
        this.acceptThread.start();
    }

    int port() {
        return serverSocket.getLocalPort();
    }

    void respondWith(int checkcode, int status) {
        this.responseCheckcode = checkcode;
        this.status = status;
    }

    private void acceptLoop() {
        while (!serverSocket.isClosed()) {
            try {
                Socket client = serverSocket.accept();
                connections.incrementAndGet();
                Thread t = new Thread(() -> serve(client));
                t.setDaemon(true);
                t.start();
            } catch (IOException e) {
                return;
            }
        }
    }

    private void serve(Socket client) {
        try (Socket s = client) {
            while (true) {
                Optional<Frame> frame = FrameCodec.readFrame(s.getInputStream(), 1 << 20);
                if (frame.isEmpty()) {
                    return;
                }
                received.add(frame.get());
                FrameCodec.writeResponse(s.getOutputStream(),
                        new FrameResponse(responseCheckcode, frame.get().requestCode(), status));
            }
        } catch (IOException | RuntimeException e) {
            // client went away
        }
    }

    @Override
    public void close() throws IOException {
        serverSocket.close();
    }
}
