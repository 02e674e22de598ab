package com.phillippitts.scriptmonitor.service.transport;

import com.phillippitts.scriptmonitor.exception.FrameDecodingException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Little-endian, length-prefixed framing shared by the monitor server and the subtitle client.
 *
 * <pre>
 * request:  checkcode:int32 | requestCode:int32 | size:int32 | payload[size] (UTF-8)
 * response: checkcode:int32 | requestCode:int32 | status:uint8
 * </pre>
 *
 * <p>Thread-safe: all methods are static and stateless.
 */
public final class FrameCodec {

    public static final int HEADER_BYTES = 12;
    public static final int RESPONSE_BYTES = 9;
    public static final int STATUS_OK = 0;

    private FrameCodec() {
        // Utility class - prevent instantiation
    }

    /**
     * Reads one request frame.
     *
     * @param in       source stream
     * @param maxBytes largest accepted payload size
     * @return the frame, or empty if the stream ended cleanly before a new header
     * @throws FrameDecodingException if the size is negative or above {@code maxBytes}, or the
     *                                stream ends inside a frame
     * @throws IOException            on socket read failure
     */
    public static Optional<Frame> readFrame(InputStream in, int maxBytes) throws IOException {
        byte[] header = new byte[HEADER_BYTES];
        int first = readAtLeastOne(in, header);
        if (first < 0) {
            return Optional.empty();
        }
        readFully(in, header, first, HEADER_BYTES - first);

        ByteBuffer buf = ByteBuffer.wrap(header).order(ByteOrder.LITTLE_ENDIAN);
        int checkcode = buf.getInt();
        int requestCode = buf.getInt();
        int size = buf.getInt();
        if (size < 0) {
            throw new FrameDecodingException("Negative payload size", size);
        }
        if (size > maxBytes) {
            throw new FrameDecodingException("Payload exceeds " + maxBytes + " bytes", size);
        }

        byte[] payload = new byte[size];
        readFully(in, payload, 0, size);
        return Optional.of(new Frame(checkcode, requestCode, new String(payload, StandardCharsets.UTF_8)));
    }

    /**
     * Encodes a request frame carrying {@code text} as UTF-8.
     */
    public static byte[] encodeRequest(int checkcode, int requestCode, String text) {
        byte[] payload = (text == null ? "" : text).getBytes(StandardCharsets.UTF_8);
        return ByteBuffer.allocate(HEADER_BYTES + payload.length)
                .order(ByteOrder.LITTLE_ENDIAN)
                .putInt(checkcode)
                .putInt(requestCode)
                .putInt(payload.length)
                .put(payload)
                .array();
    }

    public static void writeResponse(OutputStream out, FrameResponse response) throws IOException {
        byte[] bytes = ByteBuffer.allocate(RESPONSE_BYTES)
                .order(ByteOrder.LITTLE_ENDIAN)
                .putInt(response.checkcode())
                .putInt(response.requestCode())
                .put((byte) response.status())
                .array();
        out.write(bytes);
        out.flush();
    }

    /**
     * Reads one response.
     *
     * @throws FrameDecodingException if the stream ends before all response bytes arrive
     */
    public static FrameResponse readResponse(InputStream in) throws IOException {
        byte[] bytes = new byte[RESPONSE_BYTES];
        readFully(in, bytes, 0, RESPONSE_BYTES);
        ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        int checkcode = buf.getInt();
        int requestCode = buf.getInt();
        int status = Byte.toUnsignedInt(buf.get());
        return new FrameResponse(checkcode, requestCode, status);
    }

    // Returns bytes read, or -1 on EOF before any byte
    private static int readAtLeastOne(InputStream in, byte[] target) throws IOException {
        int n;
        do {
            n = in.read(target, 0, target.length);
        } while (n == 0);
        return n;
    }

    private static void readFully(InputStream in, byte[] target, int offset, int length) throws IOException {
        int pos = offset;
        int end = offset + length;
        while (pos < end) {
            int n = in.read(target, pos, end - pos);
            if (n < 0) {
                throw new FrameDecodingException("Stream closed mid-frame after " + pos + " of " + end + " bytes");
            }
            pos += n;
        }
    }
}
