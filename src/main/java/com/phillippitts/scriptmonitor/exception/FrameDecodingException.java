package com.phillippitts.scriptmonitor.exception;

/**
 * Thrown when a length-prefixed frame cannot be read from a socket stream
 * (negative or oversized length, or the peer closed mid-frame).
 */
public class FrameDecodingException extends ScriptMonitorException {

    private final int declaredSize;

    public FrameDecodingException(String message) {
        super(message);
        this.declaredSize = -1;
    }

    public FrameDecodingException(String message, int declaredSize) {
        super(message + " (declared size: " + declaredSize + ")");
        this.declaredSize = declaredSize;
    }

    public int getDeclaredSize() {
        return declaredSize;
    }
}
