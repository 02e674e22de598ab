package com.phillippitts.scriptmonitor.exception;

/**
 * Thrown by the subtitle client when a fragment could not be delivered or acknowledged.
 * Never escapes the forwarder; scoring does not depend on the subtitle sink.
 */
public class SubtitleForwardException extends ScriptMonitorException {

    private final String endpoint;

    public SubtitleForwardException(String message, String endpoint) {
        super(message + " (endpoint: " + endpoint + ")");
        this.endpoint = endpoint;
    }

    public SubtitleForwardException(String message, String endpoint, Throwable cause) {
        super(message + " (endpoint: " + endpoint + ")", cause);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
