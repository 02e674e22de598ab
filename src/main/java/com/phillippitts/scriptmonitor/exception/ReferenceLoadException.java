package com.phillippitts.scriptmonitor.exception;

/**
 * Thrown when a reference script cannot be read.
 */
public class ReferenceLoadException extends ScriptMonitorException {

    private final String path;

    public ReferenceLoadException(String message, String path) {
        super(message + ": " + path);
        this.path = path;
    }

    public ReferenceLoadException(String message, String path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
