package com.phillippitts.scriptmonitor.exception;

/**
 * Base exception for all scriptMonitor application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class ScriptMonitorException extends RuntimeException {

    public ScriptMonitorException(String message) {
        super(message);
    }

    public ScriptMonitorException(String message, Throwable cause) {
        super(message, cause);
    }
}
