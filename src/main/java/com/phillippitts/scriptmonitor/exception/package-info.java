/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.scriptmonitor.exception.ScriptMonitorException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.scriptmonitor.exception.FrameDecodingException} - Thrown when a
 *       monitor client sends a frame that cannot be decoded</li>
 *   <li>{@link com.phillippitts.scriptmonitor.exception.ReferenceLoadException} - Thrown when a
 *       reference script file cannot be read</li>
 *   <li>{@link com.phillippitts.scriptmonitor.exception.SubtitleForwardException} - Thrown inside
 *       the subtitle client when delivery fails</li>
 * </ul>
 *
 * <p>The alignment engine itself never throws for string input; these exceptions belong to the
 * transport, file and forwarding layers around it.
 *
 * @see com.phillippitts.scriptmonitor.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.scriptmonitor.exception;
