/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Endpoints under {@code /api/monitor}:
 * <ul>
 *   <li>{@code GET /score} - latest live report</li>
 *   <li>{@code POST /score} - stateless scoring of a reference/hypothesis pair</li>
 *   <li>{@code PUT /reference} - load a plain-text script</li>
 *   <li>{@code POST /reset} - clear the live session</li>
 *   <li>{@code POST /subtitle/reconnect} - reconnect to the subtitle server</li>
 *   <li>{@code GET /status} - session and connection overview</li>
 * </ul>
 *
 * @see com.phillippitts.scriptmonitor.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.scriptmonitor.presentation.controller;
