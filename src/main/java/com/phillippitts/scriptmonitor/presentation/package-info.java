/**
 * Presentation layer (REST API, token rendering and exception handling).
 *
 * <p>Presentation depends on service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers under {@code /api/monitor}</li>
 *   <li>{@code presentation.render} - ANSI and plain rendering of classified tokens</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * @see com.phillippitts.scriptmonitor.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.scriptmonitor.presentation;
