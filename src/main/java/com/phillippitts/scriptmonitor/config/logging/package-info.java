/**
 * Logging context (Log4j2 ThreadContext) for REST requests.
 */
package com.phillippitts.scriptmonitor.config.logging;
