/**
 * Spring configuration: typed properties, bean wiring for the alignment engine, thread pools
 * and logging context.
 *
 * @since 1.0
 */
package com.phillippitts.scriptmonitor.config;
