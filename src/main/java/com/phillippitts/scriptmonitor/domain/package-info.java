/**
 * Immutable value types produced by the alignment engine.
 *
 * <p>Every type here is created fresh on each scoring call; none of them carries state between
 * calls. Key types:
 * <ul>
 *   <li>{@link com.phillippitts.scriptmonitor.domain.CharacterState} - per-character aligner output</li>
 *   <li>{@link com.phillippitts.scriptmonitor.domain.TokenSpan} - token boundaries in the normalized script</li>
 *   <li>{@link com.phillippitts.scriptmonitor.domain.AlignedToken} - per-token verdict</li>
 *   <li>{@link com.phillippitts.scriptmonitor.domain.PartialMetrics} - WER/CER over the processed prefix</li>
 *   <li>{@link com.phillippitts.scriptmonitor.domain.AlignmentReport} - tokens plus metrics</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.scriptmonitor.domain;
