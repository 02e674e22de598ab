/**
 * Alignment and partial-scoring engine.
 *
 * <p>Scores a growing speech-to-text transcript against a fixed reference script, telling
 * genuine omissions apart from script that has not been read yet.
 *
 * <p>Architecture:
 * <ul>
 *   <li>{@link com.phillippitts.scriptmonitor.service.alignment.ScriptAlignmentEngine} - entry point</li>
 *   <li>{@link com.phillippitts.scriptmonitor.service.alignment.CharacterAligner} - strategy seam,
 *       implemented by {@code SequentialAligner} and {@code OptimalAligner}</li>
 *   <li>{@link com.phillippitts.scriptmonitor.service.alignment.TokenRangeMapper} - token offsets</li>
 *   <li>{@link com.phillippitts.scriptmonitor.service.alignment.TokenClassifier} - per-token verdicts</li>
 *   <li>{@link com.phillippitts.scriptmonitor.service.alignment.MetricsCalculator} - partial WER/CER</li>
 * </ul>
 *
 * <p>Nothing in this package performs I/O or keeps per-session state.
 *
 * @since 1.0
 */
package com.phillippitts.scriptmonitor.service.alignment;
