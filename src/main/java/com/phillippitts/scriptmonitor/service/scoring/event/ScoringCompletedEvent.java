package com.phillippitts.scriptmonitor.service.scoring.event;

import com.phillippitts.scriptmonitor.domain.AlignmentReport;

import java.time.Instant;

/**
 * Emitted once per session, when the transcript has reached every reference token.
 * Scoring stops until the session is reset or a new script is loaded.
 */
public record ScoringCompletedEvent(AlignmentReport finalReport, Instant timestamp) {}
