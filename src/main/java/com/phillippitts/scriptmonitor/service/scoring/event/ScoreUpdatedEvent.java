package com.phillippitts.scriptmonitor.service.scoring.event;

import com.phillippitts.scriptmonitor.domain.AlignmentReport;

import java.time.Instant;

/**
 * Emitted after every scoring pass.
 *
 * @param report      classified tokens and partial metrics; empty in passthrough mode
 * @param hypothesis  transcript the report was computed from
 * @param passthrough true when no reference is loaded and the transcript is shown as-is
 * @param timestamp   when the pass finished
 */
public record ScoreUpdatedEvent(
        AlignmentReport report,
        String hypothesis,
        boolean passthrough,
        Instant timestamp
) {}
