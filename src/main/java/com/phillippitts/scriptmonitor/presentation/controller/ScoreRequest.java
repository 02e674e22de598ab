package com.phillippitts.scriptmonitor.presentation.controller;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

/**
 * Body of an ad-hoc scoring request.
 *
 * @param reference  reference script
 * @param hypothesis transcript to score
 * @param threshold  optional similarity threshold; the configured one when absent
 */
record ScoreRequest(
        @NotNull String reference,
        @NotNull String hypothesis,
        @DecimalMin("0.0") @DecimalMax("1.0") Double threshold
) {}
