package com.ospicorp.laiforecast.normalization;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDate;

/** A class left out of one date's normalized output. Recorded, never thrown. */
public record UndefinedFactorWarning(
    LocalDate date,
    @JsonProperty("vegetation_class") int classId,
    String reason
) {}
