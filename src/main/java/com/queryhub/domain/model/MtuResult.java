package com.queryhub.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Monthly tracked users for a workspace on a given day, with the billing
 * cycle (first to last day of the month) the count covers.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MtuResult {

    String workspaceId;
    long mtuCount;

    /** {@code primary}, {@code fallback_partial}, {@code fallback_complete} or {@code cache}. */
    String source;

    LocalDate trackedDate;
    LocalDate billingCycleStart;
    LocalDate billingCycleEnd;
    boolean cached;
}
