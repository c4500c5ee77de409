package com.survey.boothsampling.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * A region paired with its selection result inside a batch run
 */
@Value
@Builder
@AllArgsConstructor
public class RegionOutcome {
    Region region;
    SelectionResult result;
}
