package com.survey.boothsampling.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * An assembly or parliamentary constituency as listed from the region layer
 */
@Value
@Builder
@AllArgsConstructor
public class Region {
    String code;
    String name;
}
